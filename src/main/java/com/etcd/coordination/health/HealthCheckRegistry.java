package com.etcd.coordination.health;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Runs every registered check and folds the results into one status.
 * The aggregate takes the worst individual status; each check's own result is
 * kept as a detail under the check's name. A check that throws counts as DOWN.
 */
public class HealthCheckRegistry {

    private final List<HealthCheck> checks = new CopyOnWriteArrayList<>();

    public void register(HealthCheck check) {
        if (check != null) {
            checks.add(check);
        }
    }

    public HealthStatus checkAll() {
        if (checks.isEmpty()) {
            return HealthStatus.up("No health checks registered");
        }

        Map<String, Object> results = new LinkedHashMap<>();
        HealthStatus worst = HealthStatus.up();
        String worstName = null;
        for (HealthCheck check : checks) {
            HealthStatus result = run(check);
            results.put(check.getName(), Map.of(
                    "status", result.status().name(),
                    "message", result.message(),
                    "details", result.details()));
            if (result.isWorseThan(worst)) {
                worst = result;
                worstName = check.getName();
            }
        }

        String message = worstName == null ? "OK" : worstName + ": " + worst.message();
        HealthStatus aggregate = new HealthStatus(worst.status(), message, Map.of());
        for (Map.Entry<String, Object> entry : results.entrySet()) {
            aggregate = aggregate.withDetail(entry.getKey(), entry.getValue());
        }
        return aggregate;
    }

    public int size() {
        return checks.size();
    }

    private static HealthStatus run(HealthCheck check) {
        try {
            return check.check();
        } catch (RuntimeException e) {
            return HealthStatus.down(check.getName() + " check threw: " + e.getMessage());
        }
    }
}
