package com.etcd.coordination.cdi;

import com.etcd.coordination.api.CoordinationClient;
import com.etcd.coordination.lock.LockConfig;
import com.etcd.coordination.memoize.MemoizeOptions;
import com.etcd.coordination.store.EtcdConfig;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * CDI producer that wires the coordination client from MicroProfile Config properties.
 *
 * <pre>
 * coordination:
 *   etcd:
 *     endpoints: http://etcd-0:2379,http://etcd-1:2379
 *     namespace: /my-service
 *   lock:
 *     lease-timeout-seconds: 10
 *     max-wait-millis: 30000
 *   memoize:
 *     ttl-seconds: 300
 * </pre>
 *
 * <p>Inject the client directly: {@code @Inject CoordinationClient coordination;}</p>
 */
@ApplicationScoped
public class CoordinationClientProducer {

    private static final Logger log = LoggerFactory.getLogger(CoordinationClientProducer.class);

    // ── etcd ──────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "coordination.etcd.endpoints", defaultValue = "http://localhost:2379")
    String endpoints;

    @Inject
    @ConfigProperty(name = "coordination.etcd.namespace")
    Optional<String> namespace;

    @Inject
    @ConfigProperty(name = "coordination.etcd.request-timeout-millis", defaultValue = "5000")
    long requestTimeoutMillis;

    @Inject
    @ConfigProperty(name = "coordination.etcd.user")
    Optional<String> user;

    @Inject
    @ConfigProperty(name = "coordination.etcd.password")
    Optional<String> password;

    // ── Locks ─────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "coordination.lock.lease-timeout-seconds", defaultValue = "10")
    int leaseTimeoutSeconds;

    @Inject
    @ConfigProperty(name = "coordination.lock.max-wait-millis", defaultValue = "30000")
    long maxWaitMillis;

    @Inject
    @ConfigProperty(name = "coordination.lock.backoff-step-millis", defaultValue = "250")
    long backoffStepMillis;

    @Inject
    @ConfigProperty(name = "coordination.lock.backoff-cap-millis", defaultValue = "750")
    long backoffCapMillis;

    // ── Memoize ───────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "coordination.memoize.ttl-seconds", defaultValue = "300")
    long memoizeTtlSeconds;

    @Produces
    @ApplicationScoped
    public CoordinationClient coordinationClient() {
        log.info("Producing CoordinationClient: etcd={} namespace='{}'", endpoints, namespace.orElse(""));
        return CoordinationClient.builder()
                .etcd(etcdConfig())
                .lockConfig(lockConfig())
                .memoizeOptions(new MemoizeOptions(memoizeTtlSeconds, leaseTimeoutSeconds, maxWaitMillis))
                .build();
    }

    public void closeClient(@Disposes CoordinationClient client) {
        log.info("Closing CoordinationClient");
        client.close();
    }

    EtcdConfig etcdConfig() {
        EtcdConfig.Builder builder = EtcdConfig.builder()
                .endpoints(endpoints)
                .namespace(namespace.orElse(""))
                .requestTimeoutMillis(requestTimeoutMillis);
        user.ifPresent(u -> builder.credentials(u, password.orElse("")));
        return builder.build();
    }

    LockConfig lockConfig() {
        return new LockConfig(leaseTimeoutSeconds, maxWaitMillis, backoffStepMillis, backoffCapMillis);
    }
}
