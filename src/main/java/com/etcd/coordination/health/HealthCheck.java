package com.etcd.coordination.health;

/**
 * A single named probe of one client dependency.
 */
public interface HealthCheck {

    String getName();

    /**
     * Runs the probe. Implementations report failures as a DOWN status instead of throwing.
     */
    HealthStatus check();
}
