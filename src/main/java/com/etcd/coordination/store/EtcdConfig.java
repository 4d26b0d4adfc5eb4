package com.etcd.coordination.store;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Configuration for {@link EtcdKeyValueStore}.
 */
public class EtcdConfig {

    private final List<String> endpoints;
    private final String namespace;
    private final long requestTimeoutMillis;
    private final String user;
    private final String password;

    private EtcdConfig(Builder builder) {
        this.endpoints = List.copyOf(builder.endpoints);
        this.namespace = builder.namespace;
        this.requestTimeoutMillis = builder.requestTimeoutMillis;
        this.user = builder.user;
        this.password = builder.password;
    }

    public List<String> getEndpoints() { return endpoints; }
    public String getNamespace() { return namespace; }
    public long getRequestTimeoutMillis() { return requestTimeoutMillis; }
    public String getUser() { return user; }
    public String getPassword() { return password; }

    public boolean hasCredentials() {
        return user != null && !user.isBlank();
    }

    public static EtcdConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private List<String> endpoints = List.of("http://localhost:2379");
        private String namespace = "";
        private long requestTimeoutMillis = 5000;
        private String user;
        private String password;

        public Builder endpoints(List<String> endpoints) {
            if (endpoints == null || endpoints.isEmpty()) {
                throw new IllegalArgumentException("at least one endpoint is required");
            }
            this.endpoints = new ArrayList<>(endpoints);
            return this;
        }

        /**
         * Accepts a comma-separated endpoint list, e.g. {@code http://etcd-0:2379,http://etcd-1:2379}.
         */
        public Builder endpoints(String endpoints) {
            if (endpoints == null || endpoints.isBlank()) {
                throw new IllegalArgumentException("at least one endpoint is required");
            }
            return endpoints(Arrays.stream(endpoints.split(","))
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .toList());
        }

        public Builder namespace(String namespace) {
            this.namespace = namespace != null ? namespace : "";
            return this;
        }

        public Builder requestTimeoutMillis(long requestTimeoutMillis) {
            if (requestTimeoutMillis <= 0) throw new IllegalArgumentException("requestTimeoutMillis must be > 0");
            this.requestTimeoutMillis = requestTimeoutMillis;
            return this;
        }

        public Builder credentials(String user, String password) {
            this.user = user;
            this.password = password;
            return this;
        }

        public EtcdConfig build() {
            return new EtcdConfig(this);
        }
    }
}
