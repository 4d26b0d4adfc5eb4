package com.etcd.coordination.cdi;

import com.etcd.coordination.lock.LockConfig;
import com.etcd.coordination.store.EtcdConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CoordinationClientProducer Tests")
class CoordinationClientProducerTest {

    private CoordinationClientProducer producer() {
        CoordinationClientProducer producer = new CoordinationClientProducer();
        producer.endpoints = "http://etcd-0:2379, http://etcd-1:2379";
        producer.namespace = Optional.of("/orders");
        producer.requestTimeoutMillis = 2000;
        producer.user = Optional.empty();
        producer.password = Optional.empty();
        producer.leaseTimeoutSeconds = 15;
        producer.maxWaitMillis = 10_000;
        producer.backoffStepMillis = 100;
        producer.backoffCapMillis = 400;
        producer.memoizeTtlSeconds = 60;
        return producer;
    }

    @Test
    @DisplayName("Should map etcd properties onto EtcdConfig")
    void etcdConfig() {
        EtcdConfig config = producer().etcdConfig();

        assertEquals(List.of("http://etcd-0:2379", "http://etcd-1:2379"), config.getEndpoints());
        assertEquals("/orders", config.getNamespace());
        assertEquals(2000, config.getRequestTimeoutMillis());
        assertFalse(config.hasCredentials());
    }

    @Test
    @DisplayName("Should pass credentials when a user is configured")
    void credentials() {
        CoordinationClientProducer producer = producer();
        producer.user = Optional.of("svc");
        producer.password = Optional.of("secret");

        EtcdConfig config = producer.etcdConfig();

        assertTrue(config.hasCredentials());
        assertEquals("svc", config.getUser());
        assertEquals("secret", config.getPassword());
    }

    @Test
    @DisplayName("Should map lock properties onto LockConfig")
    void lockConfig() {
        LockConfig config = producer().lockConfig();

        assertEquals(15, config.leaseTimeoutSeconds());
        assertEquals(10_000, config.maxWaitMillis());
        assertEquals(400, config.backoffDelayMillis(9));
    }
}
