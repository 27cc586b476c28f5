package com.brokerbridge.engine;

import com.brokerbridge.config.ConfigLoader;
import com.brokerbridge.engine.id.OrderIdStrategy;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class SessionConfigTest {

    @Test
    void defaultsComeFromReferenceConf() {
        SessionConfig config = SessionConfig.load();

        assertEquals("broker", config.getName());
        assertEquals("127.0.0.1", config.getHost());
        assertEquals(7497, config.getPort());
        assertEquals(OrderIdStrategy.RETRY, config.getOrderIdStrategy());
        assertEquals(5, config.getOrderIdMaxAttempts());
        assertEquals(Duration.ofMillis(500), config.getOrderIdAttemptTimeout());
        assertEquals(Duration.ofSeconds(30), config.getRequestTimeout());
        assertTrue(config.isSubscribeOnConnect());
        assertFalse(config.isReadOnly());
        assertEquals(45, config.getMaxRequestsPerSecond());
    }

    @Test
    void overridesAreRead() {
        SessionConfig config = SessionConfig.fromConfig(ConfigFactory.parseString(
                "name = paper\n"
                        + "port = 4002\n"
                        + "client-id = 7\n"
                        + "read-only = true\n"
                        + "is-fa = true\n"
                        + "order-id-strategy = increment\n"
                        + "order-id.max-attempts = 2\n"
                        + "order-id.attempt-timeout = 1s\n"
                        + "contract-timeout = 2s\n"
                        + "subscribe-on-connect = false\n"));

        assertEquals("paper", config.getName());
        assertEquals(4002, config.getPort());
        assertEquals(7, config.getClientId());
        assertTrue(config.isReadOnly());
        assertTrue(config.isFinancialAdvisor());
        assertEquals(OrderIdStrategy.INCREMENT, config.getOrderIdStrategy());
        assertEquals(2, config.getOrderIdMaxAttempts());
        assertEquals(Duration.ofSeconds(1), config.getOrderIdAttemptTimeout());
        assertEquals(Duration.ofSeconds(2), config.getContractTimeout());
        assertFalse(config.isSubscribeOnConnect());
        // untouched values keep their defaults
        assertEquals(Duration.ofSeconds(30), config.getRequestTimeout());
    }

    @Test
    void unknownStrategyIsRejected() {
        ConfigLoader.ConfigurationException e = assertThrows(ConfigLoader.ConfigurationException.class,
                () -> SessionConfig.fromConfig(ConfigFactory.parseString("order-id-strategy = guess")));
        assertTrue(e.getMessage().contains("guess"));
    }

    @Test
    void builderValidates() {
        assertThrows(ConfigLoader.ConfigurationException.class,
                () -> SessionConfig.builder().port(0).build());
        assertThrows(ConfigLoader.ConfigurationException.class,
                () -> SessionConfig.builder().name(" ").build());
        assertThrows(ConfigLoader.ConfigurationException.class,
                () -> SessionConfig.builder().orderIdMaxAttempts(0).build());
        assertThrows(ConfigLoader.ConfigurationException.class,
                () -> SessionConfig.builder().requestTimeout(Duration.ZERO).build());

        SessionConfig config = SessionConfig.builder().name("live").port(7496).build();
        assertEquals("live", config.getName());
        assertEquals(7496, config.getPort());
    }
}
