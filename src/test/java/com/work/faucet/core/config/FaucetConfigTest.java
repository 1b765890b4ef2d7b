package com.work.faucet.core.config;

import com.work.faucet.core.exception.FaucetConfigurationException;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class FaucetConfigTest {

    @Test
    public void parses_amount_and_cooldown() {
        assertEquals(new BigInteger("1000000000000000000"), FaucetConfig.parseAmount("1000000000000000000"));
        assertEquals(Duration.ofHours(24), FaucetConfig.parseCooldownHours(" 24 "));
        assertEquals(Duration.ZERO, FaucetConfig.parseCooldownHours("0"));
    }

    @Test
    public void malformed_amount_is_fatal() {
        assertThrows(FaucetConfigurationException.class, () -> FaucetConfig.parseAmount("1e18"));
        assertThrows(FaucetConfigurationException.class, () -> FaucetConfig.parseAmount("-5"));
        assertThrows(FaucetConfigurationException.class, () -> FaucetConfig.parseAmount("0"));
        assertThrows(FaucetConfigurationException.class, () -> FaucetConfig.parseAmount(""));
    }

    @Test
    public void malformed_cooldown_is_fatal() {
        FaucetConfigurationException e = assertThrows(FaucetConfigurationException.class,
                () -> FaucetConfig.parseCooldownHours("one day"));
        assertEquals("invalid COOLDOWN_HOURS: one day", e.getMessage());
        assertThrows(FaucetConfigurationException.class, () -> FaucetConfig.parseCooldownHours("1.5"));
        assertThrows(FaucetConfigurationException.class, () -> FaucetConfig.parseCooldownHours("-1"));
    }

    @Test
    public void retention_is_a_multiple_of_cooldown() {
        FaucetConfig config = new FaucetConfig(BigInteger.ONE, Duration.ofHours(24), 0, Duration.ofSeconds(1));
        assertEquals(1, config.getRetentionMultiplier());
        assertEquals(Duration.ofHours(24), config.getRetention());
    }

    @Test
    public void oversized_cooldown_is_a_configuration_error() {
        FaucetConfigurationException e = assertThrows(FaucetConfigurationException.class,
                () -> FaucetConfig.parseCooldownHours("9999999999999999"));
        assertTrue(e.getMessage().startsWith("invalid COOLDOWN_HOURS"));

        Duration largest = FaucetConfig.parseCooldownHours(String.valueOf(Long.MAX_VALUE / 3600));
        FaucetConfigurationException retention = assertThrows(FaucetConfigurationException.class,
                () -> new FaucetConfig(BigInteger.ONE, largest, 2, Duration.ofSeconds(1)));
        assertTrue(retention.getMessage().startsWith("invalid COOLDOWN_HOURS"));
    }
}
