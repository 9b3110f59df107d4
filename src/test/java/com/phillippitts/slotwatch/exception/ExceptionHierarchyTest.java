package com.phillippitts.slotwatch.exception;

import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;

class ExceptionHierarchyTest {

    @Test
    void allDomainExceptionsExtendBase() {
        assertThat(new ProbeException("x")).isInstanceOf(SlotWatchException.class);
        assertThat(new DeliveryException(1L, "x")).isInstanceOf(SlotWatchException.class);
        assertThat(new InvalidConfigurationException("k", "x")).isInstanceOf(SlotWatchException.class);
        assertThat(new SlotWatchException("x")).isInstanceOf(RuntimeException.class);
    }

    @Test
    void probeExceptionCarriesOperation() {
        ProbeException e = new ProbeException("Refresh failed", "refresh", new IOException("reset"));

        assertThat(e.getOperation()).isEqualTo("refresh");
        assertThat(e.getMessage()).isEqualTo("Refresh failed (operation: refresh)");
        assertThat(e.getCause()).isInstanceOf(IOException.class);
        assertThat(new ProbeException("x").getOperation()).isEqualTo("unknown");
    }

    @Test
    void deliveryExceptionCarriesRecipient() {
        DeliveryException e = new DeliveryException(1001L, "chat not found");

        assertThat(e.getRecipientId()).isEqualTo(1001L);
        assertThat(e.getMessage()).isEqualTo("Delivery to 1001 failed: chat not found");
    }

    @Test
    void invalidConfigurationCarriesSetting() {
        InvalidConfigurationException e = new InvalidConfigurationException("jitter-ratio", "must be in [0,1]");

        assertThat(e.getSetting()).isEqualTo("jitter-ratio");
        assertThat(e.getMessage()).isEqualTo("Invalid configuration 'jitter-ratio': must be in [0,1]");
    }
}
