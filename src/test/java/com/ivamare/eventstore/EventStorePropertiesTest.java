package com.ivamare.eventstore;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("EventStoreProperties")
class EventStorePropertiesTest {

    @Test
    @DisplayName("should have gpud defaults")
    void shouldHaveDefaults() {
        EventStoreProperties properties = new EventStoreProperties();

        assertTrue(properties.isEnabled());
        assertEquals(Duration.ofHours(72), properties.getRetention());
        assertEquals("gpud_metrics_v0_5_0", properties.getMetrics().getTable());
        assertEquals(Duration.ofMinutes(1), properties.getMetrics().getScrapeInterval());
        assertEquals(Duration.ofMinutes(10), properties.getMetrics().getPurgeInterval());
        assertDoesNotThrow(properties::validate);
    }

    @Test
    @DisplayName("should reject a blank path")
    void shouldRejectBlankPath() {
        EventStoreProperties properties = new EventStoreProperties();
        properties.setPath(" ");

        IllegalStateException ex = assertThrows(IllegalStateException.class, properties::validate);
        assertEquals("eventstore.path is required", ex.getMessage());
    }

    @Test
    @DisplayName("should accept exactly one minute of retention")
    void shouldAcceptOneMinuteRetention() {
        EventStoreProperties properties = new EventStoreProperties();
        properties.setRetention(Duration.ofMinutes(1));

        assertDoesNotThrow(properties::validate);
    }

    @Test
    @DisplayName("should reject a non-positive scrape interval")
    void shouldRejectNonPositiveScrapeInterval() {
        EventStoreProperties properties = new EventStoreProperties();
        properties.getMetrics().setScrapeInterval(Duration.ZERO);

        assertThrows(IllegalStateException.class, properties::validate);
    }

    @Test
    @DisplayName("should reject a short metrics retention")
    void shouldRejectShortMetricsRetention() {
        EventStoreProperties properties = new EventStoreProperties();
        properties.getMetrics().setRetention(Duration.ofSeconds(59));

        assertThrows(IllegalStateException.class, properties::validate);
    }
}
