package com.ivamare.eventstore;

import com.ivamare.eventstore.api.Store;
import com.ivamare.eventstore.codec.JsonColumnCodec;
import com.ivamare.eventstore.datasource.SqliteDataSources;
import com.ivamare.eventstore.health.EventStoreHealthIndicator;
import com.ivamare.eventstore.health.HealthAutoConfiguration;
import com.ivamare.eventstore.health.WorkerHealthIndicator;
import com.ivamare.eventstore.metrics.MetricsStore;
import com.ivamare.eventstore.metrics.Scraper;
import com.ivamare.eventstore.metrics.syncer.Syncer;
import com.ivamare.eventstore.observe.MicrometerLatencyRecorder;
import com.ivamare.eventstore.observe.OperationLatencyRecorder;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("EventStoreAutoConfiguration")
class EventStoreAutoConfigurationTest {

    @TempDir
    Path tempDir;

    private ApplicationContextRunner contextRunner() {
        return new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(EventStoreAutoConfiguration.class, HealthAutoConfiguration.class))
            .withPropertyValues("eventstore.path=" + tempDir.resolve("gpud.state"));
    }

    @Test
    @DisplayName("should create all beans when enabled")
    void shouldCreateAllBeansWhenEnabled() {
        contextRunner().run(context -> {
            assertThat(context).hasSingleBean(SqliteDataSources.class);
            assertThat(context).hasSingleBean(ObjectMapper.class);
            assertThat(context).hasSingleBean(JsonColumnCodec.class);
            assertThat(context).hasSingleBean(Store.class);
            assertThat(context).hasSingleBean(MetricsStore.class);
            assertThat(context).hasSingleBean(EventStoreHealthIndicator.class);
            assertThat(context).hasSingleBean(WorkerHealthIndicator.class);
            assertThat(context).doesNotHaveBean(Syncer.class);
            assertThat(context.getBean(OperationLatencyRecorder.class)).isSameAs(OperationLatencyRecorder.NOOP);
        });
    }

    @Test
    @DisplayName("should not create beans when disabled")
    void shouldNotCreateBeansWhenDisabled() {
        contextRunner()
            .withPropertyValues("eventstore.enabled=false")
            .run(context -> {
                assertThat(context).doesNotHaveBean(SqliteDataSources.class);
                assertThat(context).doesNotHaveBean(Store.class);
                assertThat(context).doesNotHaveBean(EventStoreHealthIndicator.class);
            });
    }

    @Test
    @DisplayName("should skip the metrics store when metrics are disabled")
    void shouldSkipMetricsStoreWhenDisabled() {
        contextRunner()
            .withPropertyValues("eventstore.metrics.enabled=false")
            .withUserConfiguration(ScraperConfig.class)
            .run(context -> {
                assertThat(context).hasSingleBean(Store.class);
                assertThat(context).doesNotHaveBean(MetricsStore.class);
                assertThat(context).doesNotHaveBean(Syncer.class);
            });
    }

    @Test
    @DisplayName("should start a syncer when a scraper is provided")
    void shouldStartSyncerWhenScraperProvided() {
        contextRunner()
            .withPropertyValues(
                "eventstore.metrics.scrape-interval=30s",
                "eventstore.metrics.purge-interval=5m",
                "eventstore.metrics.retention=24h")
            .withUserConfiguration(ScraperConfig.class)
            .run(context -> {
                assertThat(context).hasSingleBean(Syncer.class);
                Syncer syncer = context.getBean(Syncer.class);
                assertThat(syncer.scrapeInterval()).isEqualTo(Duration.ofSeconds(30));
                assertThat(syncer.purgeInterval()).isEqualTo(Duration.ofMinutes(5));
                assertThat(syncer.retainDuration()).isEqualTo(Duration.ofHours(24));
                assertThat(syncer.workers()).allMatch(w -> w.isRunning());
            });
    }

    @Test
    @DisplayName("should publish latencies when a meter registry exists")
    void shouldPublishLatenciesWithMeterRegistry() {
        contextRunner()
            .withUserConfiguration(MeterRegistryConfig.class)
            .run(context -> assertThat(context.getBean(OperationLatencyRecorder.class))
                .isInstanceOf(MicrometerLatencyRecorder.class));
    }

    @Test
    @DisplayName("should use custom ObjectMapper if provided")
    void shouldUseCustomObjectMapperIfProvided() {
        contextRunner()
            .withUserConfiguration(CustomObjectMapperConfig.class)
            .run(context -> assertThat(context.getBean(ObjectMapper.class))
                .isSameAs(CustomObjectMapperConfig.CUSTOM_MAPPER));
    }

    @Test
    @DisplayName("should fail on a retention under one minute")
    void shouldFailOnShortRetention() {
        contextRunner()
            .withPropertyValues("eventstore.retention=30s")
            .run(context -> {
                assertThat(context).hasFailed();
                assertThat(context.getStartupFailure())
                    .rootCause()
                    .hasMessageContaining("eventstore.retention must be at least 1 minute");
            });
    }

    @Configuration(proxyBeanMethods = false)
    static class ScraperConfig {
        @Bean
        Scraper scraper() {
            return ctx -> List.of();
        }
    }

    @Configuration(proxyBeanMethods = false)
    static class MeterRegistryConfig {
        @Bean
        MeterRegistry meterRegistry() {
            return new SimpleMeterRegistry();
        }
    }

    @Configuration(proxyBeanMethods = false)
    static class CustomObjectMapperConfig {
        static final ObjectMapper CUSTOM_MAPPER = new ObjectMapper();

        @Bean
        ObjectMapper customObjectMapper() {
            return CUSTOM_MAPPER;
        }
    }
}
