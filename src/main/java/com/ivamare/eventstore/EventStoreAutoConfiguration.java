package com.ivamare.eventstore;

import com.ivamare.eventstore.api.Store;
import com.ivamare.eventstore.api.impl.JdbcStore;
import com.ivamare.eventstore.codec.JsonColumnCodec;
import com.ivamare.eventstore.datasource.SqliteDataSources;
import com.ivamare.eventstore.metrics.MetricsStore;
import com.ivamare.eventstore.metrics.Scraper;
import com.ivamare.eventstore.metrics.impl.JdbcMetricsStore;
import com.ivamare.eventstore.metrics.syncer.Syncer;
import com.ivamare.eventstore.observe.MicrometerLatencyRecorder;
import com.ivamare.eventstore.observe.OperationLatencyRecorder;
import com.ivamare.eventstore.purge.RetentionPolicy;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.sqlite.SQLiteDataSource;

import java.nio.file.Path;

/**
 * Auto-configuration for the event store.
 *
 * <p>Automatically configures:
 * <ul>
 *   <li>Writer and reader SQLite pools</li>
 *   <li>Event store and its JSON column codec</li>
 *   <li>Metrics store</li>
 *   <li>Metrics syncer, when the application defines a {@link Scraper}</li>
 * </ul>
 *
 * <p>To disable auto-configuration:
 * <pre>
 * eventstore.enabled=false
 * </pre>
 */
@AutoConfiguration
@ConditionalOnClass(SQLiteDataSource.class)
@ConditionalOnProperty(prefix = "eventstore", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(EventStoreProperties.class)
public class EventStoreAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(EventStoreAutoConfiguration.class);

    // --- Data Sources ---

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public SqliteDataSources eventStoreDataSources(EventStoreProperties properties) {
        properties.validate();
        return SqliteDataSources.open(
            Path.of(properties.getPath()),
            properties.getBusyTimeout(),
            properties.getReaderPoolSize()
        );
    }

    // --- Object Mapper ---

    @Bean
    @ConditionalOnMissingBean
    public ObjectMapper eventStoreObjectMapper() {
        return new ObjectMapper();
    }

    @Bean
    @ConditionalOnMissingBean
    public JsonColumnCodec jsonColumnCodec(ObjectMapper objectMapper) {
        return new JsonColumnCodec(objectMapper);
    }

    // --- Latency ---

    @Bean
    @ConditionalOnMissingBean
    public OperationLatencyRecorder operationLatencyRecorder(ObjectProvider<MeterRegistry> meterRegistry) {
        MeterRegistry registry = meterRegistry.getIfAvailable();
        if (registry == null) {
            return OperationLatencyRecorder.NOOP;
        }
        return new MicrometerLatencyRecorder(registry);
    }

    // --- Event Store ---

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean(Store.class)
    public JdbcStore eventStore(
            SqliteDataSources dataSources,
            JsonColumnCodec codec,
            OperationLatencyRecorder latencyRecorder,
            EventStoreProperties properties) {
        return new JdbcStore(
            dataSources.writer(),
            dataSources.reader(),
            codec,
            RetentionPolicy.of(properties.getRetention()),
            latencyRecorder
        );
    }

    // --- Metrics ---

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "eventstore.metrics", name = "enabled", havingValue = "true", matchIfMissing = true)
    public MetricsStore metricsStore(
            SqliteDataSources dataSources,
            OperationLatencyRecorder latencyRecorder,
            EventStoreProperties properties) {
        return new JdbcMetricsStore(
            dataSources.writer(),
            dataSources.reader(),
            properties.getMetrics().getTable(),
            latencyRecorder
        );
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    @ConditionalOnMissingBean
    @ConditionalOnBean({Scraper.class, MetricsStore.class})
    public Syncer metricsSyncer(Scraper scraper, MetricsStore metricsStore, EventStoreProperties properties) {
        EventStoreProperties.MetricsProperties metrics = properties.getMetrics();
        log.debug("Configuring metrics syncer for table {}", metrics.getTable());
        return new Syncer(
            scraper,
            metricsStore,
            metrics.getScrapeInterval(),
            metrics.getPurgeInterval(),
            metrics.getRetention()
        );
    }
}
