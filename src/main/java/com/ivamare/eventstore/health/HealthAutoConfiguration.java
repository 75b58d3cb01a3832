package com.ivamare.eventstore.health;

import com.ivamare.eventstore.EventStoreAutoConfiguration;
import com.ivamare.eventstore.api.impl.JdbcStore;
import com.ivamare.eventstore.datasource.SqliteDataSources;
import com.ivamare.eventstore.metrics.syncer.Syncer;
import com.ivamare.eventstore.worker.Worker;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;

import java.util.ArrayList;
import java.util.List;

/**
 * Auto-configuration for event store health indicators.
 */
@AutoConfiguration(after = EventStoreAutoConfiguration.class)
@ConditionalOnClass(HealthIndicator.class)
@ConditionalOnBean(SqliteDataSources.class)
@ConditionalOnProperty(prefix = "eventstore", name = "enabled", havingValue = "true", matchIfMissing = true)
public class HealthAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(EventStoreHealthIndicator.class)
    public EventStoreHealthIndicator eventStoreHealthIndicator(
            SqliteDataSources dataSources,
            ObjectProvider<JdbcStore> store) {
        return new EventStoreHealthIndicator(dataSources.writer(), store.getIfAvailable());
    }

    @Bean
    @ConditionalOnMissingBean(WorkerHealthIndicator.class)
    public WorkerHealthIndicator eventStoreWorkersHealthIndicator(
            ObjectProvider<JdbcStore> store,
            ObjectProvider<Syncer> syncer) {
        return new WorkerHealthIndicator(() -> {
            List<Worker> workers = new ArrayList<>();
            store.ifAvailable(s -> workers.addAll(s.purgers()));
            syncer.ifAvailable(s -> workers.addAll(s.workers()));
            return workers;
        });
    }
}
