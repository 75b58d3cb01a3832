package com.ivamare.eventstore.metrics;

import com.ivamare.eventstore.context.OperationContext;
import com.ivamare.eventstore.model.Metric;

import java.util.List;

/**
 * Produces a fresh batch of metric samples on demand.
 */
@FunctionalInterface
public interface Scraper {

    /**
     * Scrape now.
     *
     * @param ctx operation context
     * @return scraped samples, possibly empty
     */
    List<Metric> scrape(OperationContext ctx);
}
