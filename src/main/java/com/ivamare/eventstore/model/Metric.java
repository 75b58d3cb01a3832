package com.ivamare.eventstore.model;

/**
 * One scraped metric sample.
 *
 * @param unixMilliseconds Collection time
 * @param component Producing component
 * @param name Metric name
 * @param label Optional label, e.g. a GPU id (empty when absent)
 * @param value Sample value
 */
public record Metric(
    long unixMilliseconds,
    String component,
    String name,
    String label,
    double value
) {

    public Metric {
        if (label == null) {
            label = "";
        }
    }

    public static Metric of(long unixMilliseconds, String component, String name, double value) {
        return new Metric(unixMilliseconds, component, name, "", value);
    }
}
