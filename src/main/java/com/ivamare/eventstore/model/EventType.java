package com.ivamare.eventstore.model;

/**
 * Classification of a health event.
 */
public enum EventType {
    UNKNOWN("Unknown"),
    INFO("Info"),
    WARNING("Warning"),
    CRITICAL("Critical"),
    FATAL("Fatal");

    private final String label;

    EventType(String label) {
        this.label = label;
    }

    /**
     * Text persisted in the type column.
     */
    public String label() {
        return label;
    }

    /**
     * Parse a stored label. Unrecognized labels map to {@link #UNKNOWN}.
     *
     * @param label stored text (nullable)
     * @return matching type
     */
    public static EventType fromLabel(String label) {
        if (label != null) {
            for (EventType type : values()) {
                if (type.label.equals(label)) {
                    return type;
                }
            }
        }
        return UNKNOWN;
    }
}
