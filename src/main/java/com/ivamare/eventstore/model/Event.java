package com.ivamare.eventstore.model;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * A discrete health event recorded in a bucket.
 *
 * <p>Time is carried as signed Unix seconds, the unit persisted in the
 * timestamp column, so every 64-bit value round-trips even where
 * {@link Instant} cannot represent it. {@code extraInfo} and
 * {@code suggestedActions} are optional; {@code null} means absent.
 *
 * @param unixSeconds When the event occurred, in Unix seconds
 * @param name Source identifier, e.g. a kernel log subsystem
 * @param type Event classification
 * @param message Human-readable description (may be empty)
 * @param extraInfo Diagnostic key/value payload, also the dedup key (nullable)
 * @param suggestedActions Remediation hints (nullable)
 */
public record Event(
    long unixSeconds,
    String name,
    EventType type,
    String message,
    Map<String, String> extraInfo,
    SuggestedActions suggestedActions
) {

    public Event {
        if (name == null) {
            name = "";
        }
        if (type == null) {
            type = EventType.UNKNOWN;
        }
        if (message == null) {
            message = "";
        }
    }

    /**
     * Creates an event at an instant, truncated to whole seconds.
     */
    public Event(
            Instant time,
            String name,
            EventType type,
            String message,
            Map<String, String> extraInfo,
            SuggestedActions suggestedActions) {
        this(requireTime(time).getEpochSecond(), name, type, message, extraInfo, suggestedActions);
    }

    /**
     * Creates an event without payload fields.
     */
    public static Event of(Instant time, String name, EventType type, String message) {
        return new Event(time, name, type, message, null, null);
    }

    /**
     * Creates an event without payload fields at raw Unix seconds.
     */
    public static Event of(long unixSeconds, String name, EventType type, String message) {
        return new Event(unixSeconds, name, type, message, null, null);
    }

    private static Instant requireTime(Instant time) {
        if (time == null) {
            throw new IllegalArgumentException("time is required");
        }
        return time;
    }

    public Event withExtraInfo(Map<String, String> newExtraInfo) {
        return new Event(unixSeconds, name, type, message, newExtraInfo, suggestedActions);
    }

    public Event withSuggestedActions(SuggestedActions newSuggestedActions) {
        return new Event(unixSeconds, name, type, message, extraInfo, newSuggestedActions);
    }

    /**
     * Event time as an instant.
     *
     * @return the event time
     * @throws java.time.DateTimeException if the seconds lie outside the range {@link Instant} supports
     */
    public Instant time() {
        return Instant.ofEpochSecond(unixSeconds);
    }

    /**
     * Dedup comparison of extra info: same size, and every key of this event
     * present in the other with an identical value. Null counts as empty.
     *
     * @param other event to compare with
     * @return true if both carry the same extra info
     */
    public boolean sameExtraInfo(Event other) {
        Map<String, String> mine = extraInfo != null ? extraInfo : Map.of();
        Map<String, String> theirs = other.extraInfo != null ? other.extraInfo : Map.of();
        if (mine.size() != theirs.size()) {
            return false;
        }
        for (Map.Entry<String, String> entry : mine.entrySet()) {
            if (!theirs.containsKey(entry.getKey())
                    || !Objects.equals(theirs.get(entry.getKey()), entry.getValue())) {
                return false;
            }
        }
        return true;
    }
}
