package com.ivamare.eventstore.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Remediation hints attached to an event.
 *
 * <p>Stored as a JSON object. The store compares it only by its serialized form.
 *
 * @param descriptions Human-readable remediation notes (nullable)
 * @param repairActions Machine-readable repair actions (nullable)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SuggestedActions(
    @JsonProperty("descriptions") List<String> descriptions,
    @JsonProperty("repair_actions") List<RepairActionType> repairActions
) {

    public static SuggestedActions of(String... descriptions) {
        return new SuggestedActions(List.of(descriptions), null);
    }

    public static SuggestedActions of(RepairActionType... actions) {
        return new SuggestedActions(null, List.of(actions));
    }
}
