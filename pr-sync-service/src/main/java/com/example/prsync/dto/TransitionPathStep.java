package com.example.prsync.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One hop of a multi-hop path: from a status, take the transition with this id or name.
 * Label is display-only.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TransitionPathStep(@JsonProperty("from") String fromStatus,
                                 String transitionId,
                                 String transitionName,
                                 String label) {

    public static TransitionPathStep byName(String fromStatus, String transitionName) {
        return new TransitionPathStep(fromStatus, null, transitionName, null);
    }

    /**
     * What to look for among permitted transitions: the name, else the label, else the id.
     */
    public String hint() {
        if (transitionName != null && !transitionName.isBlank()) {
            return transitionName;
        }
        if (label != null && !label.isBlank()) {
            return label;
        }
        return transitionId;
    }
}
