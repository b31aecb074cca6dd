package com.cloudscheduler.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Discrete scaling recommendation emitted by {@link com.cloudscheduler.common.decision.DecisionPolicy}.
 */
public enum ScalingAction {
    MAINTAIN("maintain"),
    SCALE_UP("scale_up"),
    SCALE_DOWN("scale_down"),
    OPTIMIZE("optimize");

    private final String wireName;

    ScalingAction(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static ScalingAction fromWireName(String value) {
        for (ScalingAction action : values()) {
            if (action.wireName.equalsIgnoreCase(value) || action.name().equalsIgnoreCase(value)) {
                return action;
            }
        }
        throw new IllegalArgumentException("Unknown scaling action: " + value);
    }
}
