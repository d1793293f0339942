package com.whereq.dispatch.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.whereq.dispatch.exception.UnknownTriggerException;

/**
 * Kinds of triggers, as written in the persisted {@code type} field
 */
public enum TriggerType {
    AT("@at"),
    IN("@in"),
    CRON("@cron"),
    EVERY("@every"),
    EVENT("@event");

    private final String tag;

    TriggerType(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String getTag() {
        return tag;
    }

    @JsonCreator
    public static TriggerType fromTag(String tag) {
        for (TriggerType type : values()) {
            if (type.tag.equals(tag)) {
                return type;
            }
        }
        throw new UnknownTriggerException(tag);
    }

    @Override
    public String toString() {
        return tag;
    }
}
