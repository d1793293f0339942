package com.whereq.dispatch.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.whereq.dispatch.model.Message;

/**
 * Persisted records keep their messages as JSON strings so the payload bytes
 * come back unchanged after a save and reload.
 */
@JsonSerialize(using = Message.TextSerializer.class)
@JsonDeserialize(using = Message.TextDeserializer.class)
abstract class StoredMessageMixin {

    static ObjectMapper storageMapper(ObjectMapper objectMapper) {
        return objectMapper.copy().addMixIn(Message.class, StoredMessageMixin.class);
    }
}
