package com.whereq.dispatch.model;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.whereq.dispatch.exception.MessageUnmarshalException;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Base64;

/**
 * Opaque JSON payload carried by jobs and triggers.
 *
 * The bytes are copied on the way in and on the way out, so a message can be
 * shared between threads without aliasing mutable state.
 *
 * @author WhereQ Inc.
 */
@JsonSerialize(using = Message.Serializer.class)
@JsonDeserialize(using = Message.Deserializer.class)
public final class Message {

    static final ObjectMapper MAPPER = new ObjectMapper()
        .findAndRegisterModules()
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private static final String LEGACY_TYPE = "Type";
    private static final String LEGACY_DATA = "Data";
    private static final String LEGACY_JSON_TYPE = "json";

    private final byte[] data;

    private Message(byte[] data) {
        this.data = data;
    }

    /**
     * Encode a value as a message
     *
     * @param value any value Jackson can serialize
     * @return the encoded message
     */
    public static Message of(Object value) {
        try {
            return new Message(MAPPER.writeValueAsBytes(value));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot encode message: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Wrap already encoded bytes, as read back from storage
     */
    public static Message fromBytes(byte[] bytes) {
        return new Message(Arrays.copyOf(bytes, bytes.length));
    }

    public static Message fromJson(String json) {
        return new Message(json.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Decode the payload into the given type.
     *
     * @throws MessageUnmarshalException if the payload is malformed or uses an
     *                                   unknown legacy encoding
     */
    public <T> T unmarshal(Class<T> type) {
        JsonNode node = payload();
        try {
            return MAPPER.treeToValue(node, type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new MessageUnmarshalException("Cannot unmarshal message into " + type.getSimpleName(), e);
        }
    }

    public <T> T unmarshal(TypeReference<T> type) {
        JsonNode node = payload();
        try {
            return MAPPER.readValue(MAPPER.treeAsTokens(node), type);
        } catch (IOException | IllegalArgumentException e) {
            throw new MessageUnmarshalException("Cannot unmarshal message", e);
        }
    }

    /**
     * Payload as a JSON tree, with the legacy {@code {"Type":"json","Data":<base64>}}
     * envelope unwrapped.
     */
    public JsonNode payload() {
        JsonNode node;
        try {
            node = MAPPER.readTree(data);
        } catch (IOException e) {
            throw new MessageUnmarshalException("Malformed message payload", e);
        }
        if (node == null || node.isMissingNode()) {
            throw new MessageUnmarshalException("Empty message payload");
        }
        if (isLegacyEnvelope(node)) {
            String type = node.get(LEGACY_TYPE).asText();
            if (!LEGACY_JSON_TYPE.equals(type)) {
                throw new MessageUnmarshalException("Unknown message encoding: " + type);
            }
            try {
                byte[] inner = Base64.getDecoder().decode(node.get(LEGACY_DATA).asText());
                return MAPPER.readTree(inner);
            } catch (IOException | IllegalArgumentException e) {
                throw new MessageUnmarshalException("Malformed legacy message payload", e);
            }
        }
        return node;
    }

    public byte[] toBytes() {
        return Arrays.copyOf(data, data.length);
    }

    public String toJson() {
        return new String(data, StandardCharsets.UTF_8);
    }

    public Message copy() {
        return new Message(Arrays.copyOf(data, data.length));
    }

    private static boolean isLegacyEnvelope(JsonNode node) {
        return node.isObject()
            && node.size() == 2
            && node.hasNonNull(LEGACY_TYPE)
            && node.hasNonNull(LEGACY_DATA);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof Message other && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return toJson();
    }

    static class Serializer extends JsonSerializer<Message> {
        @Override
        public void serialize(Message value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
            gen.writeRawValue(value.toJson());
        }
    }

    /**
     * Reads a message from any JSON value. The tokens are copied one by one so
     * numbers keep their original text and precision.
     */
    static class Deserializer extends JsonDeserializer<Message> {
        @Override
        public Message deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            if (p.currentToken() == JsonToken.VALUE_NULL) {
                return null;
            }
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            try (JsonGenerator gen = MAPPER.getFactory().createGenerator(out)) {
                copyValue(p, gen);
            }
            return new Message(out.toByteArray());
        }

        @Override
        public Message getNullValue(DeserializationContext ctxt) {
            return null;
        }

        private static void copyValue(JsonParser p, JsonGenerator gen) throws IOException {
            JsonToken token = p.currentToken();
            int depth = 0;
            if (token == JsonToken.FIELD_NAME) {
                // object start already consumed by the caller
                gen.writeStartObject();
                depth = 1;
            }
            while (token != null) {
                switch (token) {
                    case START_OBJECT -> {
                        gen.writeStartObject();
                        depth++;
                    }
                    case START_ARRAY -> {
                        gen.writeStartArray();
                        depth++;
                    }
                    case END_OBJECT -> {
                        gen.writeEndObject();
                        depth--;
                    }
                    case END_ARRAY -> {
                        gen.writeEndArray();
                        depth--;
                    }
                    case FIELD_NAME -> gen.writeFieldName(p.currentName());
                    case VALUE_STRING -> gen.writeString(p.getText());
                    case VALUE_NUMBER_INT, VALUE_NUMBER_FLOAT -> gen.writeNumber(p.getText());
                    case VALUE_TRUE -> gen.writeBoolean(true);
                    case VALUE_FALSE -> gen.writeBoolean(false);
                    case VALUE_NULL -> gen.writeNull();
                    default -> gen.writeObject(p.getEmbeddedObject());
                }
                if (depth == 0) {
                    return;
                }
                token = p.nextToken();
            }
            throw new MessageUnmarshalException("Truncated message payload");
        }
    }

    /**
     * Writes a message as a JSON string holding its exact bytes, for records
     * that must read back byte for byte.
     */
    public static class TextSerializer extends JsonSerializer<Message> {
        @Override
        public void serialize(Message value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
            gen.writeString(value.toJson());
        }
    }

    /**
     * Reads what {@link TextSerializer} writes. Records holding the message as
     * a plain JSON value are still accepted.
     */
    public static class TextDeserializer extends JsonDeserializer<Message> {
        private final Deserializer structured = new Deserializer();

        @Override
        public Message deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            if (p.currentToken() == JsonToken.VALUE_STRING) {
                return fromJson(p.getText());
            }
            return structured.deserialize(p, ctxt);
        }

        @Override
        public Message getNullValue(DeserializationContext ctxt) {
            return null;
        }
    }
}
