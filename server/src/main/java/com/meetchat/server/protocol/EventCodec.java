package com.meetchat.server.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.meetchat.server.error.ProtocolException;
import com.meetchat.server.error.ValidationException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;

import java.util.Comparator;
import java.util.Map;
import java.util.Set;

/**
 * Parses and validates inbound envelopes, serializes outbound ones.
 */
public class EventCodec {

    private static final Map<String, Class<? extends InboundEvent>> INBOUND = Map.of(
            JoinMeeting.EVENT, JoinMeeting.class,
            LeaveMeeting.EVENT, LeaveMeeting.class,
            SendMessage.EVENT, SendMessage.class,
            TypingStart.EVENT, TypingStart.class,
            TypingStop.EVENT, TypingStop.class,
            ReactToMessage.EVENT, ReactToMessage.class,
            ParticipantStatusUpdate.EVENT, ParticipantStatusUpdate.class);

    private final ObjectMapper mapper;
    private final Validator validator;

    public EventCodec(ObjectMapper mapper, Validator validator) {
        this.mapper = mapper;
        this.validator = validator;
    }

    /** Mapper with ISO-8601 timestamps, for callers outside the Spring context. */
    public static ObjectMapper defaultMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    /**
     * @throws ProtocolException   when the text is not a known, well-formed envelope
     * @throws ValidationException when the payload violates a field constraint
     */
    public InboundEvent decode(String text) {
        JsonNode root;
        try {
            root = mapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new ProtocolException("Malformed JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new ProtocolException("Event must be a JSON object");
        }
        JsonNode name = root.get("event");
        if (name == null || !name.isTextual()) {
            throw new ProtocolException("Missing event name");
        }
        Class<? extends InboundEvent> type = INBOUND.get(name.asText());
        if (type == null) {
            throw new ProtocolException("Unknown event: " + name.asText());
        }
        JsonNode data = root.get("data");
        if (data == null || !data.isObject()) {
            throw new ProtocolException("Missing payload for " + name.asText());
        }

        InboundEvent event;
        try {
            event = mapper.treeToValue(data, type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new ProtocolException("Invalid payload for " + name.asText(), e);
        }
        return validate(event);
    }

    public <T> T validate(T value) {
        Set<ConstraintViolation<T>> violations = validator.validate(value);
        if (!violations.isEmpty()) {
            ConstraintViolation<T> first = violations.stream()
                    .min(Comparator.comparing(v -> v.getPropertyPath().toString()))
                    .get();
            throw new ValidationException(first.getPropertyPath() + ": " + first.getMessage());
        }
        return value;
    }

    public String encode(OutboundEvent event) {
        try {
            return mapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize " + event.event(), e);
        }
    }
}
