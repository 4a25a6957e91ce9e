package com.bookindexer.ingest.service;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

import org.springframework.stereotype.Component;

import com.bookindexer.common.model.PubSubEnvelope;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.DeserializationFeature;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;

/**
 * Extracts the raw items from a push envelope.
 * <p>
 * A payload that cannot be decoded will never decode on redelivery either, so every failure
 * here yields an empty list and the batch is acknowledged.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EnvelopeUnpacker {

    private static final String ITEMS_FIELD = "items";

    private final ObjectMapper objectMapper;

    public List<JsonNode> unpack(PubSubEnvelope envelope) {
        String messageId = envelope.getMessage().getMessageId();

        byte[] raw;
        try {
            raw = Base64.getDecoder().decode(envelope.getMessage().getData());
        } catch (IllegalArgumentException e) {
            log.warn("Message {} data is not valid base64: {}", messageId, e.getMessage());
            return List.of();
        }

        String json;
        try {
            json = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(raw))
                    .toString();
        } catch (CharacterCodingException e) {
            log.warn("Message {} data is not valid UTF-8: {}", messageId, e.getMessage());
            return List.of();
        }

        JsonNode root;
        try {
            root = objectMapper.reader()
                    .with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
                    .readTree(json);
        } catch (JacksonException e) {
            log.warn("Message {} data is not valid JSON: {}", messageId, e.getOriginalMessage());
            return List.of();
        }

        JsonNode items = root != null ? root.get(ITEMS_FIELD) : null;
        if (items == null || !items.isArray()) {
            log.warn("Message {} has no '{}' array, ignoring payload", messageId, ITEMS_FIELD);
            return List.of();
        }

        List<JsonNode> result = new ArrayList<>(items.size());
        items.forEach(result::add);
        log.debug("Unpacked {} items from message {}", result.size(), messageId);
        return result;
    }
}
