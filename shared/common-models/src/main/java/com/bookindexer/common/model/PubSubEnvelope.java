package com.bookindexer.common.model;

import java.util.HashMap;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Push-subscription envelope as delivered over HTTP by the message bus.
 * <pre>
 * {
 *   "message": {
 *     "attributes": { "key": "value" },
 *     "data": "eyJpdGVtcyI6IFtdfQ==",
 *     "message_id": "2070443601311540",
 *     "publish_time": "2021-02-26T19:13:55.749Z"
 *   },
 *   "subscription": "projects/myproject/subscriptions/mysubscription"
 * }
 * </pre>
 * {@code data} is base64 of a UTF-8 JSON object {@code {"items": [...]}}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class PubSubEnvelope {

    @Valid
    @NotNull(message = "message is required")
    private Message message;

    @NotBlank(message = "subscription is required")
    private String subscription;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Message {

        @Builder.Default
        private Map<String, Object> attributes = new HashMap<>();

        @NotNull(message = "data is required")
        private String data;

        @NotBlank(message = "message_id is required")
        @JsonProperty("message_id")
        private String messageId;

        @NotBlank(message = "publish_time is required")
        @JsonProperty("publish_time")
        private String publishTime;
    }
}
