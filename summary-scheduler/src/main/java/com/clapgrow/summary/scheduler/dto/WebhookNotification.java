package com.clapgrow.summary.scheduler.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

/**
 * Green API webhook notification. Only the fields needed to collect group messages are mapped.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class WebhookNotification {

    public static final String INCOMING_MESSAGE = "incomingMessageReceived";

    private String typeWebhook;
    private String idMessage;
    /** Epoch seconds. */
    private Long timestamp;
    private SenderData senderData;
    private MessageData messageData;

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SenderData {
        private String chatId;
        private String sender;
        private String senderName;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class MessageData {
        private String typeMessage;
        private TextMessageData textMessageData;
        private ExtendedTextMessageData extendedTextMessageData;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class TextMessageData {
        private String textMessage;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ExtendedTextMessageData {
        private String text;
    }
}
