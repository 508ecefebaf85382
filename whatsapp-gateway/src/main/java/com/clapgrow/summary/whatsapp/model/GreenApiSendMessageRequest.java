package com.clapgrow.summary.whatsapp.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;

@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class GreenApiSendMessageRequest {
    private String chatId;
    private String message;
    private String quotedMessageId; // Message ID to reply to
    private Boolean linkPreview;

    public static GreenApiSendMessageRequest of(String chatId, String message) {
        GreenApiSendMessageRequest request = new GreenApiSendMessageRequest();
        request.setChatId(chatId);
        request.setMessage(message);
        request.setLinkPreview(false);
        return request;
    }
}
