package com.clapgrow.summary.scheduler.dto;

import lombok.Data;

/**
 * Ad-hoc message. Blank fields are rejected by the gateway client with
 * EMPTY_IDENTIFIER / EMPTY_MESSAGE.
 */
@Data
public class SendMessageRequest {
    private String chatId;
    private String message;
}
