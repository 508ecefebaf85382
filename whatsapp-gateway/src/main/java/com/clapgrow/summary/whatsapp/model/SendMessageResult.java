package com.clapgrow.summary.whatsapp.model;

/**
 * Result of an accepted send.
 *
 * @param messageId gateway message id; null when the gateway accepted the message
 *                  but its response body could not be read
 */
public record SendMessageResult(String messageId) {
}
