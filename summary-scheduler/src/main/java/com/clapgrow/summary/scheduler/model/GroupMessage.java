package com.clapgrow.summary.scheduler.model;

import java.time.LocalDateTime;

/**
 * Message collected from a monitored group, input to the content producer.
 *
 * @param groupId    canonical group chat id
 * @param senderId   sender chat id
 * @param senderName sender display name, may be null
 * @param text       message text
 * @param timestamp  local time the message was sent
 * @param type       message kind
 */
public record GroupMessage(String groupId,
                           String senderId,
                           String senderName,
                           String text,
                           LocalDateTime timestamp,
                           MessageType type) {

    public String senderDisplayName() {
        return senderName == null || senderName.isBlank() ? senderId : senderName;
    }
}
