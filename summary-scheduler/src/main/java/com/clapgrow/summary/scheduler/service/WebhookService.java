package com.clapgrow.summary.scheduler.service;

import com.clapgrow.summary.scheduler.dto.WebhookNotification;
import com.clapgrow.summary.scheduler.model.GroupMessage;
import com.clapgrow.summary.scheduler.model.MessageType;
import com.clapgrow.summary.scheduler.store.ConfigurationStore;
import com.clapgrow.summary.whatsapp.service.IdentifierNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;

/**
 * Collects incoming text messages of configured groups from gateway webhooks.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WebhookService {

    private static final String TEXT_MESSAGE = "textMessage";
    private static final String EXTENDED_TEXT_MESSAGE = "extendedTextMessage";

    private final ConfigurationStore configurationStore;
    private final Clock clock;

    /**
     * @return true if the notification was stored as a group message
     */
    public boolean handle(WebhookNotification notification) {
        if (!WebhookNotification.INCOMING_MESSAGE.equals(notification.getTypeWebhook())) {
            log.debug("Ignoring webhook of type {}", notification.getTypeWebhook());
            return false;
        }
        WebhookNotification.SenderData sender = notification.getSenderData();
        if (sender == null || !IdentifierNormalizer.isGroupChatId(sender.getChatId())) {
            return false;
        }
        if (configurationStore.findGroup(sender.getChatId()).isEmpty()) {
            log.debug("Ignoring message from unconfigured group {}", sender.getChatId());
            return false;
        }
        String text = textOf(notification.getMessageData());
        if (text == null || text.isBlank()) {
            return false;
        }

        configurationStore.recordMessage(new GroupMessage(
            sender.getChatId(),
            sender.getSender(),
            sender.getSenderName(),
            text,
            timestampOf(notification),
            MessageType.TEXT));
        log.debug("Recorded message {} from group {}", notification.getIdMessage(), sender.getChatId());
        return true;
    }

    private static String textOf(WebhookNotification.MessageData data) {
        if (data == null) {
            return null;
        }
        if (TEXT_MESSAGE.equals(data.getTypeMessage()) && data.getTextMessageData() != null) {
            return data.getTextMessageData().getTextMessage();
        }
        if (EXTENDED_TEXT_MESSAGE.equals(data.getTypeMessage()) && data.getExtendedTextMessageData() != null) {
            return data.getExtendedTextMessageData().getText();
        }
        return null;
    }

    private LocalDateTime timestampOf(WebhookNotification notification) {
        if (notification.getTimestamp() == null) {
            return LocalDateTime.now(clock);
        }
        return LocalDateTime.ofInstant(Instant.ofEpochSecond(notification.getTimestamp()), clock.getZone());
    }
}
