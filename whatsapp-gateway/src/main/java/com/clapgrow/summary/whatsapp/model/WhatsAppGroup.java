package com.clapgrow.summary.whatsapp.model;

/**
 * Group chat visible to the gateway account.
 *
 * @param id          canonical group chat id
 * @param name        group subject, "Unknown Group" when the gateway has none
 * @param contactName contact name reported by the gateway, may be null
 */
public record WhatsAppGroup(String id, String name, String contactName) {
}
