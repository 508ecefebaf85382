package com.clapgrow.summary.whatsapp.service;

import com.clapgrow.summary.common.group.GroupConfig;
import com.clapgrow.summary.whatsapp.model.InstanceState;
import com.clapgrow.summary.whatsapp.model.SendMessageResult;
import com.clapgrow.summary.whatsapp.model.WhatsAppGroup;

import java.util.List;

/**
 * Client of the rate-limited WhatsApp gateway.
 *
 * All operations are blocking. Failures are reported as
 * {@link com.clapgrow.summary.whatsapp.exception.GatewayException} carrying a
 * {@link com.clapgrow.summary.whatsapp.exception.GatewayErrorCode}.
 */
public interface GatewayClient {

    /**
     * Authorization state of the gateway account. Cached briefly. A throttled state
     * check is reported as AUTHORIZED so that state checks alone never cascade into
     * NOT_AUTHORIZED failures under load.
     */
    InstanceState getInstanceState();

    /**
     * Group chats of the account. Cached; requires an authorized instance.
     *
     * @throws com.clapgrow.summary.whatsapp.exception.GatewayException NOT_AUTHORIZED when the
     *         instance is not authorized
     */
    List<WhatsAppGroup> listGroups();

    /**
     * Send a text message. The identifier is normalized before transmission.
     */
    SendMessageResult sendMessage(String identifier, String text);

    /**
     * Send a summary to a group, wrapped in the standard summary envelope.
     *
     * @throws com.clapgrow.summary.whatsapp.exception.GatewayException INVALID_GROUP_ID when the
     *         group id is not a canonical group chat id
     */
    void sendGroupSummary(GroupConfig group, String text);

    default boolean isConfigured() {
        return true;
    }
}
