package com.clapgrow.summary.whatsapp.service;

import com.clapgrow.summary.whatsapp.exception.GatewayErrorCode;
import com.clapgrow.summary.whatsapp.exception.GatewayException;

import java.util.regex.Pattern;

/**
 * Converts raw chat identifiers into the canonical form expected by the gateway.
 *
 * <p>Rules, in order:
 * <ol>
 *   <li>already suffixed with {@code @c.us} or {@code @g.us}: unchanged</li>
 *   <li>two numeric segments joined by {@code -} (creator phone and creation timestamp): group chat</li>
 *   <li>anything else: direct chat</li>
 * </ol>
 * Normalization is idempotent.
 */
public final class IdentifierNormalizer {

    public static final String DIRECT_CHAT_SUFFIX = "@c.us";
    public static final String GROUP_CHAT_SUFFIX = "@g.us";

    private static final Pattern MULTI_PARTY_MARKER = Pattern.compile("\\d+-\\d+");
    private static final Pattern GROUP_CHAT_ID = Pattern.compile("^\\d+-\\d+@g\\.us$");

    private IdentifierNormalizer() {
    }

    /**
     * @param raw chat id with or without suffix
     * @return canonical chat id
     * @throws GatewayException with {@link GatewayErrorCode#INVALID_IDENTIFIER} when raw is null or blank
     */
    public static String normalize(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new GatewayException(GatewayErrorCode.INVALID_IDENTIFIER, "Chat ID cannot be empty");
        }
        String id = raw.trim();
        if (id.endsWith(DIRECT_CHAT_SUFFIX) || id.endsWith(GROUP_CHAT_SUFFIX)) {
            return id;
        }
        if (MULTI_PARTY_MARKER.matcher(id).find()) {
            return id + GROUP_CHAT_SUFFIX;
        }
        return id + DIRECT_CHAT_SUFFIX;
    }

    /**
     * Whether the id is a fully qualified group chat id, e.g. {@code 123456789-1234567890@g.us}.
     */
    public static boolean isGroupChatId(String id) {
        return id != null && GROUP_CHAT_ID.matcher(id).matches();
    }
}
