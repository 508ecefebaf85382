package com.clapgrow.summary.common.group;

import java.util.Objects;

/**
 * Summary configuration of one monitored WhatsApp group.
 *
 * Owned by the configuration store; the scheduler only reads it.
 *
 * @param groupId WhatsApp group chat id (e.g. {@code 123456789-1234567890@g.us})
 * @param name    display name
 * @param cadence delivery schedule
 * @param enabled whether the group should be scheduled at all
 */
public record GroupConfig(String groupId, String name, Cadence cadence, boolean enabled) {

    public GroupConfig {
        Objects.requireNonNull(groupId, "groupId");
        Objects.requireNonNull(cadence, "cadence");
    }

    public String displayName() {
        return name == null || name.isBlank() ? groupId : name;
    }
}
