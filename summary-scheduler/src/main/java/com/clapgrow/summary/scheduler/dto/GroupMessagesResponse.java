package com.clapgrow.summary.scheduler.dto;

import com.clapgrow.summary.scheduler.model.GroupMessage;

import java.util.List;

/**
 * Messages collected for one group, oldest first.
 */
public record GroupMessagesResponse(String groupId, int messageCount, List<GroupMessage> messages) {

    public static GroupMessagesResponse of(String groupId, List<GroupMessage> messages) {
        return new GroupMessagesResponse(groupId, messages.size(), messages);
    }
}
