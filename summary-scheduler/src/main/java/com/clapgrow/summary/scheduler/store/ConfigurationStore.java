package com.clapgrow.summary.scheduler.store;

import com.clapgrow.summary.common.group.GroupConfig;
import com.clapgrow.summary.scheduler.model.GroupMessage;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Source of group configurations and collected group messages.
 * Group ids are canonical chat ids.
 */
public interface ConfigurationStore {

    List<GroupConfig> listGroups();

    List<GroupConfig> listEnabledGroups();

    Optional<GroupConfig> findGroup(String groupId);

    void saveGroup(GroupConfig config);

    /**
     * @return true if the group existed
     */
    boolean removeGroup(String groupId);

    /**
     * Messages of a group sent strictly after {@code since}, oldest first.
     */
    List<GroupMessage> getMessagesSince(String groupId, LocalDateTime since);

    /**
     * Every stored message of a group, oldest first.
     */
    List<GroupMessage> getMessages(String groupId);

    void recordMessage(GroupMessage message);

    /**
     * Drop a group's collected messages, keeping its config.
     *
     * @return number of messages dropped
     */
    int clearMessages(String groupId);
}
