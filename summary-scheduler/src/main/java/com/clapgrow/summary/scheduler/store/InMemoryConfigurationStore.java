package com.clapgrow.summary.scheduler.store;

import com.clapgrow.summary.common.group.GroupConfig;
import com.clapgrow.summary.scheduler.model.GroupMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.ArrayDeque;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local store. Keeps the most recent {@value #MAX_MESSAGES_PER_GROUP} messages per group;
 * older ones are dropped as new ones arrive. Nothing survives a restart.
 */
@Component
@Slf4j
public class InMemoryConfigurationStore implements ConfigurationStore {

    static final int MAX_MESSAGES_PER_GROUP = 1000;

    private final Map<String, GroupConfig> groups = new ConcurrentHashMap<>();
    private final Map<String, Deque<GroupMessage>> messages = new ConcurrentHashMap<>();

    @Override
    public List<GroupConfig> listGroups() {
        return groups.values().stream()
            .sorted(Comparator.comparing(GroupConfig::groupId))
            .toList();
    }

    @Override
    public List<GroupConfig> listEnabledGroups() {
        return listGroups().stream()
            .filter(GroupConfig::enabled)
            .toList();
    }

    @Override
    public Optional<GroupConfig> findGroup(String groupId) {
        return Optional.ofNullable(groups.get(groupId));
    }

    @Override
    public void saveGroup(GroupConfig config) {
        groups.put(config.groupId(), config);
        log.debug("Saved group config {}", config.groupId());
    }

    @Override
    public boolean removeGroup(String groupId) {
        messages.remove(groupId);
        return groups.remove(groupId) != null;
    }

    @Override
    public List<GroupMessage> getMessagesSince(String groupId, LocalDateTime since) {
        Deque<GroupMessage> groupMessages = messages.get(groupId);
        if (groupMessages == null) {
            return List.of();
        }
        synchronized (groupMessages) {
            return groupMessages.stream()
                .filter(message -> message.timestamp().isAfter(since))
                .toList();
        }
    }

    @Override
    public List<GroupMessage> getMessages(String groupId) {
        Deque<GroupMessage> groupMessages = messages.get(groupId);
        if (groupMessages == null) {
            return List.of();
        }
        synchronized (groupMessages) {
            return List.copyOf(groupMessages);
        }
    }

    @Override
    public void recordMessage(GroupMessage message) {
        Deque<GroupMessage> groupMessages = messages.computeIfAbsent(message.groupId(), id -> new ArrayDeque<>());
        synchronized (groupMessages) {
            groupMessages.addLast(message);
            while (groupMessages.size() > MAX_MESSAGES_PER_GROUP) {
                groupMessages.removeFirst();
            }
        }
    }

    @Override
    public int clearMessages(String groupId) {
        Deque<GroupMessage> groupMessages = messages.remove(groupId);
        if (groupMessages == null) {
            return 0;
        }
        synchronized (groupMessages) {
            log.debug("Cleared {} messages of group {}", groupMessages.size(), groupId);
            return groupMessages.size();
        }
    }
}
