package com.clapgrow.summary.scheduler.service;

import com.clapgrow.summary.common.group.Cadence;
import com.clapgrow.summary.common.group.GroupConfig;
import com.clapgrow.summary.scheduler.dto.GroupMessagesResponse;
import com.clapgrow.summary.scheduler.dto.ScheduleRequest;
import com.clapgrow.summary.scheduler.dto.ScheduleResponse;
import com.clapgrow.summary.scheduler.exception.ScheduleNotFoundException;
import com.clapgrow.summary.scheduler.store.ConfigurationStore;
import com.clapgrow.summary.whatsapp.exception.GatewayErrorCode;
import com.clapgrow.summary.whatsapp.exception.GatewayException;
import com.clapgrow.summary.whatsapp.service.IdentifierNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalTime;
import java.util.List;

/**
 * Keeps stored group configs and scheduler enrollments in step.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GroupScheduleService {

    private final ConfigurationStore configurationStore;
    private final DeliveryScheduler deliveryScheduler;

    public List<ScheduleResponse> listSchedules() {
        return configurationStore.listGroups().stream()
            .map(this::toResponse)
            .toList();
    }

    public ScheduleResponse getSchedule(String groupId) {
        String canonicalId = canonicalGroupId(groupId);
        GroupConfig config = configurationStore.findGroup(canonicalId)
            .orElseThrow(() -> new ScheduleNotFoundException(canonicalId));
        return toResponse(config);
    }

    /**
     * Save a group's schedule and (re)enroll it; a disabled schedule is unenrolled.
     */
    public ScheduleResponse saveSchedule(String groupId, ScheduleRequest request) {
        String canonicalId = canonicalGroupId(groupId);
        Cadence cadence = new Cadence(request.getFrequency(), LocalTime.parse(request.getTime()),
            request.getDayOfWeek());
        GroupConfig config = new GroupConfig(canonicalId, request.getName(), cadence, request.isEnabled());

        configurationStore.saveGroup(config);
        deliveryScheduler.enroll(config);
        log.info("Saved schedule for group {}: {} at {} (enabled: {})", canonicalId, cadence.frequency(),
            cadence.time(), config.enabled());
        return toResponse(config);
    }

    public void deleteSchedule(String groupId) {
        String canonicalId = canonicalGroupId(groupId);
        if (!configurationStore.removeGroup(canonicalId)) {
            throw new ScheduleNotFoundException(canonicalId);
        }
        deliveryScheduler.unenroll(canonicalId);
        log.info("Deleted schedule for group {}", canonicalId);
    }

    /**
     * Messages collected for a group, whether or not it has a schedule.
     */
    public GroupMessagesResponse getMessages(String groupId) {
        String canonicalId = canonicalGroupId(groupId);
        return GroupMessagesResponse.of(canonicalId, configurationStore.getMessages(canonicalId));
    }

    public int clearMessages(String groupId) {
        String canonicalId = canonicalGroupId(groupId);
        int cleared = configurationStore.clearMessages(canonicalId);
        log.info("Cleared {} collected messages of group {}", cleared, canonicalId);
        return cleared;
    }

    /**
     * Load configured groups into the store and enroll every enabled one.
     */
    public int enrollAll(List<GroupConfig> initialGroups) {
        for (GroupConfig group : initialGroups) {
            try {
                String canonicalId = canonicalGroupId(group.groupId());
                configurationStore.saveGroup(new GroupConfig(canonicalId, group.name(), group.cadence(),
                    group.enabled()));
            } catch (GatewayException e) {
                log.error("Skipping configured group {}: {}", group.groupId(), e.getMessage());
            }
        }
        List<GroupConfig> enabled = configurationStore.listEnabledGroups();
        enabled.forEach(deliveryScheduler::enroll);
        return enabled.size();
    }

    private ScheduleResponse toResponse(GroupConfig config) {
        return ScheduleResponse.of(config, deliveryScheduler.getTaskStatus(config.groupId()).orElse(null));
    }

    private static String canonicalGroupId(String groupId) {
        String canonicalId = IdentifierNormalizer.normalize(groupId);
        if (!IdentifierNormalizer.isGroupChatId(canonicalId)) {
            throw new GatewayException(GatewayErrorCode.INVALID_GROUP_ID,
                "Invalid group ID format, expected e.g. \"123456789-1234567890@g.us\": " + groupId);
        }
        return canonicalId;
    }
}
