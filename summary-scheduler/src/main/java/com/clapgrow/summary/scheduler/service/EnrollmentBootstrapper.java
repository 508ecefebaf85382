package com.clapgrow.summary.scheduler.service;

import com.clapgrow.summary.common.group.GroupConfig;
import com.clapgrow.summary.scheduler.config.GroupsProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Enrolls the configured groups once the application is ready.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EnrollmentBootstrapper {

    private final GroupsProperties groupsProperties;
    private final GroupScheduleService groupScheduleService;

    @EventListener(ApplicationReadyEvent.class)
    public void enrollConfiguredGroups() {
        List<GroupConfig> groups = new ArrayList<>();
        for (GroupsProperties.GroupDefinition definition : groupsProperties.getGroups()) {
            try {
                groups.add(definition.toGroupConfig());
            } catch (RuntimeException e) {
                log.error("Ignoring invalid group definition {}: {}", definition.getId(), e.getMessage());
            }
        }
        int enrolled = groupScheduleService.enrollAll(groups);
        log.info("Enrolled {} of {} configured groups", enrolled, groups.size());
    }
}
