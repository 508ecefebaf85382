package com.clapgrow.summary.scheduler.config;

import com.clapgrow.summary.common.group.Cadence;
import com.clapgrow.summary.common.group.CadenceFrequency;
import com.clapgrow.summary.common.group.GroupConfig;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Groups loaded into the configuration store at startup.
 *
 * Maps to:
 * summary:
 *   groups:
 *     - id: 123456789-1234567890@g.us
 *       name: Family
 *       frequency: DAILY
 *       time: "20:00"
 *     - id: 987654321-1234567890@g.us
 *       frequency: WEEKLY
 *       day-of-week: MONDAY
 *       time: "09:30"
 *       enabled: false
 */
@Configuration
@ConfigurationProperties(prefix = "summary")
@Data
public class GroupsProperties {

    private List<GroupDefinition> groups = new ArrayList<>();

    @Data
    public static class GroupDefinition {
        private String id;
        private String name;
        private CadenceFrequency frequency = CadenceFrequency.DAILY;
        /**
         * Local time of day, HH:mm.
         */
        private String time = "20:00";
        private DayOfWeek dayOfWeek;
        private boolean enabled = true;

        public GroupConfig toGroupConfig() {
            return new GroupConfig(id, name, new Cadence(frequency, LocalTime.parse(time), dayOfWeek), enabled);
        }
    }
}
