package com.clapgrow.summary.scheduler.service;

import com.clapgrow.summary.scheduler.model.GroupMessage;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Default content producer: message statistics instead of a written summary.
 */
@Component
public class MessageStatsContentProducer implements ContentProducer {

    static final String NO_MESSAGES = "No messages were sent in this period.";
    private static final int TOP_ENTRIES = 3;

    @Override
    public String produceSummary(List<GroupMessage> messages) {
        if (messages == null || messages.isEmpty()) {
            return NO_MESSAGES;
        }

        StringBuilder summary = new StringBuilder();
        summary.append("*Messages:* ").append(messages.size());

        summary.append("\n\n*Most active participants:*");
        int rank = 1;
        for (Map.Entry<String, Long> participant : top(messages, GroupMessage::senderDisplayName)) {
            summary.append('\n').append(rank++).append(". ")
                .append(participant.getKey()).append(" (").append(participant.getValue()).append(')');
        }

        summary.append("\n\n*Busiest hours:*");
        for (Map.Entry<String, Long> hour : top(messages,
                message -> String.format("%02d:00", message.timestamp().getHour()))) {
            summary.append("\n- ").append(hour.getKey()).append(" (").append(hour.getValue()).append(')');
        }
        return summary.toString();
    }

    private static List<Map.Entry<String, Long>> top(List<GroupMessage> messages,
                                                     Function<GroupMessage, String> key) {
        return messages.stream()
            .collect(Collectors.groupingBy(key, Collectors.counting()))
            .entrySet().stream()
            .sorted(Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder())
                .thenComparing(Map.Entry.comparingByKey()))
            .limit(TOP_ENTRIES)
            .toList();
    }
}
