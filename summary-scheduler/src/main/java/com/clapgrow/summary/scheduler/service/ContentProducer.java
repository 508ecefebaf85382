package com.clapgrow.summary.scheduler.service;

import com.clapgrow.summary.scheduler.model.GroupMessage;

import java.util.List;

/**
 * Produces the summary text for a group's messages. Any runtime exception is treated
 * as a transient delivery failure and retried by the scheduler.
 */
@FunctionalInterface
public interface ContentProducer {

    String produceSummary(List<GroupMessage> messages);
}
