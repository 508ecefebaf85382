package com.clapgrow.summary.scheduler.service;

import com.clapgrow.summary.common.group.GroupConfig;
import com.clapgrow.summary.common.retry.BackoffDecision;
import com.clapgrow.summary.common.retry.BackoffPolicy;
import com.clapgrow.summary.common.retry.FailureClassification;
import com.clapgrow.summary.scheduler.config.SchedulerProperties;
import com.clapgrow.summary.scheduler.model.GroupMessage;
import com.clapgrow.summary.scheduler.model.ScheduledTask;
import com.clapgrow.summary.scheduler.model.TaskState;
import com.clapgrow.summary.scheduler.model.TaskStatus;
import com.clapgrow.summary.scheduler.store.ConfigurationStore;
import com.clapgrow.summary.whatsapp.exception.GatewayException;
import com.clapgrow.summary.whatsapp.service.GatewayClient;
import com.clapgrow.summary.whatsapp.service.IdentifierNormalizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * Delivers group summaries on each group's cadence.
 *
 * <p>One task per enrolled group. A periodic evaluation fires every task that is due and
 * not already running; the firing task immediately gets the next regular slot as a
 * provisional next run, and the delivery itself runs on the delivery executor:
 * messages since the last success are read from the store, turned into a summary by the
 * content producer and sent through the gateway client.
 *
 * <p>Failed deliveries are retried with the delivery backoff policy. Once the policy gives
 * up (or the failure is not retryable) the task falls back to its next regular slot with
 * the error recorded; one group failing never affects the others.
 *
 * <p>The task map is only changed through atomic per-key replacements. A delivery result is
 * applied only if the task still carries the enrollment id it was fired with, so results
 * of unenrolled or re-enrolled groups are discarded.
 */
@Service
@Slf4j
public class DeliveryScheduler {

    static final String EXHAUSTED_PREFIX = "EXHAUSTED: ";

    private final ConcurrentMap<String, ScheduledTask> tasks = new ConcurrentHashMap<>();
    private final AtomicLong enrollmentSequence = new AtomicLong();
    private final AtomicBoolean running;

    private final GatewayClient gatewayClient;
    private final ConfigurationStore configurationStore;
    private final ContentProducer contentProducer;
    private final BackoffPolicy backoffPolicy;
    private final Executor deliveryExecutor;
    private final DeliveryMetrics metrics;
    private final SchedulerProperties properties;
    private final Clock clock;

    public DeliveryScheduler(GatewayClient gatewayClient,
                             ConfigurationStore configurationStore,
                             ContentProducer contentProducer,
                             @Qualifier("deliveryBackoffPolicy") BackoffPolicy backoffPolicy,
                             @Qualifier("deliveryExecutor") Executor deliveryExecutor,
                             DeliveryMetrics metrics,
                             SchedulerProperties properties,
                             Clock clock) {
        this.gatewayClient = gatewayClient;
        this.configurationStore = configurationStore;
        this.contentProducer = contentProducer;
        this.backoffPolicy = backoffPolicy;
        this.deliveryExecutor = deliveryExecutor;
        this.metrics = metrics;
        this.properties = properties;
        this.clock = clock;
        this.running = new AtomicBoolean(properties.isAutoStart());
    }

    /**
     * Enroll a group, or replace its task when already enrolled. The next run is computed
     * from the new cadence; a disabled config unenrolls the group.
     */
    public void enroll(GroupConfig config) {
        String groupId = IdentifierNormalizer.normalize(config.groupId());
        if (!config.enabled()) {
            unenroll(groupId);
            return;
        }
        GroupConfig normalized = groupId.equals(config.groupId())
            ? config
            : new GroupConfig(groupId, config.name(), config.cadence(), true);
        LocalDateTime nextRun = CadenceCalculator.computeNextRegularRun(normalized.cadence(), now());
        long enrollmentId = enrollmentSequence.incrementAndGet();

        tasks.compute(groupId, (id, previous) -> ScheduledTask.enrolled(normalized, nextRun, previous,
            enrollmentId));
        log.info("Enrolled group {} ({}) with {} cadence at {}, next run {}", normalized.displayName(), groupId,
            normalized.cadence().frequency(), normalized.cadence().time(), nextRun);
    }

    /**
     * Remove a group's task. An in-flight delivery is not aborted; its result is discarded.
     *
     * @return true if the group was enrolled
     */
    public boolean unenroll(String groupId) {
        ScheduledTask removed = tasks.remove(IdentifierNormalizer.normalize(groupId));
        if (removed != null) {
            log.info("Unenrolled group {} ({})", removed.config().displayName(), removed.groupId());
        }
        return removed != null;
    }

    public Optional<TaskStatus> getTaskStatus(String groupId) {
        return Optional.ofNullable(tasks.get(IdentifierNormalizer.normalize(groupId)))
            .map(ScheduledTask::toStatus);
    }

    public List<TaskStatus> listTaskStatuses() {
        List<TaskStatus> statuses = new ArrayList<>();
        tasks.values().forEach(task -> statuses.add(task.toStatus()));
        statuses.sort(Comparator.comparing(TaskStatus::groupId));
        return statuses;
    }

    public void start() {
        if (running.compareAndSet(false, true)) {
            log.info("Delivery scheduler started with {} enrolled groups", tasks.size());
        }
    }

    /**
     * Stop evaluating tasks. Enrollments are kept; deliveries already running complete normally.
     */
    public void stop() {
        if (running.compareAndSet(true, false)) {
            log.info("Delivery scheduler stopped");
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    @Scheduled(fixedRateString = "${summary.scheduler.poll-interval-ms:60000}")
    public void evaluate() {
        if (!running.get()) {
            log.debug("Delivery scheduler is stopped, skipping evaluation");
            return;
        }
        LocalDateTime now = now();
        for (String groupId : tasks.keySet()) {
            try {
                evaluateTask(groupId, now);
            } catch (RuntimeException e) {
                log.error("Failed to evaluate schedule of group {}: {}", groupId, e.getMessage(), e);
            }
        }
    }

    private void evaluateTask(String groupId, LocalDateTime now) {
        AtomicReference<ScheduledTask> fired = new AtomicReference<>();
        tasks.computeIfPresent(groupId, (id, task) -> {
            if (!task.isDue(now)) {
                return task;
            }
            ScheduledTask firing = task.firing(CadenceCalculator.computeNextRegularRun(task.config().cadence(), now));
            fired.set(firing);
            return firing;
        });

        ScheduledTask task = fired.get();
        if (task == null) {
            return;
        }
        log.info("Firing summary delivery for group {} (retry {})", task.config().displayName(), task.retryCount());
        try {
            deliveryExecutor.execute(() -> deliver(task, now));
        } catch (RejectedExecutionException e) {
            onFailure(task, e);
        }
    }

    private void deliver(ScheduledTask task, LocalDateTime firedAt) {
        GroupConfig group = task.config();
        try {
            LocalDateTime windowEnd = now();
            LocalDateTime since = task.summarizedUntil() != null
                ? task.summarizedUntil()
                : firedAt.minus(group.cadence().frequency().getPeriod());
            // messages stamped after windowEnd belong to the next window
            List<GroupMessage> messages = configurationStore.getMessagesSince(group.groupId(), since).stream()
                .filter(message -> !message.timestamp().isAfter(windowEnd))
                .toList();
            String summary = contentProducer.produceSummary(messages);

            if (properties.isDryRun()) {
                log.info("[dry-run] Summary for group {} ({} messages):\n{}", group.displayName(),
                    messages.size(), summary);
            } else {
                gatewayClient.sendGroupSummary(group, summary);
            }
            onSuccess(task, windowEnd);
        } catch (RuntimeException e) {
            onFailure(task, e);
        }
    }

    private void onSuccess(ScheduledTask task, LocalDateTime windowEnd) {
        metrics.recordDelivered();
        LocalDateTime completedAt = now();
        LocalDateTime nextRun = CadenceCalculator.computeNextRegularRun(task.config().cadence(), completedAt);
        if (applyIfCurrent(task, current -> current.succeeded(nextRun, completedAt, windowEnd))) {
            log.info("Delivered summary to group {}, next run {}", task.config().displayName(), nextRun);
        }
    }

    private void onFailure(ScheduledTask task, Exception failure) {
        metrics.recordFailed();
        LocalDateTime failedAt = now();
        String error = describe(failure);
        BackoffDecision decision = backoffPolicy.nextDelay(task.retryCount(), classify(failure));

        if (decision.shouldRetry()) {
            LocalDateTime retryAt = failedAt.plus(decision.delay());
            if (applyIfCurrent(task, current -> current.retrying(retryAt, error))) {
                metrics.recordRetried();
                log.warn("Summary delivery for group {} failed ({}), retry {}/{} at {}",
                    task.config().displayName(), error, task.retryCount() + 1, backoffPolicy.maxRetries(), retryAt);
            }
            return;
        }

        boolean exhausted = decision.outcome() == BackoffDecision.Outcome.EXHAUSTED;
        String lastError = exhausted ? EXHAUSTED_PREFIX + error : error;
        LocalDateTime nextRun = CadenceCalculator.computeNextRegularRun(task.config().cadence(), failedAt);
        if (applyIfCurrent(task, current -> current.fellBack(nextRun, lastError))) {
            if (exhausted) {
                metrics.recordExhausted();
            }
            log.error("Summary delivery for group {} failed ({}), giving up until next run {}",
                task.config().displayName(), lastError, nextRun);
        }
    }

    /**
     * Replace the task only if it is still the enrollment that was fired.
     */
    private boolean applyIfCurrent(ScheduledTask fired, UnaryOperator<ScheduledTask> transition) {
        AtomicBoolean applied = new AtomicBoolean(false);
        tasks.computeIfPresent(fired.groupId(), (id, current) -> {
            if (current.enrollmentId() != fired.enrollmentId() || current.state() != TaskState.RUNNING) {
                return current;
            }
            applied.set(true);
            return transition.apply(current);
        });
        if (!applied.get()) {
            log.info("Discarding delivery result for group {}: it was unenrolled or re-enrolled meanwhile",
                fired.groupId());
        }
        return applied.get();
    }

    private static FailureClassification classify(Exception failure) {
        if (failure instanceof GatewayException gatewayException) {
            return switch (gatewayException.getErrorCode()) {
                case RATE_LIMITED -> FailureClassification.RATE_LIMIT;
                case TRANSPORT_ERROR, INVALID_RESPONSE -> FailureClassification.TRANSIENT;
                default -> FailureClassification.PERMANENT;
            };
        }
        return FailureClassification.TRANSIENT;
    }

    private static String describe(Exception failure) {
        if (failure instanceof GatewayException gatewayException) {
            return gatewayException.getErrorCode() + ": " + gatewayException.getMessage();
        }
        return failure.getClass().getSimpleName() + ": " + failure.getMessage();
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }
}
