package com.clapgrow.summary.whatsapp.service;

import com.clapgrow.summary.common.cache.ResponseCache;
import com.clapgrow.summary.common.group.GroupConfig;
import com.clapgrow.summary.common.retry.BackoffDecision;
import com.clapgrow.summary.common.retry.BackoffPolicy;
import com.clapgrow.summary.common.retry.FailureClassification;
import com.clapgrow.summary.whatsapp.config.GreenApiProperties;
import com.clapgrow.summary.whatsapp.exception.GatewayErrorCode;
import com.clapgrow.summary.whatsapp.exception.GatewayException;
import com.clapgrow.summary.whatsapp.model.GreenApiSendMessageRequest;
import com.clapgrow.summary.whatsapp.model.InstanceState;
import com.clapgrow.summary.whatsapp.model.SendMessageResult;
import com.clapgrow.summary.whatsapp.model.WhatsAppGroup;
import com.clapgrow.summary.whatsapp.transport.GatewayTransport;
import com.clapgrow.summary.whatsapp.transport.TransportException;
import com.clapgrow.summary.whatsapp.transport.TransportResponse;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link GatewayClient} for the Green API WhatsApp gateway.
 *
 * <p>Rules (must not be violated):
 * <ul>
 *   <li>Every outbound call goes through one FIFO queue</li>
 *   <li>Only ONE drain loop runs at a time; calls are made strictly sequentially</li>
 *   <li>The drain loop keeps at least {@code min-request-interval} between the end of one
 *       call and the start of the next, regardless of how fast callers enqueue</li>
 *   <li>A throttled or transiently failed call is retried in place after the backoff delay;
 *       nothing queued behind it is serviced first</li>
 * </ul>
 *
 * <p>Enqueueing is lock-free; the drain loop runs on a dedicated single thread and is
 * started by whichever caller finds it idle.
 */
@Slf4j
public class GreenApiGatewayClient implements GatewayClient, AutoCloseable {

    static final String STATE_ENDPOINT = "getStateInstance";
    static final String CONTACTS_ENDPOINT = "getContacts";
    static final String SEND_MESSAGE_ENDPOINT = "sendMessage";

    private static final String AUTHORIZED_STATE = "authorized";
    private static final String GROUP_CONTACT_TYPE = "group";
    private static final String UNKNOWN_GROUP_NAME = "Unknown Group";
    private static final DateTimeFormatter GENERATED_AT_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

    private final GatewayTransport transport;
    private final GreenApiProperties properties;
    private final GatewayFailureClassifier failureClassifier;
    private final BackoffPolicy backoffPolicy;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Sleeper sleeper;
    private final Counter throttledCounter;

    private final ResponseCache<InstanceState> stateCache;
    private final ResponseCache<List<WhatsAppGroup>> groupsCache;

    private final Queue<QueuedRequest> queue = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean draining = new AtomicBoolean(false);
    private volatile boolean closed;
    private final ExecutorService drainExecutor;

    /** Written and read by the drain thread only. */
    private Instant lastCallFinishedAt;

    public GreenApiGatewayClient(GatewayTransport transport,
                                 GreenApiProperties properties,
                                 GatewayFailureClassifier failureClassifier,
                                 ObjectMapper objectMapper,
                                 Clock clock,
                                 Sleeper sleeper,
                                 MeterRegistry meterRegistry) {
        this.transport = transport;
        this.properties = properties;
        this.failureClassifier = failureClassifier;
        this.backoffPolicy = properties.getBackoff().toPolicy();
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.sleeper = sleeper;
        this.stateCache = new ResponseCache<>("instance-state", properties.getStateCacheTtl(), clock);
        this.groupsCache = new ResponseCache<>("groups", properties.getGroupsCacheTtl(), clock);
        this.throttledCounter = Counter.builder("gateway.requests.throttled")
            .description("Gateway responses with HTTP 429 Too Many Requests")
            .register(meterRegistry);
        this.drainExecutor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "green-api-drain");
            thread.setDaemon(true);
            return thread;
        });
    }

    @Override
    public InstanceState getInstanceState() {
        Optional<InstanceState> cached = stateCache.get(STATE_ENDPOINT);
        if (cached.isPresent()) {
            return cached.get();
        }

        try {
            // no in-place retry on 429: a throttled state check fails open below
            String body = execute(QueuedRequest.of(STATE_ENDPOINT, HttpMethod.GET, null, false));
            JsonNode root = readJson(STATE_ENDPOINT, body);
            JsonNode stateNode = root.get("stateInstance");
            if (stateNode == null || !stateNode.isTextual()) {
                throw new GatewayException(GatewayErrorCode.INVALID_RESPONSE,
                    "Unexpected instance state response: " + body);
            }
            InstanceState state = AUTHORIZED_STATE.equals(stateNode.asText())
                ? InstanceState.AUTHORIZED
                : InstanceState.UNAUTHORIZED;
            log.info("WhatsApp instance state: {} ({})", stateNode.asText(), state);
            stateCache.set(STATE_ENDPOINT, state);
            return state;

        } catch (GatewayException e) {
            if (e.getErrorCode() == GatewayErrorCode.RATE_LIMITED) {
                log.info("Rate limited during instance state check, assuming authorized");
                return InstanceState.AUTHORIZED;
            }
            log.error("Failed to check instance state: {} ({})", e.getMessage(), e.getErrorCode());
            return InstanceState.UNAUTHORIZED;
        }
    }

    @Override
    public List<WhatsAppGroup> listGroups() {
        Optional<List<WhatsAppGroup>> cached = groupsCache.get(CONTACTS_ENDPOINT);
        if (cached.isPresent()) {
            log.debug("Using cached groups data");
            return cached.get();
        }

        if (getInstanceState() != InstanceState.AUTHORIZED) {
            throw new GatewayException(GatewayErrorCode.NOT_AUTHORIZED,
                "WhatsApp instance is not authorized. Please scan the QR code in the Green API console.");
        }

        String body = execute(QueuedRequest.of(CONTACTS_ENDPOINT, HttpMethod.GET, null, true));
        JsonNode root = readJson(CONTACTS_ENDPOINT, body);
        if (!root.isArray()) {
            log.warn("Unexpected response format from {}: {}", CONTACTS_ENDPOINT, abbreviate(body));
            return List.of();
        }

        List<WhatsAppGroup> groups = new ArrayList<>();
        for (JsonNode contact : root) {
            String id = contact.path("id").asText("");
            if (!GROUP_CONTACT_TYPE.equals(contact.path("type").asText()) || id.isBlank()) {
                continue;
            }
            String name = contact.path("name").asText("");
            groups.add(new WhatsAppGroup(
                IdentifierNormalizer.normalize(id),
                name.isBlank() ? UNKNOWN_GROUP_NAME : name,
                contact.hasNonNull("contactName") ? contact.get("contactName").asText() : null));
        }

        List<WhatsAppGroup> result = List.copyOf(groups);
        groupsCache.set(CONTACTS_ENDPOINT, result);
        log.info("Fetched {} groups from WhatsApp gateway", result.size());
        return result;
    }

    @Override
    public SendMessageResult sendMessage(String identifier, String text) {
        if (identifier == null || identifier.isBlank()) {
            throw new GatewayException(GatewayErrorCode.EMPTY_IDENTIFIER, "Chat ID cannot be empty");
        }
        if (text == null || text.isBlank()) {
            throw new GatewayException(GatewayErrorCode.EMPTY_MESSAGE, "Message text cannot be empty");
        }

        String chatId = IdentifierNormalizer.normalize(identifier);
        log.info("Sending message to {} (original id: {}, {} chars)", chatId, identifier, text.length());

        String body = execute(QueuedRequest.of(SEND_MESSAGE_ENDPOINT, HttpMethod.POST,
            GreenApiSendMessageRequest.of(chatId, text), true));

        // The gateway accepted the message at this point; an unreadable body must not turn into a retry
        try {
            JsonNode root = objectMapper.readTree(body);
            String messageId = root.hasNonNull("idMessage") ? root.get("idMessage").asText() : null;
            if (messageId == null) {
                log.warn("Message to {} accepted without idMessage in response: {}", chatId, abbreviate(body));
            }
            return new SendMessageResult(messageId);
        } catch (JsonProcessingException e) {
            log.warn("Message to {} accepted but response could not be parsed: {}", chatId, abbreviate(body));
            return new SendMessageResult(null);
        }
    }

    @Override
    public void sendGroupSummary(GroupConfig group, String text) {
        if (group == null || !IdentifierNormalizer.isGroupChatId(group.groupId())) {
            throw new GatewayException(GatewayErrorCode.INVALID_GROUP_ID,
                "Invalid group ID format. Group ID must include both creator's phone number and timestamp "
                    + "(e.g. \"123456789-1234567890@g.us\"), got: " + (group == null ? null : group.groupId()));
        }
        if (text == null || text.isBlank()) {
            throw new GatewayException(GatewayErrorCode.EMPTY_MESSAGE, "Summary message cannot be empty");
        }

        String message = envelope(text, LocalDateTime.now(clock));
        SendMessageResult result = sendMessage(group.groupId(), message);
        log.info("Sent group summary to {} ({}), message id {}",
            group.displayName(), group.groupId(), result.messageId());
    }

    @Override
    public boolean isConfigured() {
        return properties.isConfigured();
    }

    /**
     * Wrap a summary in the header/footer markers used for every group summary.
     */
    static String envelope(String summary, LocalDateTime generatedAt) {
        return String.join("\n\n",
            "📊 *Group Summary*",
            "-------------------",
            summary,
            "\n_Generated at: " + GENERATED_AT_FORMAT.format(generatedAt) + "_");
    }

    /**
     * Number of requests waiting behind the one currently in flight.
     */
    int pendingRequests() {
        return queue.size();
    }

    @Override
    public void close() {
        closed = true;
        drainExecutor.shutdownNow();
        failQueued("Gateway client closed");
    }

    private String execute(QueuedRequest request) {
        if (closed) {
            throw new GatewayException(GatewayErrorCode.TRANSPORT_ERROR,
                "Gateway client closed, cannot call " + request.endpoint());
        }
        queue.add(request);
        startDrainIfIdle();
        try {
            return request.completion().get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GatewayException(GatewayErrorCode.TRANSPORT_ERROR,
                "Interrupted while waiting for " + request.endpoint(), e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof GatewayException gatewayException) {
                throw gatewayException;
            }
            throw new GatewayException(GatewayErrorCode.TRANSPORT_ERROR,
                "Unexpected failure calling " + request.endpoint(), e.getCause());
        }
    }

    private void startDrainIfIdle() {
        if (!draining.compareAndSet(false, true)) {
            return;
        }
        try {
            drainExecutor.execute(this::drain);
        } catch (RejectedExecutionException e) {
            draining.set(false);
            failQueued("Gateway client is shut down");
        }
    }

    private void drain() {
        try {
            QueuedRequest request;
            while (!closed && (request = queue.poll()) != null) {
                process(request);
            }
        } finally {
            draining.set(false);
        }
        // a caller may have enqueued after the last poll but before the flag was cleared
        if (closed) {
            failQueued("Gateway client closed");
        } else if (!queue.isEmpty()) {
            startDrainIfIdle();
        }
    }

    private void process(QueuedRequest request) {
        int attempt = 0;
        while (true) {
            Integer statusCode = null;
            String responseBody = null;
            TransportException transportFailure = null;

            try {
                awaitRequestSlot();
                TransportResponse response = transport.exchange(request.method(), urlFor(request.endpoint()),
                    request.payload());
                if (response.isSuccessful()) {
                    request.completion().complete(response.body());
                    return;
                }
                statusCode = response.statusCode();
                responseBody = response.body();
            } catch (TransportException e) {
                transportFailure = e;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                reject(request, new GatewayException(GatewayErrorCode.TRANSPORT_ERROR,
                    "Interrupted before calling " + request.endpoint(), e));
                return;
            } catch (RuntimeException e) {
                reject(request, new GatewayException(GatewayErrorCode.TRANSPORT_ERROR,
                    "Unexpected transport failure calling " + request.endpoint() + ": " + e.getMessage(), e));
                return;
            } finally {
                lastCallFinishedAt = clock.instant();
            }

            FailureClassification classification = failureClassifier.classify(statusCode);
            String failure = transportFailure != null
                ? transportFailure.getMessage()
                : "HTTP " + statusCode + " from " + request.endpoint();

            if (classification == FailureClassification.RATE_LIMIT) {
                throttledCounter.increment();
                if (!request.retryThrottling()) {
                    reject(request, new GatewayException(GatewayErrorCode.RATE_LIMITED,
                        "Rate limited calling " + request.endpoint(), statusCode, responseBody, null));
                    return;
                }
            }

            BackoffDecision decision = backoffPolicy.nextDelay(attempt, classification);
            switch (decision.outcome()) {
                case RETRY -> {
                    log.warn("{} failed ({}), retrying in {}ms (attempt {}/{})", request.endpoint(), failure,
                        decision.delay().toMillis(), attempt + 1, backoffPolicy.maxRetries());
                    try {
                        sleeper.sleep(decision.delay());
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        reject(request, new GatewayException(GatewayErrorCode.TRANSPORT_ERROR,
                            "Interrupted during backoff for " + request.endpoint(), e));
                        return;
                    }
                    attempt++;
                }
                case EXHAUSTED -> {
                    log.error("{} failed after {} retries: {}", request.endpoint(), attempt, failure);
                    reject(request, new GatewayException(failureClassifier.exhaustedCode(classification),
                        failure + " (gave up after " + attempt + " retries)", statusCode, responseBody,
                        transportFailure));
                    return;
                }
                case NON_RETRYABLE -> {
                    GatewayErrorCode code = failureClassifier.nonRetryableCode(statusCode, responseBody);
                    log.error("{} rejected by gateway with {}: {}", request.endpoint(), code, abbreviate(responseBody));
                    reject(request, new GatewayException(code, failure, statusCode, responseBody, null));
                    return;
                }
            }
        }
    }

    private void awaitRequestSlot() throws InterruptedException {
        if (lastCallFinishedAt == null) {
            return;
        }
        Duration elapsed = Duration.between(lastCallFinishedAt, clock.instant());
        Duration remaining = properties.getMinRequestInterval().minus(elapsed);
        if (!remaining.isNegative() && !remaining.isZero()) {
            sleeper.sleep(remaining);
        }
    }

    private void reject(QueuedRequest request, GatewayException failure) {
        request.completion().completeExceptionally(failure);
    }

    private void failQueued(String reason) {
        QueuedRequest pending;
        while ((pending = queue.poll()) != null) {
            reject(pending, new GatewayException(GatewayErrorCode.TRANSPORT_ERROR,
                reason + " before " + pending.endpoint() + " was sent"));
        }
    }

    private String urlFor(String endpoint) {
        return properties.getBaseUrl() + "/waInstance" + properties.getIdInstance()
            + "/" + endpoint + "/" + properties.getApiToken();
    }

    private JsonNode readJson(String endpoint, String body) {
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new GatewayException(GatewayErrorCode.INVALID_RESPONSE,
                "Unreadable response from " + endpoint + ": " + abbreviate(body), e);
        }
    }

    private static String abbreviate(String body) {
        if (body == null) {
            return null;
        }
        return body.length() > 200 ? body.substring(0, 200) + "..." : body;
    }
}
