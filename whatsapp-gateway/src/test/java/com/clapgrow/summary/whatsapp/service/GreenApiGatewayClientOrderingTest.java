package com.clapgrow.summary.whatsapp.service;

import com.clapgrow.summary.whatsapp.config.GreenApiProperties;
import com.clapgrow.summary.whatsapp.model.GreenApiSendMessageRequest;
import com.clapgrow.summary.whatsapp.support.MutableClock;
import com.clapgrow.summary.whatsapp.support.RecordingSleeper;
import com.clapgrow.summary.whatsapp.transport.GatewayTransport;
import com.clapgrow.summary.whatsapp.transport.TransportResponse;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Queue discipline of the gateway client under concurrent callers.
 */
class GreenApiGatewayClientOrderingTest {

    private final List<String> sentMessages = new CopyOnWriteArrayList<>();
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger maxInFlight = new AtomicInteger();
    private final CountDownLatch firstCallEntered = new CountDownLatch(1);
    private final CountDownLatch releaseFirstCall = new CountDownLatch(1);

    private GreenApiGatewayClient client;
    private ExecutorService callers;

    @BeforeEach
    void setUp() {
        GatewayTransport blockingTransport = (HttpMethod method, String url, Object body) -> {
            int current = inFlight.incrementAndGet();
            maxInFlight.accumulateAndGet(current, Math::max);
            try {
                String message = ((GreenApiSendMessageRequest) body).getMessage();
                if (sentMessages.isEmpty()) {
                    firstCallEntered.countDown();
                    awaitQuietly(releaseFirstCall);
                }
                sentMessages.add(message);
                return new TransportResponse(200, "{\"idMessage\":\"" + message + "\"}");
            } finally {
                inFlight.decrementAndGet();
            }
        };

        GreenApiProperties properties = new GreenApiProperties();
        properties.setIdInstance("1101");
        properties.setApiToken("token");
        properties.setMinRequestInterval(Duration.ZERO);

        client = new GreenApiGatewayClient(blockingTransport, properties, new GatewayFailureClassifier(),
            new ObjectMapper(), new MutableClock(Instant.parse("2024-05-01T08:00:00Z")), new RecordingSleeper(),
            new SimpleMeterRegistry());
        callers = Executors.newFixedThreadPool(3);
    }

    @AfterEach
    void tearDown() {
        releaseFirstCall.countDown();
        callers.shutdownNow();
        client.close();
    }

    @Test
    void testConcurrentCallers_ServedInEnqueueOrderOneAtATime() throws Exception {
        Future<?> first = callers.submit(() -> client.sendMessage("15550000001", "first"));
        assertTrue(firstCallEntered.await(5, TimeUnit.SECONDS));

        Future<?> second = callers.submit(() -> client.sendMessage("15550000002", "second"));
        awaitCondition(() -> client.pendingRequests() == 1);
        Future<?> third = callers.submit(() -> client.sendMessage("15550000003", "third"));
        awaitCondition(() -> client.pendingRequests() == 2);

        releaseFirstCall.countDown();
        first.get(5, TimeUnit.SECONDS);
        second.get(5, TimeUnit.SECONDS);
        third.get(5, TimeUnit.SECONDS);

        assertEquals(List.of("first", "second", "third"), sentMessages);
        assertEquals(1, maxInFlight.get());
        assertEquals(0, client.pendingRequests());
    }

    @Test
    void testClose_FailsRequestsStillQueued() throws Exception {
        Future<?> first = callers.submit(() -> client.sendMessage("15550000001", "first"));
        assertTrue(firstCallEntered.await(5, TimeUnit.SECONDS));
        Future<?> queued = callers.submit(() -> client.sendMessage("15550000002", "queued"));
        awaitCondition(() -> client.pendingRequests() == 1);

        client.close();

        Exception failure = assertThrows(Exception.class, () -> queued.get(5, TimeUnit.SECONDS));
        assertInstanceOf(com.clapgrow.summary.whatsapp.exception.GatewayException.class, failure.getCause());
        assertFalse(sentMessages.contains("queued"));
        first.cancel(true);
    }

    private static void awaitCondition(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail("Condition not met within 5 seconds");
            }
            Thread.sleep(5);
        }
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
