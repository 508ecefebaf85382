package com.clapgrow.summary.whatsapp.service;

import com.clapgrow.summary.common.retry.FailureClassification;
import com.clapgrow.summary.whatsapp.exception.GatewayErrorCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class GatewayFailureClassifierTest {

    private GatewayFailureClassifier classifier;

    @BeforeEach
    void setUp() {
        classifier = new GatewayFailureClassifier();
    }

    @Test
    void testClassify_RateLimit() {
        assertEquals(FailureClassification.RATE_LIMIT, classifier.classify(429));
    }

    @Test
    void testClassify_TransientFailures() {
        assertEquals(FailureClassification.TRANSIENT, classifier.classify(null));
        assertEquals(FailureClassification.TRANSIENT, classifier.classify(500));
        assertEquals(FailureClassification.TRANSIENT, classifier.classify(503));
    }

    @Test
    void testClassify_PermanentFailures() {
        assertEquals(FailureClassification.PERMANENT, classifier.classify(400));
        assertEquals(FailureClassification.PERMANENT, classifier.classify(401));
        assertEquals(FailureClassification.PERMANENT, classifier.classify(403));
        assertEquals(FailureClassification.PERMANENT, classifier.classify(404));
    }

    @Test
    void testNonRetryableCode_AuthorizationFailures() {
        assertEquals(GatewayErrorCode.NOT_AUTHORIZED, classifier.nonRetryableCode(401, null));
        assertEquals(GatewayErrorCode.NOT_AUTHORIZED, classifier.nonRetryableCode(403, ""));
        assertEquals(GatewayErrorCode.NOT_AUTHORIZED,
            classifier.nonRetryableCode(400, "{\"message\":\"Instance Not Authorized\"}"));
    }

    @Test
    void testNonRetryableCode_OtherRejections() {
        assertEquals(GatewayErrorCode.REQUEST_REJECTED, classifier.nonRetryableCode(400, "{\"message\":\"bad chatId\"}"));
        assertEquals(GatewayErrorCode.REQUEST_REJECTED, classifier.nonRetryableCode(404, null));
    }

    @Test
    void testExhaustedCode() {
        assertEquals(GatewayErrorCode.RATE_LIMITED, classifier.exhaustedCode(FailureClassification.RATE_LIMIT));
        assertEquals(GatewayErrorCode.TRANSPORT_ERROR, classifier.exhaustedCode(FailureClassification.TRANSIENT));
    }
}
