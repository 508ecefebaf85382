package com.clapgrow.summary.whatsapp.service;

import com.clapgrow.summary.common.retry.FailureClassification;
import com.clapgrow.summary.whatsapp.exception.GatewayErrorCode;
import org.springframework.stereotype.Component;

/**
 * Classifies gateway responses to determine retry strategy.
 *
 * Classification rules:
 * - RATE_LIMIT: HTTP 429 Too Many Requests
 * - TRANSIENT: no response at all (network failure) or HTTP 5xx
 * - PERMANENT: authorization failures (401, 403) and every other 4xx
 */
@Component
public class GatewayFailureClassifier {

    /**
     * @param httpStatusCode HTTP status code, null when the call failed at network level
     * @return failure classification
     */
    public FailureClassification classify(Integer httpStatusCode) {
        if (httpStatusCode == null) {
            return FailureClassification.TRANSIENT;
        }
        if (httpStatusCode == 429) {
            return FailureClassification.RATE_LIMIT;
        }
        if (httpStatusCode >= 500) {
            return FailureClassification.TRANSIENT;
        }
        return FailureClassification.PERMANENT;
    }

    /**
     * Error code for a failure the drain loop will not retry.
     *
     * @param httpStatusCode HTTP status code (may be null)
     * @param responseBody   response body (may be null)
     * @return NOT_AUTHORIZED for authorization failures, REQUEST_REJECTED otherwise
     */
    public GatewayErrorCode nonRetryableCode(Integer httpStatusCode, String responseBody) {
        if (httpStatusCode != null && (httpStatusCode == 401 || httpStatusCode == 403)) {
            return GatewayErrorCode.NOT_AUTHORIZED;
        }
        if (responseBody != null) {
            String lowerResponse = responseBody.toLowerCase();
            if (lowerResponse.contains("not authorized") || lowerResponse.contains("unauthorized")) {
                return GatewayErrorCode.NOT_AUTHORIZED;
            }
        }
        return GatewayErrorCode.REQUEST_REJECTED;
    }

    /**
     * Error code once the backoff budget for a retryable failure is spent.
     */
    public GatewayErrorCode exhaustedCode(FailureClassification classification) {
        return classification == FailureClassification.RATE_LIMIT
            ? GatewayErrorCode.RATE_LIMITED
            : GatewayErrorCode.TRANSPORT_ERROR;
    }
}
