package com.clapgrow.summary.whatsapp.exception;

/**
 * Classified failure of a gateway operation.
 *
 * Every pending gateway request is resolved either with a value or with this
 * exception. The error code drives both retry decisions in the scheduler and
 * the HTTP status of the control surface.
 *
 * Example usage:
 * <pre>
 * try {
 *     gatewayClient.sendGroupSummary(group, summary);
 * } catch (GatewayException e) {
 *     if (e.getErrorCode() == GatewayErrorCode.NOT_AUTHORIZED) {
 *         // re-authorize out of band, retrying will not help
 *     }
 * }
 * </pre>
 */
public class GatewayException extends RuntimeException {

    private final GatewayErrorCode errorCode;
    private final Integer httpStatusCode;
    private final String responseBody;

    public GatewayException(GatewayErrorCode errorCode, String message) {
        this(errorCode, message, null, null, null);
    }

    public GatewayException(GatewayErrorCode errorCode, String message, Throwable cause) {
        this(errorCode, message, null, null, cause);
    }

    public GatewayException(GatewayErrorCode errorCode, String message, Integer httpStatusCode,
                            String responseBody, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.httpStatusCode = httpStatusCode;
        this.responseBody = responseBody;
    }

    public GatewayErrorCode getErrorCode() {
        return errorCode;
    }

    /**
     * HTTP status of the last remote response, or null when the failure was local or network-level.
     */
    public Integer getHttpStatusCode() {
        return httpStatusCode;
    }

    public String getResponseBody() {
        return responseBody;
    }
}
