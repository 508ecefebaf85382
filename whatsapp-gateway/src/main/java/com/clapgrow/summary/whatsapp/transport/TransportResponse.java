package com.clapgrow.summary.whatsapp.transport;

/**
 * Raw HTTP outcome of a gateway call.
 *
 * @param statusCode HTTP status code
 * @param body       response body, empty string when the remote sent none
 */
public record TransportResponse(int statusCode, String body) {

    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300;
    }
}
