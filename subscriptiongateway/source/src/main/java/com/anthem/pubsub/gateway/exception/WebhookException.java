package com.anthem.pubsub.gateway.exception;

/**
 * Transport-level failure of a webhook call (connection error, timeout,
 * non-2xx status or an unreadable body).
 */
public class WebhookException extends RuntimeException {

    private final String url;

    public WebhookException(String url, String message) {
        super(message);
        this.url = url;
    }

    public WebhookException(String url, String message, Throwable cause) {
        super(message, cause);
        this.url = url;
    }

    public String getUrl() {
        return url;
    }
}
