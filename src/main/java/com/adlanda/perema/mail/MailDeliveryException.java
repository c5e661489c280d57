package com.adlanda.perema.mail;

/**
 * A mail could not be handed over to the provider.
 */
public class MailDeliveryException extends RuntimeException {

    private final int statusCode;

    public MailDeliveryException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public MailDeliveryException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    /**
     * HTTP status returned by the provider, or -1 if no response was received.
     */
    public int getStatusCode() {
        return statusCode;
    }
}
