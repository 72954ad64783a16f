package com.gt.vocab.delivery;

// Raised by a notifier when a review message could not be handed to the transport
public class NotificationException extends Exception {

    public NotificationException(String errMsg) {
        super(errMsg);
    }

    public NotificationException(String errMsg, Throwable cause) {
        super(errMsg, cause);
    }
}
