package com.gt.vocab.delivery;

/**
 * Transport that delivers a review reminder to a user.
 */
public interface ReviewNotifier {

    /**
     * Sends the reminder and returns the transport's id for the message. Must throw rather than return when the
     * message was not accepted, since a returned id marks the review as sent.
     */
    String send(String userId, ReviewPayload payload) throws NotificationException;
}
