package com.gt.vocab.delivery;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.UUID;

// Default notifier for deployments without a transport. Writes the reminder to the log and assigns a random message id.
public class LoggingReviewNotifier implements ReviewNotifier {

    private static final Logger log = LoggerFactory.getLogger(LoggingReviewNotifier.class);

    @Override
    public String send(String userId, ReviewPayload payload) {
        String messageId = UUID.randomUUID().toString();

        log.info("Review reminder {} for user {}: word {} ({})", messageId, userId, payload.wordId(), payload.text());

        return messageId;
    }
}
