package com.gt.vocab.delivery;

/**
 * Outcome of one delivery pass. {@code skipped} counts claimed items deactivated because their word is not in the
 * catalog; {@code failed} counts items the notifier rejected, sent without a message id, or that could not be marked sent.
 */
public record DeliveryReport(int claimed, int sent, int failed, int skipped) {

    public static final DeliveryReport EMPTY = new DeliveryReport(0, 0, 0, 0);
}
