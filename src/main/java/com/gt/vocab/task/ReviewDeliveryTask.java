package com.gt.vocab.task;

import com.gt.vocab.delivery.DeliveryCoordinator;
import com.gt.vocab.exception.DaoException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(value = "vocab.delivery.enabled", havingValue = "true")
public class ReviewDeliveryTask {

    private static final Logger log = LoggerFactory.getLogger(ReviewDeliveryTask.class);

    private final DeliveryCoordinator deliveryCoordinator;
    private final int batchSize;

    public ReviewDeliveryTask(DeliveryCoordinator deliveryCoordinator,
                              @Value("${vocab.delivery.batchSize:10}") int batchSize) {
        this.deliveryCoordinator = deliveryCoordinator;

        this.batchSize = batchSize;
    }

    @Scheduled(fixedDelayString = "${vocab.delivery.tickMs:60000}", initialDelayString = "${vocab.delivery.tickMs:60000}")
    public void deliverDueReviews() {
        try {
            deliveryCoordinator.deliver(batchSize);
        } catch (DaoException ex) {
            log.error("Review delivery tick failed, retrying on next tick", ex);
        }
    }
}
