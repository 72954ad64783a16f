package com.gt.vocab.delivery;

import com.gt.vocab.reviewItem.ReviewItemStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;

@Component
public class TimeoutSweeper {

    private static final Logger log = LoggerFactory.getLogger(TimeoutSweeper.class);

    private final ReviewItemStore reviewItemStore;
    private final Clock clock;
    private final int timeoutMinutes;
    private final int claimTimeoutMinutes;

    @Autowired
    public TimeoutSweeper(ReviewItemStore reviewItemStore,
                          Clock clock,
                          @Value("${vocab.delivery.timeoutMinutes:1440}") int timeoutMinutes,
                          @Value("${vocab.delivery.claimTimeoutMinutes:15}") int claimTimeoutMinutes) {
        this.reviewItemStore = reviewItemStore;
        this.clock = clock;

        this.timeoutMinutes = requirePositive(timeoutMinutes);
        this.claimTimeoutMinutes = requirePositive(claimTimeoutMinutes);
    }

    public int sweep() {
        return processTimeouts(timeoutMinutes) + releaseStaleClaims();
    }

    public int processTimeouts(int timeoutMinutes) {
        int resetCnt = reviewItemStore.processTimeouts(Duration.ofMinutes(requirePositive(timeoutMinutes)), clock.instant());

        log.info("Processed delivery timeouts. {} unanswered reviews returned to due.", resetCnt);
        return resetCnt;
    }

    // Claims never marked sent belong to a worker that stopped between claim and send
    public int releaseStaleClaims() {
        int releasedCnt = reviewItemStore.releaseStaleClaims(Duration.ofMinutes(claimTimeoutMinutes), clock.instant());

        if (releasedCnt > 0) {
            log.info("Released {} stale review claims.", releasedCnt);
        }
        return releasedCnt;
    }

    public int getTimeoutMinutes() {
        return timeoutMinutes;
    }

    private static int requirePositive(int minutes) {
        if (minutes <= 0) {
            throw new IllegalArgumentException("Timeout must be a positive number of minutes, got " + minutes);
        }
        return minutes;
    }
}
