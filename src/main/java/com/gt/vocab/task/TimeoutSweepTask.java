package com.gt.vocab.task;

import com.gt.vocab.delivery.TimeoutSweeper;
import com.gt.vocab.exception.DaoException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(value = "vocab.delivery.enabled", havingValue = "true")
public class TimeoutSweepTask {

    private static final Logger log = LoggerFactory.getLogger(TimeoutSweepTask.class);

    private final TimeoutSweeper timeoutSweeper;

    public TimeoutSweepTask(TimeoutSweeper timeoutSweeper) {
        this.timeoutSweeper = timeoutSweeper;
    }

    @Scheduled(fixedDelayString = "${vocab.delivery.sweepTickMs:300000}", initialDelayString = "${vocab.delivery.sweepTickMs:300000}")
    public void sweepTimedOutReviews() {
        try {
            timeoutSweeper.sweep();
        } catch (DaoException ex) {
            log.error("Timeout sweep failed, retrying on next tick", ex);
        }
    }
}
