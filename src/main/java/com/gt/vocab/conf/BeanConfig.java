package com.gt.vocab.conf;

import com.gt.vocab.delivery.LoggingReviewNotifier;
import com.gt.vocab.delivery.ReviewNotifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class BeanConfig {

    // All scheduling and delivery timestamps are taken from this clock
    @Bean
    public Clock getClock() {
        return Clock.systemUTC();
    }

    @Bean
    public ReviewNotifier getReviewNotifier() {
        return new LoggingReviewNotifier();
    }
}
