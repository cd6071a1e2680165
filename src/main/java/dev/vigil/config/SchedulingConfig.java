package dev.vigil.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

/**
 * Scheduling configuration.
 *
 * <p>TRADEOFF: one scheduler thread vs. a pool.
 * All periodic work (model catalog refresh, working tree polling, shadow reviews) runs on a
 * single thread. Request volume is one interactive user, and a single thread guarantees that
 * two poll ticks never overlap, so the snapshot and the review state are never touched
 * concurrently by the automatic path. The price is that a slow chat completion delays the
 * next model refresh tick, which is acceptable at seconds-scale reaction times.
 *
 * <p>Each tick starts with a clean MDC so a review's correlation id never leaks into the
 * next tick's log lines.
 */
@Configuration
public class SchedulingConfig {

    private static final Logger log = LoggerFactory.getLogger(SchedulingConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ThreadPoolTaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("vigil-tick-");
        scheduler.setTaskDecorator(new MdcClearingTaskDecorator());
        scheduler.setErrorHandler(t -> log.warn("Scheduled tick failed: {}", t.getMessage(), t));
        return scheduler;
    }

    static class MdcClearingTaskDecorator implements TaskDecorator {
        @Override
        public Runnable decorate(Runnable runnable) {
            return () -> {
                try {
                    runnable.run();
                } finally {
                    MDC.clear();
                }
            };
        }
    }
}
