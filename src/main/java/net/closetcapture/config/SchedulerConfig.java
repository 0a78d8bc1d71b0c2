package net.closetcapture.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Schedulers and clock shared by the capture pipeline.
 *
 * <p>Blocking file and image work runs on {@link #IO_SCHEDULER}; processing timeouts are timed on
 * {@link #TIMER_SCHEDULER}. Both are beans so tests can substitute immediate or virtual-time
 * schedulers.</p>
 */
@Configuration
public class SchedulerConfig {

    public static final String IO_SCHEDULER = "captureIoScheduler";
    public static final String TIMER_SCHEDULER = "captureTimerScheduler";

    @Bean(name = IO_SCHEDULER)
    public Scheduler captureIoScheduler() {
        return Schedulers.boundedElastic();
    }

    @Bean(name = TIMER_SCHEDULER)
    public Scheduler captureTimerScheduler() {
        return Schedulers.parallel();
    }

    @Bean
    public Clock captureClock() {
        return Clock.systemUTC();
    }
}
