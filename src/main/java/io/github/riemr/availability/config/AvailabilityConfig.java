package io.github.riemr.availability.config;

import io.github.riemr.availability.application.cache.InMemoryAvailabilityCache;
import io.github.riemr.availability.domain.model.BusinessHours;
import io.github.riemr.availability.domain.model.JobTiming;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;

@Configuration
public class AvailabilityConfig {

    @Value("${availability.business-hours.start-hour:9}")
    private int startHour;

    @Value("${availability.business-hours.end-hour:18}")
    private int endHour;

    @Value("${availability.business-hours.slot-minutes:60}")
    private int slotMinutes;

    @Value("${availability.business-hours.zone:America/Los_Angeles}")
    private String zone;

    @Value("${availability.job.buffer-before-minutes:60}")
    private long bufferBeforeMinutes;

    @Value("${availability.job.buffer-after-minutes:60}")
    private long bufferAfterMinutes;

    @Value("${availability.job.service-minutes:60}")
    private long serviceMinutes;

    @Value("${availability.cache.max-size:1000}")
    private int cacheMaxSize;

    @Value("${availability.cache.ttl.default:PT5M}")
    private Duration cacheDefaultTtl;

    @Value("${availability.cache.sweep-interval:PT5M}")
    private Duration cacheSweepInterval;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public BusinessHours businessHours() {
        return new BusinessHours(startHour, endHour, slotMinutes, ZoneId.of(zone));
    }

    @Bean
    public JobTiming jobTiming() {
        return JobTiming.ofMinutes(bufferBeforeMinutes, bufferAfterMinutes, serviceMinutes);
    }

    /** The sweep timer lives and dies with the application context. */
    @Bean(initMethod = "start", destroyMethod = "stop")
    public InMemoryAvailabilityCache availabilityCache(Clock clock) {
        return new InMemoryAvailabilityCache(clock, cacheMaxSize, cacheDefaultTtl, cacheSweepInterval);
    }
}
