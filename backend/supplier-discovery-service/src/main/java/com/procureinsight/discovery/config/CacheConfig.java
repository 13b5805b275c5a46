package com.procureinsight.discovery.config;

import com.procureinsight.discovery.cache.TtlCache;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Process-wide cache and clock.
 *
 * One {@link TtlCache} lives for the whole process and is handed to every component that
 * memoizes provider calls.
 */
@Configuration
public class CacheConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public TtlCache<Object> discoveryCache(Clock clock) {
        return new TtlCache<>(clock);
    }
}
