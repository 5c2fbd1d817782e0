package com.csd.pkghealth.config;

import com.csd.pkghealth.service.PackageCache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@Slf4j
public class CacheConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Process-wide metadata/tree cache shared by every scan.
     */
    @Bean
    public PackageCache packageCache(AnalyzerProperties properties, Clock clock) {
        AnalyzerProperties.Cache cache = properties.getCache();
        log.info("Package cache enabled={} ttl={}", cache.isEnabled(), cache.getTtl());
        return new PackageCache(cache.isEnabled(), cache.getTtl(), clock);
    }
}
