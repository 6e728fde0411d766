package com.ridematch.dispatch.config;

import com.ridematch.shared.featureflag.FeatureFlagService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Seeds the dispatch feature flags on startup without overwriting values
 * already present in Redis.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class FeatureFlagInitializer {

    private final FeatureFlagService featureFlagService;

    @Bean
    public ApplicationRunner seedDispatchFlags() {
        return args -> {
            featureFlagService.initDefaults(FeatureFlagService.DEFAULT_SCOPE);
            log.info("Dispatch feature flags initialised for scope={}", FeatureFlagService.DEFAULT_SCOPE);
        };
    }
}
