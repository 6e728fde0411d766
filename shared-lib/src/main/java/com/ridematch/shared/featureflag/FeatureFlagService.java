package com.ridematch.shared.featureflag;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;

import java.time.Duration;

/**
 * Feature flag service backed by Redis hashes.
 *
 * Key pattern:  feature-flags:{scope}
 * Field:        {flagName}
 * Value:        "true" | "false"
 *
 * Toggle at runtime:
 *   HSET feature-flags:default dispatch_kill_switch true
 *   HSET feature-flags:global auto_radius_expansion false
 */
@Slf4j
@RequiredArgsConstructor
public class FeatureFlagService {

    private static final String FLAG_KEY_PREFIX = "feature-flags:";
    private static final String GLOBAL_SCOPE    = "global";
    public static final String DEFAULT_SCOPE    = "default";

    public static final String DISPATCH_KILL_SWITCH   = "dispatch_kill_switch";
    public static final String EXTENDED_AREA_FILTER   = "extended_area_filter";
    public static final String AUTO_RADIUS_EXPANSION  = "auto_radius_expansion";

    private final RedisTemplate<String, String> redisTemplate;

    /**
     * Returns the flag value for the scope, falling back to the global
     * scope and then to {@code defaultValue}.
     */
    public boolean isEnabled(String scope, String flagName, boolean defaultValue) {
        Object scopedVal = redisTemplate.opsForHash().get(FLAG_KEY_PREFIX + scope, flagName);
        if (scopedVal != null) {
            return Boolean.parseBoolean(scopedVal.toString());
        }

        Object globalVal = redisTemplate.opsForHash().get(FLAG_KEY_PREFIX + GLOBAL_SCOPE, flagName);
        if (globalVal != null) {
            return Boolean.parseBoolean(globalVal.toString());
        }

        log.debug("Feature flag '{}' not found for scope='{}', using default={}", flagName, scope, defaultValue);
        return defaultValue;
    }

    public boolean isEnabled(String flagName, boolean defaultValue) {
        return isEnabled(DEFAULT_SCOPE, flagName, defaultValue);
    }

    public void setFlag(String scope, String flagName, boolean value) {
        redisTemplate.opsForHash().put(FLAG_KEY_PREFIX + scope, flagName, String.valueOf(value));
        log.info("Feature flag set: scope={} flag={} value={}", scope, flagName, value);
    }

    /**
     * Seeds dispatch flags that are not yet present. Existing values win.
     */
    public void initDefaults(String scope) {
        String key = FLAG_KEY_PREFIX + scope;
        redisTemplate.opsForHash().putIfAbsent(key, DISPATCH_KILL_SWITCH,  "false");
        redisTemplate.opsForHash().putIfAbsent(key, EXTENDED_AREA_FILTER,  "true");
        redisTemplate.opsForHash().putIfAbsent(key, AUTO_RADIUS_EXPANSION, "true");
        redisTemplate.expire(key, Duration.ofDays(365));
    }
}
