package com.chuntfm.schedule.infrastructure.cache;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.ConfigDataApplicationContextInitializer;
import org.springframework.test.context.ContextConfiguration;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.junit.jupiter.SpringJUnitConfig;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

@SpringJUnitConfig
@ContextConfiguration(initializers = ConfigDataApplicationContextInitializer.class)
@EnableConfigurationProperties(ScheduleCacheConfig.class)
@TestPropertySource(properties = {
        "chuntfm.cache.ttl=2m",
        "chuntfm.cache.probe-enabled=false",
        "chuntfm.cache.probe-interval=500ms",
        "chuntfm.cache.modified-columns=modified_on",
        "chuntfm.cache.initial-load-timeout=15s"
})
class ScheduleCacheConfigTest {

    @Autowired
    private ScheduleCacheConfig config;

    @Test
    void shouldBindConfigurationProperties() {
        assertThat(config.getTtl()).isEqualTo(Duration.ofMinutes(2));
        assertThat(config.isTtlEnabled()).isTrue();
        assertThat(config.isProbeEnabled()).isFalse();
        assertThat(config.getProbeInterval()).isEqualTo(Duration.ofMillis(500));
        assertThat(config.getModifiedColumns()).containsExactly("modified_on");
        assertThat(config.getInitialLoadTimeout()).isEqualTo(Duration.ofSeconds(15));
    }

    @Test
    void shouldHaveDefaultValuesWhenNotConfigured() {
        ScheduleCacheConfig defaultConfig = new ScheduleCacheConfig();

        assertThat(defaultConfig.getTtl()).isEqualTo(Duration.ofMinutes(5));
        assertThat(defaultConfig.isProbeEnabled()).isTrue();
        assertThat(defaultConfig.getProbeInterval()).isEqualTo(Duration.ofSeconds(10));
        assertThat(defaultConfig.getModifiedColumns()).containsExactly("updated_at", "created_at");
        assertThat(defaultConfig.getInitialLoadTimeout()).isEqualTo(Duration.ofSeconds(30));
    }

    @Test
    void shouldDisableTtlWhenZero() {
        ScheduleCacheConfig defaultConfig = new ScheduleCacheConfig();

        defaultConfig.setTtl(Duration.ZERO);

        assertThat(defaultConfig.isTtlEnabled()).isFalse();
    }
}
