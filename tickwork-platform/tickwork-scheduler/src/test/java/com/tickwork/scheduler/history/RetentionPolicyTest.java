package com.tickwork.scheduler.history;

import com.tickwork.scheduler.config.CustomJobProperties;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

class RetentionPolicyTest {

    private final Map<String, String> values = new HashMap<>();
    private final CustomJobProperties properties = new CustomJobProperties();

    private RetentionPolicy policy() {
        return new RetentionPolicy(key -> Optional.ofNullable(values.get(key)), properties);
    }

    @Test
    void usesConfiguredMaxAgeByDefault() {
        properties.getRetention().setMaxAge(Duration.ofDays(30));

        assertThat(policy().cutoff(Instant.parse("2024-03-31T00:00:00Z")))
                .isEqualTo(Instant.parse("2024-03-01T00:00:00Z"));
    }

    @Test
    void keyValueOverrideWins() {
        values.put(RetentionPolicy.MAX_AGE_KEY, "P7D");

        assertThat(policy().maxAge()).isEqualTo(Duration.ofDays(7));
    }

    @Test
    void invalidOverridesFallBack() {
        values.put(RetentionPolicy.MAX_AGE_KEY, "seven days");
        assertThat(policy().maxAge()).isEqualTo(Duration.ofDays(90));

        values.put(RetentionPolicy.MAX_AGE_KEY, "-P1D");
        assertThat(policy().maxAge()).isEqualTo(Duration.ofDays(90));
    }

    @Test
    void zeroHorizonIsAllowed() {
        values.put(RetentionPolicy.MAX_AGE_KEY, "PT0S");
        Instant now = Instant.parse("2024-03-31T00:00:00Z");

        assertThat(policy().cutoff(now)).isEqualTo(now);
    }

    @Test
    void rejectsInvalidConfiguration() {
        properties.getRetention().setBatchSize(0);

        assertThatThrownBy(this::policy).isInstanceOf(IllegalArgumentException.class);
    }
}
