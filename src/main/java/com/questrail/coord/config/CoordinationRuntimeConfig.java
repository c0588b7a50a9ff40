package com.questrail.coord.config;

import com.questrail.coord.observability.CoordinationObservabilitySink;
import com.questrail.coord.observability.NullObservabilitySink;

import java.time.Duration;
import java.util.Objects;

/**
 * Aggregated configuration for a {@code CoordinationRuntime}.
 */
public record CoordinationRuntimeConfig(
    TimerBackend timerBackend,
    String timerThreadName,
    Duration wheelTickDuration,
    CoordinationTiming defaultTiming,
    CoordinationObservabilitySink observabilitySink
) {
    public CoordinationRuntimeConfig {
        Objects.requireNonNull(timerBackend, "timerBackend");
        Objects.requireNonNull(timerThreadName, "timerThreadName");
        Objects.requireNonNull(wheelTickDuration, "wheelTickDuration");
        Objects.requireNonNull(defaultTiming, "defaultTiming");
        Objects.requireNonNull(observabilitySink, "observabilitySink");

        if (wheelTickDuration.isZero() || wheelTickDuration.isNegative()) {
            throw new IllegalArgumentException("wheelTickDuration must be positive");
        }
    }

    public static CoordinationRuntimeConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private TimerBackend timerBackend = TimerBackend.EXECUTOR;
        private String timerThreadName = "coordination-timer";
        private Duration wheelTickDuration = Duration.ofMillis(10);
        private CoordinationTiming defaultTiming = CoordinationTiming.ofMillis(100);
        private CoordinationObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;

        public Builder withTimerBackend(TimerBackend timerBackend) {
            this.timerBackend = timerBackend;
            return this;
        }

        public Builder withTimerThreadName(String timerThreadName) {
            this.timerThreadName = timerThreadName;
            return this;
        }

        public Builder withWheelTickDuration(Duration wheelTickDuration) {
            this.wheelTickDuration = wheelTickDuration;
            return this;
        }

        public Builder withDefaultTiming(CoordinationTiming defaultTiming) {
            this.defaultTiming = defaultTiming;
            return this;
        }

        public Builder withObservabilitySink(CoordinationObservabilitySink observabilitySink) {
            this.observabilitySink = observabilitySink;
            return this;
        }

        public CoordinationRuntimeConfig build() {
            return new CoordinationRuntimeConfig(
                timerBackend, timerThreadName, wheelTickDuration, defaultTiming, observabilitySink);
        }
    }
}
