package com.example.finsight.router;

import com.example.finsight.config.FinanceProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 원천별 연속 장애 횟수. 기준 이상 연속 실패한 원천은 cooldown 동안 체인 뒤로 밀린다.
 */
@Component
public class SourceHealth {

    private static final Logger log = LoggerFactory.getLogger(SourceHealth.class);

    private final int failureThreshold;
    private final Duration cooldown;
    private final Clock clock;
    private final ConcurrentHashMap<String, State> states = new ConcurrentHashMap<>();

    @Autowired
    public SourceHealth(FinanceProperties props) {
        this(props, Clock.systemUTC());
    }

    SourceHealth(FinanceProperties props, Clock clock) {
        this.failureThreshold = props.getHealth().getFailureThreshold();
        this.cooldown = props.getHealth().getCooldown();
        this.clock = clock;
    }

    public void recordSuccess(String sourceId) {
        State s = states.computeIfAbsent(sourceId, k -> new State());
        synchronized (s) {
            s.consecutiveFailures = 0;
            s.lastSuccess = clock.instant();
        }
    }

    public void recordFailure(String sourceId, String error) {
        State s = states.computeIfAbsent(sourceId, k -> new State());
        synchronized (s) {
            s.consecutiveFailures++;
            s.lastFailure = clock.instant();
            s.lastError = error;
            if (s.consecutiveFailures == failureThreshold) {
                log.warn("Source {} degraded after {} consecutive failures: {}", sourceId, failureThreshold, error);
            }
        }
    }

    public boolean isDegraded(String sourceId) {
        State s = states.get(sourceId);
        if (s == null) return false;
        synchronized (s) {
            return s.consecutiveFailures >= failureThreshold
                    && s.lastFailure != null
                    && clock.instant().isBefore(s.lastFailure.plus(cooldown));
        }
    }

    public Snapshot snapshot(String sourceId) {
        State s = states.get(sourceId);
        if (s == null) return new Snapshot(0, null, null, null, false);
        synchronized (s) {
            return new Snapshot(s.consecutiveFailures, s.lastSuccess, s.lastFailure, s.lastError, isDegraded(sourceId));
        }
    }

    private static final class State {
        int consecutiveFailures;
        Instant lastSuccess;
        Instant lastFailure;
        String lastError;
    }

    public static final class Snapshot {
        public final int consecutiveFailures;
        public final Instant lastSuccess;
        public final Instant lastFailure;
        public final String lastError;
        public final boolean degraded;

        Snapshot(int consecutiveFailures, Instant lastSuccess, Instant lastFailure, String lastError, boolean degraded) {
            this.consecutiveFailures = consecutiveFailures;
            this.lastSuccess = lastSuccess;
            this.lastFailure = lastFailure;
            this.lastError = lastError;
            this.degraded = degraded;
        }
    }
}
