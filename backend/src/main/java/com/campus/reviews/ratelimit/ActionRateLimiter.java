package com.campus.reviews.ratelimit;

import com.campus.reviews.config.RateLimitProperties;
import com.campus.reviews.dto.RateLimitStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fixed-window counters per (user, action kind). Each check-and-increment is a
 * single {@link ConcurrentHashMap#compute} so two tabs of the same user cannot
 * both slip under the limit.
 */
@Slf4j
@Component
public class ActionRateLimiter {

    private static final int EVICT_EVERY = 1024;

    private record CounterKey(Long userId, ActionKind kind) {}

    private record Counter(long windowStart, long windowEnd, int count) {
        boolean expiredAt(long now) {
            return now >= windowEnd;
        }
    }

    private final RateLimitProperties props;
    private final Clock clock;
    private final Map<CounterKey, Counter> counters = new ConcurrentHashMap<>();
    private final AtomicLong checks = new AtomicLong();

    @Autowired
    public ActionRateLimiter(RateLimitProperties props) {
        this(props, Clock.systemUTC());
    }

    ActionRateLimiter(RateLimitProperties props, Clock clock) {
        this.props = props;
        this.clock = clock;
    }

    public RateDecision checkAndIncrement(Long userId, ActionKind kind) {
        RateLimitProperties.Policy policy = props.policyFor(kind);
        long now = clock.millis();
        long windowMs = policy.getWindow().toMillis();
        RateDecision[] decision = new RateDecision[1];

        counters.compute(new CounterKey(userId, kind), (k, c) -> {
            if (c == null || c.expiredAt(now)) {
                c = new Counter(now, now + windowMs, 0);
            }
            if (c.count() >= policy.getLimit()) {
                decision[0] = RateDecision.denied(policy.getLimit(), Duration.ofMillis(c.windowEnd() - now));
                return c;
            }
            Counter next = new Counter(c.windowStart(), c.windowEnd(), c.count() + 1);
            decision[0] = RateDecision.allowed(policy.getLimit(), policy.getLimit() - next.count());
            return next;
        });

        if (checks.incrementAndGet() % EVICT_EVERY == 0) {
            evictExpired(now);
        }
        if (!decision[0].allowed()) {
            log.warn("Rate limit hit: user={} action={} retryAfter={}s", userId, kind, decision[0].retryAfter().toSeconds());
        }
        return decision[0];
    }

    /** Read-only view of the user's current windows. */
    public List<RateLimitStatus> remaining(Long userId) {
        long now = clock.millis();
        List<RateLimitStatus> out = new ArrayList<>();
        for (ActionKind kind : ActionKind.values()) {
            RateLimitProperties.Policy policy = props.policyFor(kind);
            Counter c = counters.get(new CounterKey(userId, kind));
            int used = (c == null || c.expiredAt(now)) ? 0 : c.count();
            Instant resetsAt = (c == null || c.expiredAt(now)) ? null : Instant.ofEpochMilli(c.windowEnd());
            out.add(new RateLimitStatus(kind, used, policy.getLimit(), Math.max(0, policy.getLimit() - used),
                    policy.getWindow(), resetsAt));
        }
        return out;
    }

    void evictExpired(long now) {
        counters.entrySet().removeIf(e -> e.getValue().expiredAt(now));
    }

    int trackedCounters() {
        return counters.size();
    }
}
