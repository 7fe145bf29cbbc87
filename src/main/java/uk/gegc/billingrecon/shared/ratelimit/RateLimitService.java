package uk.gegc.billingrecon.shared.ratelimit;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.billingrecon.shared.exception.RateLimitExceededException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Fixed one-minute window counter per {@code operation:key}. Process-local and best effort:
 * it bounds abuse volume and is never relied on for correctness.
 */
@Slf4j
@Service
public class RateLimitService {

    private static final Duration WINDOW = Duration.ofMinutes(1);

    private final Clock clock;
    private final Map<String, Window> windows = new ConcurrentHashMap<>();

    public RateLimitService(Clock clock) {
        this.clock = clock;
    }

    public void checkRateLimit(String operation, String key, int limitPerMinute) {
        String rateLimitKey = operation + ":" + key;
        Instant now = clock.instant();

        windows.entrySet().removeIf(entry -> entry.getValue().isExpired(now));

        Window window = windows.compute(rateLimitKey, (k, existing) ->
                existing == null || existing.isExpired(now)
                        ? new Window(now, 1)
                        : new Window(existing.startedAt(), existing.count() + 1));

        if (window.count() > limitPerMinute) {
            long retryAfter = Duration.between(now, window.startedAt().plus(WINDOW)).getSeconds();
            log.warn("Rate limit exceeded for operation={} key={} count={}", operation, key, window.count());
            throw new RateLimitExceededException("Too many requests for " + operation, retryAfter);
        }
    }

    private record Window(Instant startedAt, int count) {
        boolean isExpired(Instant now) {
            return !startedAt.plus(WINDOW).isAfter(now);
        }
    }
}
