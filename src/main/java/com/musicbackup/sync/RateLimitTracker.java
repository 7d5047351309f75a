package com.musicbackup.sync;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Holds the current throttle state and the time at which remote calls may resume.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Every remote-call wrapper asks {@link #isLimited()} before issuing a call.</li>
 *   <li>Every caught throttle error is routed through {@link #recordLimit(Integer, String, String)}.</li>
 *   <li>{@link #isLimited()} clears itself once the clock passes the stored resume time.</li>
 * </ul>
 * <p>
 * Retry-after extraction from free text is best effort. When no duration can be parsed the
 * tracker waits {@link #DEFAULT_RETRY_AFTER_SECONDS}.
 *
 * @author Music Library Backup Team
 * @since 1.0
 */
public class RateLimitTracker {
    private static final Logger logger = LoggerFactory.getLogger(RateLimitTracker.class);

    public static final long DEFAULT_RETRY_AFTER_SECONDS = 3600;

    private static final Pattern RETRY_WILL_OCCUR = Pattern.compile("Retry will occur after:\\s*(\\d+)\\s*s");
    private static final Pattern RETRY_AFTER_SECONDS = Pattern.compile("retry after\\s*(\\d+)\\s*second", Pattern.CASE_INSENSITIVE);
    private static final Pattern STATUS_429 = Pattern.compile("\\b(?:http|status)(?:\\s+code)?\\s*[:=]?\\s*429\\b", Pattern.CASE_INSENSITIVE);

    private final Clock clock;
    private boolean limited;
    private long retryAfterSeconds;
    private Instant availableAt;
    private String message = "";

    public RateLimitTracker() {
        this(Clock.systemUTC());
    }

    public RateLimitTracker(Clock clock) {
        this.clock = clock;
    }

    /**
     * Parses a retry-after duration out of an error message.
     * @param errorMessage Free-text error, may be null
     * @return Seconds to wait; {@link #DEFAULT_RETRY_AFTER_SECONDS} when nothing parseable is found
     */
    public static long parseRetryAfter(String errorMessage) {
        if (errorMessage == null) return DEFAULT_RETRY_AFTER_SECONDS;
        Matcher m = RETRY_WILL_OCCUR.matcher(errorMessage);
        if (m.find()) return parseSeconds(m.group(1));
        m = RETRY_AFTER_SECONDS.matcher(errorMessage);
        if (m.find()) return parseSeconds(m.group(1));
        return DEFAULT_RETRY_AFTER_SECONDS;
    }

    private static long parseSeconds(String digits) {
        try {
            return Long.parseLong(digits);
        } catch (NumberFormatException e) {
            return DEFAULT_RETRY_AFTER_SECONDS;
        }
    }

    /**
     * Whether a free-text error describes a throttle condition: a 429 status next to "HTTP" or "status",
     * "too many requests", or "rate" together with "limit". A bare 429 inside an ID or offset does not count.
     */
    public static boolean looksLikeRateLimit(String errorMessage) {
        if (errorMessage == null) return false;
        String lower = errorMessage.toLowerCase(Locale.ROOT);
        if (STATUS_429.matcher(errorMessage).find() || lower.contains("too many requests")) return true;
        return lower.contains("rate") && lower.contains("limit");
    }

    /**
     * Records a throttle with an explicit duration.
     * @param retryAfterSeconds Seconds until calls may resume
     * @param context What the engine was doing, for logs and the persisted status
     */
    public void recordLimit(long retryAfterSeconds, String context) {
        this.limited = true;
        this.retryAfterSeconds = Math.max(0, retryAfterSeconds);
        this.availableAt = clock.instant().plusSeconds(this.retryAfterSeconds);
        this.message = context == null ? "" : "Rate limited during " + context;
        logger.warn("Rate limit reached during {}. Calls may resume at {} ({} s).", context, availableAt, this.retryAfterSeconds);
    }

    /**
     * Records a throttle using the explicit value when present, otherwise the hint embedded in the message.
     */
    public void recordLimit(Integer explicitSeconds, String errorMessage, String context) {
        long seconds = explicitSeconds != null ? explicitSeconds : parseRetryAfter(errorMessage);
        recordLimit(seconds, context);
    }

    /**
     * Re-arms a throttle persisted by an earlier process, if its window has not elapsed yet.
     */
    public void restore(RateLimitStatus status) {
        if (status == null || !status.limited() || status.availableAt() == null) return;
        long remaining = Duration.between(clock.instant(), status.availableAt()).getSeconds();
        if (remaining > 0) {
            recordLimit(remaining, "a previous run");
        }
    }

    public boolean isLimited() {
        if (!limited) return false;
        if (availableAt != null && !clock.instant().isBefore(availableAt)) {
            logger.info("Rate limit window elapsed at {}; clearing.", availableAt);
            clear();
            return false;
        }
        return true;
    }

    public void clear() {
        limited = false;
        retryAfterSeconds = 0;
        availableAt = null;
        message = "";
    }

    /**
     * @return When calls may resume, or null when not limited
     */
    public Instant availableAt() {
        return isLimited() ? availableAt : null;
    }

    public RateLimitStatus status() {
        if (!isLimited()) return RateLimitStatus.notLimited();
        return new RateLimitStatus(true, retryAfterSeconds, availableAt, message);
    }
}
