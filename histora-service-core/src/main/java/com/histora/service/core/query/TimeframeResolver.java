package com.histora.service.core.query;

import com.histora.service.core.config.HistoraProperties;
import com.histora.service.core.error.ValidationException;
import com.histora.service.core.support.DurationParser;
import com.histora.service.core.support.InstantParser;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Builds a {@link QueryDescriptor} from request parameters. At most two of start, end and duration may be set:
 *
 * <ul>
 *   <li>none: the last default duration, open end (or no lower bound for live streams)
 *   <li>start + duration: {@code [start, start + duration)}
 *   <li>start + end: {@code [start, end)}
 *   <li>duration + end: {@code [end - duration, end)}
 *   <li>start: {@code [start, open)}
 *   <li>duration: {@code [now - duration, open)}
 *   <li>end: {@code [end - default duration, end)}
 * </ul>
 *
 * A step of {@code auto} spreads the window over the desired number of points, never below the minimum step.
 */
@Component
public class TimeframeResolver {

    private static final String AUTO_STEP = "auto";

    private final Clock clock;
    private final Duration defaultDuration;
    private final Duration minimumStep;
    private final int desiredPoints;

    @Autowired
    public TimeframeResolver(HistoraProperties properties, Clock clock) {
        this(
                clock,
                DurationParser.parse(properties.getQuery().getDefaultDuration()),
                DurationParser.parse(properties.getQuery().getMinimumStep()),
                properties.getQuery().getDesiredPoints());
    }

    public TimeframeResolver(Clock clock, Duration defaultDuration, Duration minimumStep, int desiredPoints) {
        this.clock = clock;
        this.defaultDuration = defaultDuration;
        this.minimumStep = minimumStep;
        this.desiredPoints = desiredPoints;
    }

    public QueryDescriptor resolve(Collection<String> metrics, String start, String end, String duration, String step) {
        return resolve(metrics, start, end, duration, step, true);
    }

    /** For live streams: without any range parameter there is no historical portion. */
    public QueryDescriptor resolveLive(
            Collection<String> metrics, String start, String end, String duration, String step) {
        return resolve(metrics, start, end, duration, step, false);
    }

    private QueryDescriptor resolve(
            Collection<String> metrics,
            String start,
            String end,
            String duration,
            String step,
            boolean defaultWindow) {
        Instant dtStart = InstantParser.parse(start);
        Instant dtEnd = InstantParser.parse(end);
        Duration window = isBlank(duration) ? null : DurationParser.parse(duration);
        Instant now = clock.instant();

        if (dtStart != null && dtEnd != null && window != null) {
            throw new ValidationException("At most two out of start, end and duration can be provided");
        } else if (dtStart == null && dtEnd == null && window == null) {
            dtStart = defaultWindow ? now.minus(defaultDuration) : null;
        } else if (dtStart != null && window != null) {
            dtEnd = dtStart.plus(window);
        } else if (window != null && dtEnd != null) {
            dtStart = dtEnd.minus(window);
        } else if (window != null) {
            dtStart = now.minus(window);
        } else if (dtEnd != null && dtStart == null) {
            dtStart = dtEnd.minus(defaultDuration);
        }

        return QueryDescriptor.of(metrics, dtStart, dtEnd, resolveStep(step, dtStart, dtEnd, now));
    }

    private Duration resolveStep(String step, Instant start, Instant end, Instant now) {
        if (isBlank(step)) {
            return null;
        }
        if (!AUTO_STEP.equalsIgnoreCase(step.trim())) {
            return DurationParser.parse(step);
        }
        if (start == null) {
            return minimumStep;
        }
        Duration span = Duration.between(start, end != null ? end : now);
        Duration desired = span.dividedBy(Math.max(1, desiredPoints));
        return desired.compareTo(minimumStep) > 0 ? Duration.ofSeconds(desired.getSeconds()) : minimumStep;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
