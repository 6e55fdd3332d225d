package io.credway.util;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import io.credway.spi.config.ConfigException;

/**
 * Duration config value. Accepts {@code 1m}, {@code 10s}, {@code 1h 30m}, or a plain
 * number of seconds. Negative durations are rejected.
 */
public final class DurationParam
{
    private final Duration duration;

    private DurationParam(Duration duration)
    {
        if (duration.isNegative()) {
            throw new ConfigException("Duration must not be negative: " + duration);
        }
        this.duration = duration;
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    static DurationParam fromJson(Object value)
    {
        if (value instanceof Integer || value instanceof Long) {
            return of(Duration.ofSeconds(((Number) value).longValue()));
        }
        if (value instanceof String) {
            return parse((String) value);
        }
        throw new ConfigException("Expected a duration such as '30s' or '5m' but got: " + value);
    }

    public static DurationParam parse(String expr)
    {
        try {
            return new DurationParam(Durations.parseDuration(expr.trim()));
        }
        catch (DateTimeParseException ex) {
            throw new ConfigException("Invalid duration '" + expr + "'", ex);
        }
    }

    public static DurationParam of(Duration duration)
    {
        return new DurationParam(duration);
    }

    public Duration getDuration()
    {
        return duration;
    }

    @Override
    public boolean equals(Object other)
    {
        return other instanceof DurationParam && duration.equals(((DurationParam) other).duration);
    }

    @Override
    public int hashCode()
    {
        return duration.hashCode();
    }

    @JsonValue
    @Override
    public String toString()
    {
        return Durations.formatDuration(duration);
    }
}
