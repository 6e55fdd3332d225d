package io.credway.util;

import java.time.Duration;
import com.google.common.base.Preconditions;

/**
 * Growing wait between attempts of an operation that is retried forever.
 * The wait doubles after every failure until it reaches the cap, then stays there.
 * Not thread-safe.
 */
public class ExponentialBackoff
{
    private static final double MULTIPLIER = 2.0;

    private final Duration initial;
    private final Duration max;
    private Duration current;

    public ExponentialBackoff(Duration initial, Duration max)
    {
        Preconditions.checkArgument(!initial.isNegative() && !initial.isZero(), "initial backoff must be positive: %s", initial);
        Preconditions.checkArgument(max.compareTo(initial) >= 0, "max backoff %s is shorter than initial %s", max, initial);
        this.initial = initial;
        this.max = max;
        this.current = initial;
    }

    public Duration nextWait()
    {
        Duration wait = current;
        double grown = current.toMillis() * MULTIPLIER;
        current = grown >= max.toMillis() ? max : Duration.ofMillis((long) grown);
        return wait;
    }

    public void reset()
    {
        current = initial;
    }
}
