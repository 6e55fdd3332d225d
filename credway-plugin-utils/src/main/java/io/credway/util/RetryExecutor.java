package io.credway.util;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.function.Predicate;

public class RetryExecutor
{
    public static RetryExecutor retryExecutor()
    {
        return new RetryExecutor();
    }

    /**
     * Thrown when the operation failed and no more attempts are made.
     * {@link #getCause()} is the last failure.
     */
    public static class RetryGiveupException
            extends ExecutionException
    {
        public RetryGiveupException(Exception lastException)
        {
            super(lastException);
        }

        public RetryGiveupException(String message, Exception cause)
        {
            super(message, cause);
        }

        @Override
        public Exception getCause()
        {
            return (Exception) super.getCause();
        }
    }

    public interface RetryPredicate
            extends Predicate<Exception>
    { }

    public interface RetryAction
    {
        void onRetry(Exception exception, int retryCount, int retryLimit, Duration retryWait);
    }

    public interface GiveupAction
    {
        void onGiveup(Exception firstException, Exception lastException);
    }

    private final int retryLimit;
    private final Duration initialRetryWait;
    private final Duration maxRetryWait;
    private final double waitGrowRate;
    private final RetryPredicate retryPredicate;
    private final RetryAction retryAction;
    private final GiveupAction giveupAction;
    private final Sleeper sleeper;

    private RetryExecutor()
    {
        this(4, Duration.ofSeconds(1), Duration.ofMinutes(5), 1.0, null, null, null, Sleeper.SYSTEM);
    }

    private RetryExecutor(int retryLimit, Duration initialRetryWait, Duration maxRetryWait, double waitGrowRate,
            RetryPredicate retryPredicate, RetryAction retryAction, GiveupAction giveupAction, Sleeper sleeper)
    {
        this.retryLimit = retryLimit;
        this.initialRetryWait = initialRetryWait;
        this.maxRetryWait = maxRetryWait;
        this.waitGrowRate = waitGrowRate;
        this.retryPredicate = retryPredicate;
        this.retryAction = retryAction;
        this.giveupAction = giveupAction;
        this.sleeper = sleeper;
    }

    /**
     * Number of retries after the first call. A limit of 4 allows 5 calls in total.
     */
    public RetryExecutor withRetryLimit(int count)
    {
        return new RetryExecutor(
                count, initialRetryWait, maxRetryWait, waitGrowRate,
                retryPredicate, retryAction, giveupAction, sleeper);
    }

    public RetryExecutor withInitialRetryWait(Duration wait)
    {
        return new RetryExecutor(
                retryLimit, wait, maxRetryWait, waitGrowRate,
                retryPredicate, retryAction, giveupAction, sleeper);
    }

    public RetryExecutor withMaxRetryWait(Duration wait)
    {
        return new RetryExecutor(
                retryLimit, initialRetryWait, wait, waitGrowRate,
                retryPredicate, retryAction, giveupAction, sleeper);
    }

    public RetryExecutor withWaitGrowRate(double rate)
    {
        return new RetryExecutor(
                retryLimit, initialRetryWait, maxRetryWait, rate,
                retryPredicate, retryAction, giveupAction, sleeper);
    }

    public RetryExecutor withSleeper(Sleeper sleeper)
    {
        return new RetryExecutor(
                retryLimit, initialRetryWait, maxRetryWait, waitGrowRate,
                retryPredicate, retryAction, giveupAction, sleeper);
    }

    public RetryExecutor retryIf(RetryPredicate function)
    {
        return new RetryExecutor(
                retryLimit, initialRetryWait, maxRetryWait, waitGrowRate,
                function, retryAction, giveupAction, sleeper);
    }

    public RetryExecutor onRetry(RetryAction function)
    {
        return new RetryExecutor(
                retryLimit, initialRetryWait, maxRetryWait, waitGrowRate,
                retryPredicate, function, giveupAction, sleeper);
    }

    public RetryExecutor onGiveup(GiveupAction function)
    {
        return new RetryExecutor(
                retryLimit, initialRetryWait, maxRetryWait, waitGrowRate,
                retryPredicate, retryAction, function, sleeper);
    }

    public <T> T run(Callable<T> op)
            throws RetryGiveupException
    {
        int retryCount = 0;
        Exception firstException = null;

        while (true) {
            try {
                return op.call();
            }
            catch (Exception exception) {
                if (firstException == null) {
                    firstException = exception;
                }
                if (retryCount >= retryLimit || retryPredicate == null || !retryPredicate.test(exception)) {
                    if (giveupAction != null) {
                        giveupAction.onGiveup(firstException, exception);
                    }
                    throw new RetryGiveupException(exception);
                }

                Duration retryWait = retryWait(retryCount);

                retryCount++;
                if (retryAction != null) {
                    retryAction.onRetry(exception, retryCount, retryLimit, retryWait);
                }

                try {
                    sleeper.sleep(retryWait);
                }
                catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                    throw new RetryGiveupException("Interrupted while waiting to retry", exception);
                }
            }
        }
    }

    // exponential back-off with hard limit
    Duration retryWait(int retryCount)
    {
        double millis = initialRetryWait.toMillis() * Math.pow(waitGrowRate, retryCount);
        return Duration.ofMillis((long) Math.min((double) maxRetryWait.toMillis(), millis));
    }
}
