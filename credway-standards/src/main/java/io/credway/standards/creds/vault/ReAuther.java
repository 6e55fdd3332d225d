package io.credway.standards.creds.vault;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.credway.util.ExponentialBackoff;
import io.credway.util.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps an {@link Auther} logged in from a background thread.
 *
 * The loop logs in, sleeps until half of the lease has passed, then renews. When a maximum
 * token lifetime is set, the token is replaced by a fresh login once that lifetime ends even
 * if the server would keep renewing it. Failed logins and renewals are retried with an
 * exponential backoff; the loop only ends when {@link #close()} is called.
 */
public class ReAuther
        implements AutoCloseable
{
    private static final Logger logger = LoggerFactory.getLogger(ReAuther.class);

    private static final ThreadFactory THREAD_FACTORY = new ThreadFactoryBuilder()
        .setDaemon(true)
        .setNameFormat("vault-reauther-%d")
        .build();

    private final Auther auther;
    private final Duration maxTtl;
    private final ExponentialBackoff backoff;
    private final Clock clock;
    private final Sleeper sleeper;

    private final CountDownLatch loggedIn = new CountDownLatch(1);
    private final CountDownLatch closed = new CountDownLatch(1);

    private volatile Thread thread;

    // owned by the loop thread
    private Instant leaseEnd;
    private Instant tokenEol;

    public ReAuther(Auther auther, Duration maxTtl, Duration retryInitial, Duration retryMax)
    {
        this(auther, maxTtl, retryInitial, retryMax, Clock.systemUTC(), null);
    }

    @VisibleForTesting
    ReAuther(Auther auther, Duration maxTtl, Duration retryInitial, Duration retryMax, Clock clock, Sleeper sleeper)
    {
        this.auther = auther;
        this.maxTtl = maxTtl;
        this.backoff = new ExponentialBackoff(retryInitial, retryMax);
        this.clock = clock;
        this.sleeper = sleeper != null ? sleeper : this::sleepUntilClosed;
    }

    public synchronized void start()
    {
        if (thread != null) {
            throw new IllegalStateException("ReAuther is already started");
        }
        thread = THREAD_FACTORY.newThread(this::run);
        thread.start();
    }

    /**
     * Waits until the first login succeeds.
     *
     * @return false if the timeout elapsed first
     */
    public boolean awaitLoggedIn(Duration timeout)
            throws InterruptedException
    {
        return loggedIn.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public boolean isLoggedIn()
    {
        return loggedIn.getCount() == 0;
    }

    @VisibleForTesting
    void run()
    {
        try {
            while (!isClosed()) {
                login();
                renewWhileRenewable();
            }
        }
        catch (InterruptedException ex) {
            logger.debug("Vault re-authentication stopped");
        }
    }

    private void login()
            throws InterruptedException
    {
        while (true) {
            Duration lease;
            try {
                lease = auther.login();
            }
            catch (AuthException | RuntimeException ex) {
                Duration wait = backoff.nextWait();
                logger.error("Failed to log in to vault. Retrying in {}", wait, ex);
                sleep(wait);
                continue;
            }

            backoff.reset();
            loggedIn.countDown();

            Instant now = clock.instant();
            tokenEol = maxTtl.isZero() ? null : now.plus(maxTtl);
            leaseEnd = now.plus(lease);
            logger.info("Logged in to vault with lease {}", lease);

            sleepForLease(now, lease);
            return;
        }
    }

    private void renewWhileRenewable()
            throws InterruptedException
    {
        while (renewable()) {
            Duration lease;
            try {
                lease = auther.renew();
            }
            catch (NonRenewableLeaseException ex) {
                logger.info("Vault token can not be renewed. Logging in again when it expires");
                sleepUntil(tokenEol == null || leaseEnd.isBefore(tokenEol) ? leaseEnd : tokenEol);
                return;
            }
            catch (AuthException | RuntimeException ex) {
                // the current token stays in use until its lease ends
                Duration wait = backoff.nextWait();
                logger.warn("Failed to renew vault token. Retrying in {}", wait, ex);
                sleep(wait);
                continue;
            }

            backoff.reset();
            Instant now = clock.instant();
            leaseEnd = now.plus(lease);
            logger.debug("Renewed vault token with lease {}", lease);

            sleepForLease(now, lease);
        }
    }

    private void sleepForLease(Instant now, Duration lease)
            throws InterruptedException
    {
        if (lease.isZero()) {
            // the token does not expire; wake up only for the forced login
            if (tokenEol != null) {
                sleepUntil(tokenEol);
            }
            else {
                sleep(Duration.ofMillis(Long.MAX_VALUE));
            }
            leaseEnd = null;
        }
        else if (tokenEol != null && leaseEnd.isAfter(tokenEol)) {
            sleepUntil(tokenEol);
        }
        else {
            sleep(Duration.between(now, leaseEnd).dividedBy(2));
        }
    }

    private boolean renewable()
    {
        if (isClosed()) {
            return false;
        }
        Instant now = clock.instant();
        if (tokenEol != null && !now.isBefore(tokenEol)) {
            return false;
        }
        return leaseEnd != null && now.isBefore(leaseEnd);
    }

    private void sleepUntil(Instant deadline)
            throws InterruptedException
    {
        Duration wait = Duration.between(clock.instant(), deadline);
        if (!wait.isNegative() && !wait.isZero()) {
            sleep(wait);
        }
    }

    private void sleep(Duration duration)
            throws InterruptedException
    {
        if (isClosed()) {
            throw new InterruptedException("closed");
        }
        sleeper.sleep(duration);
        if (isClosed()) {
            throw new InterruptedException("closed");
        }
    }

    private void sleepUntilClosed(Duration duration)
            throws InterruptedException
    {
        closed.await(duration.toMillis(), TimeUnit.MILLISECONDS);
    }

    private boolean isClosed()
    {
        return closed.getCount() == 0;
    }

    @Override
    public void close()
    {
        closed.countDown();
        Thread t = thread;
        if (t != null) {
            try {
                t.join(TimeUnit.SECONDS.toMillis(10));
            }
            catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
            if (t.isAlive()) {
                logger.warn("Vault re-authentication thread did not stop within 10 seconds");
            }
        }
    }
}
