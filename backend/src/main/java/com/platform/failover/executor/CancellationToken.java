package com.platform.failover.executor;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Cancellation signal for one running failover. Cancelling interrupts the step attempt in
 * flight and wakes any backoff sleep.
 */
public class CancellationToken {
    
    private final CountDownLatch cancelled = new CountDownLatch(1);
    private final AtomicReference<Future<?>> running = new AtomicReference<>();
    private volatile String reason;
    
    public void cancel(String why) {
        this.reason = why;
        cancelled.countDown();
        Future<?> current = running.get();
        if (current != null) {
            current.cancel(true);
        }
    }
    
    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }
    
    public String reason() {
        return reason;
    }
    
    /**
     * Sleep for {@code delay} unless cancelled first.
     * 
     * @return true if the token was cancelled before the delay elapsed
     */
    public boolean sleep(Duration delay) throws InterruptedException {
        return cancelled.await(delay.toMillis(), TimeUnit.MILLISECONDS);
    }
    
    void attach(Future<?> attempt) {
        running.set(attempt);
        if (isCancelled()) {
            attempt.cancel(true);
        }
    }
    
    void detach() {
        running.set(null);
    }
}
