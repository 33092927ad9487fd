package net.spookly.prober.probe;

import net.spookly.prober.clock.ProbeClock;
import net.spookly.prober.clock.Ticker;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One scheduled check with its own run loop thread.
 *
 * <p>Iterations never overlap: the loop waits for the target to return before it waits for the
 * next tick. The latest result is the only state shared with readers and is exposed as an
 * immutable {@link ProbeResult}.
 */
public final class Probe implements AutoCloseable {
    private final Prober prober;
    private final String name;
    private final Duration interval;
    private final Duration initialDelay;
    private final ProbeClass probeClass;
    private final Map<String, String> labels;
    private final ProbeContext context;
    private final CountDownLatch stopped = new CountDownLatch(1);
    private final AtomicLong successes = new AtomicLong();
    private final AtomicLong failures = new AtomicLong();

    private final Object stateLock = new Object();
    private Thread loopThread;
    private boolean closed;
    private boolean resultBound;

    private final Object resultLock = new Object();
    private ProbeResult lastResult;

    Probe(Prober prober,
          String name,
          Duration interval,
          Map<String, String> labels,
          ProbeClass probeClass,
          Duration initialDelay) {
        this.prober = prober;
        this.name = name;
        this.interval = interval;
        this.labels = Map.copyOf(labels);
        this.probeClass = probeClass;
        this.initialDelay = initialDelay;
        this.context = new ProbeContext(name);
    }

    public String name() {
        return name;
    }

    public Duration interval() {
        return interval;
    }

    public String className() {
        return probeClass.className();
    }

    /**
     * Probe labels merged with the labels of its class. Does not include {@code name} or {@code class}.
     */
    public Map<String, String> labels() {
        return labels;
    }

    public Optional<ProbeResult> lastResult() {
        synchronized (resultLock) {
            return Optional.ofNullable(lastResult);
        }
    }

    public long successCount() {
        return successes.get();
    }

    public long failureCount() {
        return failures.get();
    }

    public boolean isClosed() {
        synchronized (stateLock) {
            return closed;
        }
    }

    ProbeInfo info() {
        return new ProbeInfo(name, className(), labels, interval, lastResult().orElse(null));
    }

    void start() {
        synchronized (stateLock) {
            if (closed || loopThread != null) {
                return;
            }
            try {
                prober.metrics().bind(this);
            } catch (IllegalArgumentException e) {
                closed = true;
                context.cancel();
                finish();
                prober.remove(this);
                throw e;
            }
            loopThread = prober.newLoopThread(name, this::loop);
            loopThread.start();
        }
    }

    /**
     * Stop the probe and remove it from its prober. Blocks until the run loop has exited, unless
     * called from the probe's own target, in which case the loop exits once the target returns.
     */
    @Override
    public void close() {
        boolean neverStarted = false;
        Thread thread;
        synchronized (stateLock) {
            if (!closed) {
                closed = true;
                context.cancel();
                if (loopThread == null) {
                    neverStarted = true;
                } else if (loopThread != Thread.currentThread()) {
                    loopThread.interrupt();
                }
            }
            thread = loopThread;
        }
        if (neverStarted) {
            finish();
        }
        if (thread != Thread.currentThread()) {
            awaitStopped();
        }
        prober.remove(this);
    }

    private void loop() {
        try {
            if (prober.settings().once()) {
                runIteration();
                return;
            }
            if (!initialDelay.isZero() && !awaitInitialDelay()) {
                return;
            }
            Ticker ticker = clock().newTicker(interval);
            try {
                while (!context.isCancelled()) {
                    runIteration();
                    if (context.isCancelled() || !ticker.awaitTick()) {
                        return;
                    }
                }
            } finally {
                ticker.stop();
            }
        } catch (InterruptedException ignored) {
            Thread.currentThread().interrupt();
        } finally {
            finish();
        }
    }

    private boolean awaitInitialDelay() throws InterruptedException {
        Ticker delay = clock().newTicker(initialDelay);
        try {
            return delay.awaitTick() && !context.isCancelled();
        } finally {
            delay.stop();
        }
    }

    private void runIteration() {
        Instant start = clock().now();
        String failure = null;
        try {
            probeClass.target().execute(context);
        } catch (OutOfMemoryError e) {
            throw e;
        } catch (Throwable e) {
            failure = describe(e);
        }
        Instant end = clock().now();
        record(new ProbeResult(start, end, failure == null, failure));
    }

    private void record(ProbeResult result) {
        synchronized (resultLock) {
            lastResult = result;
        }
        if (result.success()) {
            successes.incrementAndGet();
        } else {
            failures.incrementAndGet();
        }
        synchronized (stateLock) {
            if (!closed && !resultBound) {
                resultBound = true;
                prober.metrics().bindResult(this);
            }
        }
    }

    private void finish() {
        stopped.countDown();
        prober.loopExited();
    }

    private void awaitStopped() {
        boolean interrupted = false;
        while (true) {
            try {
                stopped.await();
                break;
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    private ProbeClock clock() {
        return prober.clock();
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        if (message == null || message.trim().isEmpty()) {
            return error.getClass().getSimpleName();
        }
        return message;
    }

    @Override
    public String toString() {
        return "Probe{" + name + ", every " + interval + "}";
    }
}
