package com.purchasingpower.proofengine.service.proof;

import com.purchasingpower.proofengine.configuration.ProofAnalysisProperties;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Step and deadline limit for one analysis pass.
 *
 * <p>Loops call {@link #tryConsume(String)} once per unit of work and stop when it
 * returns false. Exhaustion is sticky and logged once. Passes that run concurrently
 * each take their own {@link #fork()} so that where one of them stops never depends
 * on how the others were scheduled.
 */
@Slf4j
public class AnalysisBudget {

    private final long maxSteps;
    private final long deadlineNanos;
    private final AtomicLong steps = new AtomicLong();
    private final AtomicBoolean exhausted = new AtomicBoolean();
    private volatile String exhaustedIn;

    public AnalysisBudget(long maxSteps, Duration timeout) {
        this(maxSteps, System.nanoTime() + timeout.toNanos());
    }

    private AnalysisBudget(long maxSteps, long deadlineNanos) {
        this.maxSteps = maxSteps;
        this.deadlineNanos = deadlineNanos;
    }

    public static AnalysisBudget from(ProofAnalysisProperties.Budget settings) {
        return new AnalysisBudget(settings.getMaxSteps(), settings.getTimeout());
    }

    public static AnalysisBudget unlimited() {
        return new AnalysisBudget(Long.MAX_VALUE, Duration.ofDays(1));
    }

    /**
     * Records one unit of work in {@code stage}.
     *
     * @return false once the step cap or the deadline has been passed
     */
    public boolean tryConsume(String stage) {
        if (exhausted.get()) {
            return false;
        }
        long used = steps.incrementAndGet();
        if (used > maxSteps || System.nanoTime() > deadlineNanos) {
            if (exhausted.compareAndSet(false, true)) {
                exhaustedIn = stage;
                log.warn("Analysis budget exhausted in {} after {} steps", stage, used);
            }
            return false;
        }
        return true;
    }

    /**
     * New budget holding the steps this one has left and the same deadline.
     * A fork of an exhausted budget starts exhausted in the same stage.
     */
    public AnalysisBudget fork() {
        AnalysisBudget child = new AnalysisBudget(Math.max(0, maxSteps - steps.get()), deadlineNanos);
        if (exhausted.get()) {
            child.exhausted.set(true);
            child.exhaustedIn = exhaustedIn;
        }
        return child;
    }

    public boolean isExhausted() {
        return exhausted.get();
    }

    public String getExhaustedIn() {
        return exhaustedIn;
    }

    public long getStepsUsed() {
        return steps.get();
    }
}
