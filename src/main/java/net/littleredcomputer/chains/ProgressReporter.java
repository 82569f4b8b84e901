// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.chains;

import com.google.common.base.Stopwatch;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.message.FormattedMessage;

import java.time.Duration;
import java.time.Instant;
import java.util.function.Supplier;

/**
 * Counts steps of a long enumeration and logs the rate every so often.
 */
public class ProgressReporter {
    private static final Logger log = LogManager.getFormatterLogger(ProgressReporter.class);
    private final String name;
    private long stepCount;
    private long lastStepCount;
    private Duration logInterval = Duration.ofMillis(1000);
    private Instant lastLogTime = Instant.EPOCH;
    private final Stopwatch stopwatch = Stopwatch.createUnstarted();

    public ProgressReporter(String name) {
        this.name = name;
    }

    public ProgressReporter setLogInterval(Duration interval) {
        logInterval = interval;
        return this;
    }

    public long stepCount() { return stepCount; }

    public void start() {
        if (!stopwatch.isRunning()) stopwatch.start();
        lastLogTime = Instant.now();
        lastStepCount = stepCount;
    }

    /**
     * Counts one step and logs progress if the log interval has elapsed.
     * @param state describes the current state; evaluated only when a log line is written
     */
    public void step(Supplier<String> state) {
        ++stepCount;
        Instant now = Instant.now();
        Duration tween = Duration.between(lastLogTime, now);
        if (tween.compareTo(logInterval) < 0) return;
        final double perSec = 1e3 * (stepCount - lastStepCount) / Math.max(1, tween.toMillis());
        log.info(() -> new FormattedMessage("%s %d steps %s %.0f/sec %s", name, stepCount, stopwatch, perSec, state.get()));
        lastLogTime = now;
        lastStepCount = stepCount;
    }

    public void finish() {
        if (stopwatch.isRunning()) stopwatch.stop();
        log.info("%s done: %d steps in %s", name, stepCount, stopwatch);
    }
}
