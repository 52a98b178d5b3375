package com.treesync.util;

import com.treesync.api.DrainListener;
import com.treesync.api.Observer;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * The default diagnostic sink: writes observer failures to the log, throttled.
 */
public final class LoggingDrainListener implements DrainListener {
    private static final Logger log = LogManager.getLogger(LoggingDrainListener.class);

    private final ErrorRateLimiter errLimiter;

    public LoggingDrainListener(long errorLogIntervalMillis) {
        this.errLimiter = new ErrorRateLimiter(log, errorLogIntervalMillis);
    }

    @Override
    public void onDrainStart(long cycle) {
        log.trace("Drain {} started", cycle);
    }

    @Override
    public void onCallbackError(long cycle, Observer<?> observer, Object source, Throwable error) {
        errLimiter.log(String.format("Observer failed in drain %d for source %s: %s",
                cycle, source, error.getMessage()), error);
    }

    @Override
    public void onDrainEnd(long cycle, int invoked) {
        log.trace("Drain {} finished, {} callbacks", cycle, invoked);
    }
}
