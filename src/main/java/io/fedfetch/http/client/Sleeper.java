package io.fedfetch.http.client;

import java.time.Duration;

/**
 * Waits between retry attempts. Implementations must respond to interruption.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> {
        long millis = duration.toMillis();
        if (millis > 0) {
            Thread.sleep(millis);
        }
    };

    void sleep(Duration duration) throws InterruptedException;
}
