package io.github.yok.deploykit.db;

import java.time.Duration;

/**
 * Waits between connect attempts.
 *
 * @author Yasuharu.Okawauchi
 */
@FunctionalInterface
public interface Sleeper {

    /** Sleeps on the calling thread. */
    Sleeper THREAD = delay -> Thread.sleep(delay.toMillis());

    /**
     * Blocks for the given delay.
     *
     * @param delay delay
     * @throws InterruptedException when interrupted while waiting
     */
    void sleep(Duration delay) throws InterruptedException;
}
