package com.clapgrow.summary.whatsapp.service;

import java.time.Duration;

/**
 * Suspends the drain loop. Replaced in tests so backoff and pacing run without real delays.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
