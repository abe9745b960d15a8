package com.tenant.auth.server.key;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Keeps a {@link CachingSigningKeySource} warm so verification rarely waits on a fetch.
 */
public class SigningKeyRefresher implements AutoCloseable {

    private final ScheduledExecutorService ses = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "signing-key-refresher");
        t.setDaemon(true);
        return t;
    });

    public SigningKeyRefresher(CachingSigningKeySource keySource, Duration period) {
        long millis = period.toMillis();
        ses.scheduleWithFixedDelay(keySource::refreshIfNeeded, 0, millis, TimeUnit.MILLISECONDS);
    }

    @Override
    public void close() {
        ses.shutdownNow();
    }
}
