package io.kubestate.exporter.consumer;

import org.springframework.util.backoff.BackOff;
import org.springframework.util.backoff.ExponentialBackOff;

import java.time.Duration;

/**
 * Timing of the list/watch loop.
 *
 * @param resyncPeriod   interval of the unconditional full re-list, also the server side lifetime of a watch
 * @param requestTimeout bound of each list call
 * @param pollInterval   maximum time one wait for a watch event may block
 * @param backOff        delay policy between failed attempts
 */
public record SyncSettings(
        Duration resyncPeriod,
        Duration requestTimeout,
        Duration pollInterval,
        BackOff backOff
) {

    public static SyncSettings of(Duration resyncPeriod, Duration requestTimeout,
                                  Duration initialBackOff, Duration maxBackOff) {
        ExponentialBackOff backOff = new ExponentialBackOff(initialBackOff.toMillis(), 2.0);
        backOff.setMaxInterval(maxBackOff.toMillis());
        return new SyncSettings(resyncPeriod, requestTimeout, Duration.ofSeconds(1), backOff);
    }
}
