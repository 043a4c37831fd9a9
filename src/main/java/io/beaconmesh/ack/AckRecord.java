package io.beaconmesh.ack;

import io.beaconmesh.utils.ScheduledTask;
import lombok.Data;

import java.time.Instant;

import static java.util.Objects.nonNull;

/**
 * Tracking state of one outbound message that waits for an ack.
 */
@Data
public class AckRecord {
    private final String messageId;
    private final String fingerprint;
    private final Instant registeredAt = Instant.now();
    /**
     * Transmissions so far, initial one included
     */
    private int attempts = 1;
    private AckStatus status = AckStatus.PENDING;
    private ScheduledTask retryTask;

    void cancelRetry() {
        if (nonNull(retryTask)) {
            retryTask.cancel();
            retryTask = null;
        }
    }

    public boolean isPending() {
        return status == AckStatus.PENDING;
    }
}
