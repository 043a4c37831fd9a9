package io.beaconmesh.presence;

import io.beaconmesh.scheduler.ScanState;
import io.beaconmesh.utils.MeshEventLoop;
import io.beaconmesh.utils.ScheduledTask;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

import static java.util.Objects.nonNull;

/**
 * Announces this device on the presence pseudo-channel while it is listening: once when scanning starts,
 * then every interval until scanning stops. Driven by scan state changes on the event loop.
 */
@Slf4j
public class PresenceBeacon {
    private final MeshEventLoop eventLoop;
    private final Duration interval;
    private final Runnable heartbeat;

    private ScheduledTask nextBeat;

    public PresenceBeacon(@NonNull MeshEventLoop eventLoop, @NonNull Duration interval, @NonNull Runnable heartbeat) {
        this.eventLoop = eventLoop;
        this.interval = interval;
        this.heartbeat = heartbeat;
    }

    public void onScanStateChanged(ScanState scanState) {
        if (scanState == ScanState.ACTIVE) {
            if (isRunning()) {
                return;
            }
            log.debug("Presence heartbeat every {} ms", interval.toMillis());
            beat();
        } else {
            stop();
        }
    }

    public void stop() {
        if (nonNull(nextBeat)) {
            nextBeat.cancel();
            nextBeat = null;
            log.debug("Presence heartbeat stopped");
        }
    }

    public boolean isRunning() {
        return nonNull(nextBeat);
    }

    private void beat() {
        nextBeat = eventLoop.schedule(this::beat, interval);
        try {
            heartbeat.run();
        } catch (Exception e) {
            log.error("Error while sending heartbeat", e);
        }
    }
}
