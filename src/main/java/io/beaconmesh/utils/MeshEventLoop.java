package io.beaconmesh.utils;

import java.time.Duration;

/**
 * Serialized execution context owning all engine timers. Tasks submitted here never run concurrently
 * with each other, so state touched only from loop tasks needs no locking.
 */
public interface MeshEventLoop {

    void execute(Runnable task);

    ScheduledTask schedule(Runnable task, Duration delay);

    boolean inEventLoop();

    void shutdown();
}
