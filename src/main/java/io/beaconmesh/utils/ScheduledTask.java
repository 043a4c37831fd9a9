package io.beaconmesh.utils;

/**
 * Cancellation handle of a task scheduled on a {@link MeshEventLoop}.
 */
public interface ScheduledTask {

    /**
     * @return true if the task will not run because of this call
     */
    boolean cancel();

    boolean isDone();
}
