package io.beaconmesh.scheduler;

public enum AdvertiseState {
    IDLE,
    /**
     * An advertisement was requested or is on air
     */
    ADVERTISING,
}
