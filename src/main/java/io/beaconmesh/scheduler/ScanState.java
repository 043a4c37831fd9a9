package io.beaconmesh.scheduler;

public enum ScanState {
    STOPPED,
    ACTIVE,
}
