package io.beaconmesh.scheduler;

public enum RadioEventType {
    SCAN_RESULT,
    SCAN_FAILED,
    ADVERTISE_STARTED,
    ADVERTISE_FAILED,
}
