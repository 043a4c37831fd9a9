package io.beaconmesh.ack;

public enum AckStatus {
    PENDING,
    DELIVERED,
    FAILED,
}
