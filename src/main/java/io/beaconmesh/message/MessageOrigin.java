package io.beaconmesh.message;

public enum MessageOrigin {
    /**
     * Delivered through a local radio broadcast
     */
    MESH,
    /**
     * Delivered through an internet backed bridge
     */
    BRIDGE,
}
