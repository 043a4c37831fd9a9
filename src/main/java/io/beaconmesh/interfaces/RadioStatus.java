package io.beaconmesh.interfaces;

public enum RadioStatus {
    READY,
    /**
     * A capability failure was seen. Nothing is retried until the radio is restored.
     */
    DISABLED,
}
