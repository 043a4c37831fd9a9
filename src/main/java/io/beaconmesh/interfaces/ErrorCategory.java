package io.beaconmesh.interfaces;

public enum ErrorCategory {
    /**
     * Malformed or too short frame. Dropped locally, never surfaced.
     */
    PROTOCOL,
    /**
     * Radio unsupported or permission denied. Radio stays disabled until restored externally.
     */
    CAPABILITY,
    /**
     * Retried automatically on a fixed delay.
     */
    TRANSIENT_RADIO,
    /**
     * Payload would exceed the beacon size. The message is held, never truncated.
     */
    CAPACITY,
}
