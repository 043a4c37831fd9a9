package io.beaconmesh.interfaces;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class AdvertiseSettings {
    String serviceUuid;

    @Builder.Default
    AdvertiseMode mode = AdvertiseMode.LOW_POWER;

    @Builder.Default
    TxPowerLevel txPowerLevel = TxPowerLevel.MEDIUM;

    @Builder.Default
    boolean connectable = false;

    /**
     * 0 means the engine stops the advertisement itself.
     */
    @Builder.Default
    long timeoutMillis = 0;

    public enum AdvertiseMode {
        LOW_POWER,
        BALANCED,
        LOW_LATENCY,
    }

    public enum TxPowerLevel {
        ULTRA_LOW,
        LOW,
        MEDIUM,
        HIGH,
    }
}
