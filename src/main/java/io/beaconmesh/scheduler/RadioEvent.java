package io.beaconmesh.scheduler;

import io.beaconmesh.interfaces.RadioFailure;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Radio callback turned into a value for the event loop. {@code generation} identifies the scan or
 * advertise operation that produced it.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class RadioEvent {
    RadioEventType type;
    long generation;
    byte[] serviceData;
    int rssi;
    RadioFailure failure;

    public static RadioEvent scanResult(long generation, byte[] serviceData, int rssi) {
        return new RadioEvent(RadioEventType.SCAN_RESULT, generation, serviceData, rssi, null);
    }

    public static RadioEvent scanFailed(long generation, RadioFailure failure) {
        return new RadioEvent(RadioEventType.SCAN_FAILED, generation, null, 0, failure);
    }

    public static RadioEvent advertiseStarted(long generation) {
        return new RadioEvent(RadioEventType.ADVERTISE_STARTED, generation, null, 0, null);
    }

    public static RadioEvent advertiseFailed(long generation, RadioFailure failure) {
        return new RadioEvent(RadioEventType.ADVERTISE_FAILED, generation, null, 0, failure);
    }
}
