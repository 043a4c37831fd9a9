package io.beaconmesh.interfaces;

/**
 * Narrow view of the platform radio stack. Start operations are asynchronous: completion and failures
 * arrive through the supplied callback, possibly on any thread. Implementations may also throw a
 * {@link RuntimeException} synchronously, {@link SecurityException} when permission is missing.
 */
public interface RadioInterface {

    default String getInterfaceName() {
        return getClass().getSimpleName();
    }

    void startScan(ScanFilter filter, ScanCallback callback);

    void stopScan();

    void startAdvertise(AdvertiseSettings settings, byte[] payload, AdvertiseCallback callback);

    void stopAdvertise();
}
