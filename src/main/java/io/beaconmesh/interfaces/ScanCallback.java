package io.beaconmesh.interfaces;

public interface ScanCallback {

    /**
     * @param serviceData service data of the broadcast, null when the record carried none
     * @param rssi        received signal strength, dBm
     */
    void onScanResult(byte[] serviceData, int rssi);

    void onScanFailed(RadioFailure failure);
}
