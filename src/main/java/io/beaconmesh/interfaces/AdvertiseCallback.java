package io.beaconmesh.interfaces;

public interface AdvertiseCallback {

    void onStartSuccess();

    void onStartFailure(RadioFailure failure);
}
