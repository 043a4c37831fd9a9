package io.beaconmesh.upstream;

public interface PeerTracker {

    /**
     * Called for the sender of every received frame, whether or not the rest of it decodes.
     */
    void onPeerSeen(String peerId, int rssi);
}
