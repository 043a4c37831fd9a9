package io.beaconmesh.scheduler;

import io.beaconmesh.frame.DecodedFrame;

/**
 * Receives every frame that passed deduplication and decoded. Called on the event loop.
 */
@FunctionalInterface
public interface InboundFrameListener {

    void onFrame(DecodedFrame frame, int rssi);
}
