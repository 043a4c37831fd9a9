package io.beaconmesh.utils;

import lombok.Getter;
import lombok.ToString;

import java.util.concurrent.atomic.AtomicLong;

@Getter
@ToString
public class MeshStatistics {
    private final AtomicLong framesReceived = new AtomicLong();
    private final AtomicLong duplicatesDropped = new AtomicLong();
    private final AtomicLong framesFiltered = new AtomicLong();
    private final AtomicLong messagesDelivered = new AtomicLong();
    private final AtomicLong beaconsStarted = new AtomicLong();
    private final AtomicLong advertiseFailures = new AtomicLong();
    private final AtomicLong scanFailures = new AtomicLong();
    private final AtomicLong acksSent = new AtomicLong();
    private final AtomicLong acksReceived = new AtomicLong();
    private final AtomicLong retries = new AtomicLong();
}
