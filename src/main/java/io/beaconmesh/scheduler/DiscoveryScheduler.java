package io.beaconmesh.scheduler;

import io.beaconmesh.config.MeshConf;
import io.beaconmesh.frame.BeaconCodec;
import io.beaconmesh.interfaces.AdvertiseCallback;
import io.beaconmesh.interfaces.AdvertiseSettings;
import io.beaconmesh.interfaces.RadioFailure;
import io.beaconmesh.interfaces.RadioInterface;
import io.beaconmesh.interfaces.RadioStatus;
import io.beaconmesh.interfaces.ScanCallback;
import io.beaconmesh.interfaces.ScanFilter;
import io.beaconmesh.message.Message;
import io.beaconmesh.transport.DedupFilter;
import io.beaconmesh.transport.OutboundQueue;
import io.beaconmesh.upstream.PeerTracker;
import io.beaconmesh.utils.MeshEventLoop;
import io.beaconmesh.utils.MeshStatistics;
import io.beaconmesh.utils.ScheduledTask;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

import static io.beaconmesh.constant.MeshConstant.MAX_PAYLOAD_BYTES;
import static io.beaconmesh.constant.MeshConstant.MAX_PAYLOAD_REFUSALS;
import static java.util.Objects.isNull;
import static java.util.Objects.nonNull;
import static org.apache.commons.codec.binary.Hex.encodeHexString;

/**
 * Shares one radio between listening and short transmit bursts.
 * <p>
 * Scanning runs until no frame arrived for the idle timeout. Each outbound message is advertised for a
 * fixed duration; a newer message replaces the one on air. When an advertisement ends the scan is
 * restarted if it had stopped and the next queued message goes out. A message whose payload is too large
 * goes to the back of the queue and is dropped after {@value io.beaconmesh.constant.MeshConstant#MAX_PAYLOAD_REFUSALS}
 * refusals.
 * <p>
 * All state lives on the event loop. Radio callbacks are posted there as {@link RadioEvent}s and
 * handled in {@link #dispatch(RadioEvent)}; an event from a superseded operation is dropped.
 */
@Slf4j
public class DiscoveryScheduler {
    private final MeshConf conf;
    private final RadioInterface radio;
    private final BeaconCodec codec;
    private final OutboundQueue outboundQueue;
    private final DedupFilter dedupFilter;
    private final MeshEventLoop eventLoop;
    private final PeerTracker peerTracker;
    private final InboundFrameListener frameListener;
    private final MeshStatistics statistics;
    private final List<Consumer<ScanState>> scanStateListeners = new CopyOnWriteArrayList<>();
    private final Map<String, Integer> payloadRefusals = new HashMap<>();

    @Getter
    private volatile ScanState scanState = ScanState.STOPPED;
    @Getter
    private volatile AdvertiseState advertiseState = AdvertiseState.IDLE;
    @Getter
    private volatile RadioStatus radioStatus = RadioStatus.READY;
    @Getter
    private volatile boolean started;

    private long scanGeneration;
    private long advertiseGeneration;
    private Message onAir;
    private ScheduledTask scanIdleTask;
    private ScheduledTask scanRetryTask;
    private ScheduledTask advertiseStopTask;
    private ScheduledTask drainRetryTask;

    public DiscoveryScheduler(
            @NonNull MeshConf conf,
            @NonNull RadioInterface radio,
            @NonNull BeaconCodec codec,
            @NonNull OutboundQueue outboundQueue,
            @NonNull DedupFilter dedupFilter,
            @NonNull MeshEventLoop eventLoop,
            @NonNull PeerTracker peerTracker,
            @NonNull InboundFrameListener frameListener,
            @NonNull MeshStatistics statistics
    ) {
        this.conf = conf;
        this.radio = radio;
        this.codec = codec;
        this.outboundQueue = outboundQueue;
        this.dedupFilter = dedupFilter;
        this.eventLoop = eventLoop;
        this.peerTracker = peerTracker;
        this.frameListener = frameListener;
        this.statistics = statistics;
    }

    public void addScanStateListener(@NonNull Consumer<ScanState> listener) {
        scanStateListeners.add(listener);
    }

    public void start() {
        eventLoop.execute(() -> {
            if (started) {
                return;
            }
            started = true;
            log.info("Discovery scheduler started on {}", radio.getInterfaceName());
            startScan();
            drainOne();
        });
    }

    /**
     * Stop all radio activity. Queued messages are discarded.
     */
    public void stop() {
        runOnLoop(() -> {
            if (!started) {
                return;
            }
            started = false;
            cancelTimers();
            if (advertiseState == AdvertiseState.ADVERTISING) {
                advertiseGeneration++;
                advertiseState = AdvertiseState.IDLE;
                stopAdvertiseRadio();
            }
            if (scanState == ScanState.ACTIVE) {
                stopScan();
            }
            var discarded = outboundQueue.size();
            outboundQueue.clear();
            payloadRefusals.clear();
            onAir = null;
            log.info("Discovery scheduler stopped, {} queued message(s) discarded", discarded);
        });
    }

    /**
     * Transmit now if the radio allows, otherwise queue. Never blocks and never fails for radio conditions.
     */
    public void submit(@NonNull Message message) {
        eventLoop.execute(() -> transmit(message));
    }

    /**
     * The platform reports the radio usable again after a capability failure.
     */
    public void radioRestored() {
        eventLoop.execute(() -> {
            if (radioStatus == RadioStatus.READY) {
                return;
            }
            radioStatus = RadioStatus.READY;
            log.info("Radio {} restored", radio.getInterfaceName());
            if (started) {
                startScan();
                drainOne();
            }
        });
    }

    void dispatch(RadioEvent event) {
        switch (event.getType()) {
            case SCAN_RESULT:
                if (event.getGeneration() == scanGeneration && scanState == ScanState.ACTIVE) {
                    onScanResult(event.getServiceData(), event.getRssi());
                }
                break;
            case SCAN_FAILED:
                if (event.getGeneration() == scanGeneration) {
                    onScanFailed(event.getFailure());
                } else {
                    log.debug("Stale scan failure {} ignored", event.getFailure());
                }
                break;
            case ADVERTISE_STARTED:
                if (event.getGeneration() == advertiseGeneration && advertiseState == AdvertiseState.ADVERTISING) {
                    onAdvertiseStarted();
                } else {
                    log.debug("Stale advertise start ignored");
                }
                break;
            case ADVERTISE_FAILED:
                if (event.getGeneration() == advertiseGeneration && advertiseState == AdvertiseState.ADVERTISING) {
                    onAdvertiseFailed(event.getFailure());
                } else {
                    log.debug("Stale advertise failure {} ignored", event.getFailure());
                }
                break;
            default:
                log.warn("Unknown radio event {}", event.getType());
        }
    }

    private void transmit(Message message) {
        if (!started || radioStatus == RadioStatus.DISABLED) {
            if (outboundQueue.contains(message.getId())) {
                log.debug("Radio not available, message {} already queued", message.getId());
                return;
            }
            outboundQueue.enqueue(message);
            log.debug("Radio not available, message {} queued", message.getId());
            return;
        }

        var payload = codec.encode(message);
        if (payload.length > MAX_PAYLOAD_BYTES) {
            log.error("Payload of message {} is {} bytes, more than {}", message.getId(), payload.length, MAX_PAYLOAD_BYTES);
            holdRefused(message);
            scheduleDrain();
            return;
        }

        if (advertiseState == AdvertiseState.ADVERTISING) {
            log.debug("Replacing advertisement of message {} with {}", nonNull(onAir) ? onAir.getId() : null, message.getId());
            cancel(advertiseStopTask);
            stopAdvertiseRadio();
        }
        cancel(drainRetryTask);

        var generation = ++advertiseGeneration;
        advertiseState = AdvertiseState.ADVERTISING;
        onAir = message;
        log.trace("Advertising {}", encodeHexString(payload));

        var settings = AdvertiseSettings.builder()
                .serviceUuid(conf.getServiceUuid())
                .build();
        try {
            radio.startAdvertise(settings, payload, new AdvertiseCallback() {
                @Override
                public void onStartSuccess() {
                    eventLoop.execute(() -> dispatch(RadioEvent.advertiseStarted(generation)));
                }

                @Override
                public void onStartFailure(RadioFailure failure) {
                    eventLoop.execute(() -> dispatch(RadioEvent.advertiseFailed(generation, failure)));
                }
            });
        } catch (RuntimeException e) {
            log.error("Error while starting advertise on {}", radio.getInterfaceName(), e);
            onAdvertiseFailed(RadioFailure.fromException(e));
        }
    }

    private void onAdvertiseStarted() {
        statistics.getBeaconsStarted().incrementAndGet();
        if (nonNull(onAir)) {
            payloadRefusals.remove(onAir.getId());
        }
        log.debug("Advertising message {} for {} ms", nonNull(onAir) ? onAir.getId() : null, conf.getAdvertiseDuration());
        var generation = advertiseGeneration;
        advertiseStopTask = eventLoop.schedule(() -> onAdvertiseWindowEnd(generation), conf.advertiseDuration());
        startScan();
    }

    private void onAdvertiseWindowEnd(long generation) {
        if (generation != advertiseGeneration || advertiseState != AdvertiseState.ADVERTISING) {
            return;
        }
        advertiseStopTask = null;
        stopAdvertiseRadio();
        advertiseState = AdvertiseState.IDLE;
        onAir = null;
        startScan();
        drainOne();
    }

    private void onAdvertiseFailed(RadioFailure failure) {
        statistics.getAdvertiseFailures().incrementAndGet();
        advertiseState = AdvertiseState.IDLE;
        advertiseGeneration++;
        var failed = onAir;
        onAir = null;
        log.error("Advertise failed on {}: {} ({})", radio.getInterfaceName(), failure, failure.getCategory());

        switch (failure.getCategory()) {
            case CAPABILITY:
                if (nonNull(failed)) {
                    outboundQueue.enqueue(failed);
                }
                disable(failure);
                return;
            case CAPACITY:
                if (nonNull(failed)) {
                    holdRefused(failed);
                }
                break;
            default:
                break;
        }
        startScan();
        scheduleDrain();
    }

    /**
     * Put a refused message at the back of the queue, or drop it once it was refused too often.
     */
    private void holdRefused(Message message) {
        var refusals = payloadRefusals.merge(message.getId(), 1, Integer::sum);
        if (refusals >= MAX_PAYLOAD_REFUSALS) {
            payloadRefusals.remove(message.getId());
            log.error("Message {} dropped, its payload was refused {} times", message.getId(), refusals);
            return;
        }
        outboundQueue.enqueue(message);
        log.error("Message {} held, its payload was refused {} time(s)", message.getId(), refusals);
    }

    private void scheduleDrain() {
        cancel(drainRetryTask);
        drainRetryTask = eventLoop.schedule(this::drainOne, conf.advertiseRetryDelay());
    }

    private void drainOne() {
        drainRetryTask = null;
        if (!started || radioStatus == RadioStatus.DISABLED || advertiseState != AdvertiseState.IDLE) {
            return;
        }

        var next = outboundQueue.dequeue();
        if (nonNull(next)) {
            transmit(next);
        }
    }

    private void startScan() {
        if (!started || radioStatus == RadioStatus.DISABLED || scanState == ScanState.ACTIVE) {
            return;
        }
        cancel(scanRetryTask);
        scanRetryTask = null;

        var generation = ++scanGeneration;
        scanState = ScanState.ACTIVE;
        var filter = ScanFilter.builder()
                .serviceUuid(conf.getServiceUuid())
                .build();
        try {
            radio.startScan(filter, new ScanCallback() {
                @Override
                public void onScanResult(byte[] serviceData, int rssi) {
                    eventLoop.execute(() -> dispatch(RadioEvent.scanResult(generation, serviceData, rssi)));
                }

                @Override
                public void onScanFailed(RadioFailure failure) {
                    eventLoop.execute(() -> dispatch(RadioEvent.scanFailed(generation, failure)));
                }
            });
        } catch (RuntimeException e) {
            log.error("Error while starting scan on {}", radio.getInterfaceName(), e);
            onScanFailed(RadioFailure.fromException(e));
            return;
        }
        if (scanState != ScanState.ACTIVE) {
            return;
        }

        log.info("Scanning started on {}", radio.getInterfaceName());
        resetScanIdleTimer();
        notifyScanState(ScanState.ACTIVE);
    }

    private void stopScan() {
        scanGeneration++;
        cancel(scanIdleTask);
        scanIdleTask = null;
        scanState = ScanState.STOPPED;
        try {
            radio.stopScan();
        } catch (RuntimeException e) {
            log.error("Error while stopping scan on {}", radio.getInterfaceName(), e);
        }
        log.info("Scanning stopped on {}", radio.getInterfaceName());
        notifyScanState(ScanState.STOPPED);
    }

    private void onScanFailed(RadioFailure failure) {
        statistics.getScanFailures().incrementAndGet();
        var wasActive = scanState == ScanState.ACTIVE;
        scanGeneration++;
        scanState = ScanState.STOPPED;
        cancel(scanIdleTask);
        scanIdleTask = null;
        log.error("Scan failed on {}: {} ({})", radio.getInterfaceName(), failure, failure.getCategory());
        if (wasActive) {
            notifyScanState(ScanState.STOPPED);
        }

        if (failure.isCapability()) {
            disable(failure);
            return;
        }
        scanRetryTask = eventLoop.schedule(() -> {
            scanRetryTask = null;
            startScan();
        }, conf.scanRetryDelay());
    }

    private void resetScanIdleTimer() {
        cancel(scanIdleTask);
        var generation = scanGeneration;
        scanIdleTask = eventLoop.schedule(() -> {
            if (generation == scanGeneration && scanState == ScanState.ACTIVE) {
                log.debug("No frame for {} ms", conf.getScanIdleTimeout());
                stopScan();
            }
        }, conf.scanIdleTimeout());
    }

    private void onScanResult(byte[] raw, int rssi) {
        if (isNull(raw)) {
            return;
        }
        resetScanIdleTimer();
        statistics.getFramesReceived().incrementAndGet();

        var senderId = BeaconCodec.extractSenderId(raw);
        if (nonNull(senderId)) {
            try {
                peerTracker.onPeerSeen(senderId, rssi);
            } catch (Exception e) {
                log.error("Error while reporting peer {}", senderId, e);
            }
        }

        var frameHash = DedupFilter.hashOf(raw);
        if (dedupFilter.isDuplicate(frameHash)) {
            statistics.getDuplicatesDropped().incrementAndGet();
            log.trace("Duplicate frame {} dropped", frameHash);
            return;
        }
        dedupFilter.record(frameHash);

        var frame = codec.decode(raw);
        if (isNull(frame)) {
            statistics.getFramesFiltered().incrementAndGet();
            return;
        }

        try {
            frameListener.onFrame(frame, rssi);
        } catch (Exception e) {
            log.error("Error while handling {} frame from {}", frame.getType(), senderId, e);
        }
    }

    private void disable(RadioFailure failure) {
        radioStatus = RadioStatus.DISABLED;
        cancel(scanRetryTask);
        scanRetryTask = null;
        cancel(drainRetryTask);
        drainRetryTask = null;
        log.error("Radio {} disabled: {}. Outbound messages are held until it is restored.", radio.getInterfaceName(), failure);
    }

    private void stopAdvertiseRadio() {
        try {
            radio.stopAdvertise();
        } catch (RuntimeException e) {
            log.error("Error while stopping advertise on {}", radio.getInterfaceName(), e);
        }
    }

    private void notifyScanState(ScanState state) {
        for (var listener : scanStateListeners) {
            try {
                listener.accept(state);
            } catch (Exception e) {
                log.error("Error while notifying scan state {}", state, e);
            }
        }
    }

    private void cancelTimers() {
        cancel(scanIdleTask);
        cancel(scanRetryTask);
        cancel(advertiseStopTask);
        cancel(drainRetryTask);
        scanIdleTask = null;
        scanRetryTask = null;
        advertiseStopTask = null;
        drainRetryTask = null;
    }

    private void runOnLoop(Runnable task) {
        if (eventLoop.inEventLoop()) {
            task.run();
        } else {
            eventLoop.execute(task);
        }
    }

    private static void cancel(ScheduledTask task) {
        if (nonNull(task)) {
            task.cancel();
        }
    }
}
