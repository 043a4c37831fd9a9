package io.beaconmesh;

import io.beaconmesh.ack.AckManager;
import io.beaconmesh.channel.ChannelRouter;
import io.beaconmesh.config.ConfigObj;
import io.beaconmesh.config.MeshConf;
import io.beaconmesh.exception.MeshException;
import io.beaconmesh.frame.BeaconCodec;
import io.beaconmesh.frame.DecodedFrame;
import io.beaconmesh.interfaces.RadioInterface;
import io.beaconmesh.interfaces.RadioStatus;
import io.beaconmesh.message.Message;
import io.beaconmesh.message.MessageOrigin;
import io.beaconmesh.presence.PresenceBeacon;
import io.beaconmesh.scheduler.AdvertiseState;
import io.beaconmesh.scheduler.DiscoveryScheduler;
import io.beaconmesh.scheduler.ScanState;
import io.beaconmesh.transport.DedupFilter;
import io.beaconmesh.transport.OutboundQueue;
import io.beaconmesh.upstream.MessageRouter;
import io.beaconmesh.upstream.PeerTracker;
import io.beaconmesh.utils.MeshEventLoop;
import io.beaconmesh.utils.MeshStatistics;
import io.beaconmesh.utils.NettyMeshEventLoop;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.collections4.map.LRUMap;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

import static io.beaconmesh.constant.MeshConstant.ACK_CHANNEL;
import static io.beaconmesh.constant.MeshConstant.CONFIG_FILE_NAME;
import static io.beaconmesh.constant.MeshConstant.DELETE_CHANNEL;
import static io.beaconmesh.constant.MeshConstant.ELLIPSIS;
import static io.beaconmesh.constant.MeshConstant.HEARTBEAT_CONTENT;
import static io.beaconmesh.constant.MeshConstant.INVITE_CHANNEL;
import static io.beaconmesh.constant.MeshConstant.MAX_MESH_TEXT_CHARS;
import static io.beaconmesh.constant.MeshConstant.PING_CONTENT;
import static io.beaconmesh.constant.MeshConstant.PRESENCE_CHANNEL;
import static io.beaconmesh.exception.MeshExceptionType.ENGINE_STOPPED;
import static io.beaconmesh.exception.MeshExceptionType.RADIO_IN_USE;
import static java.util.Objects.isNull;
import static java.util.Objects.nonNull;
import static org.apache.commons.lang3.StringUtils.abbreviate;

/**
 * Mesh messaging engine for one radio.
 * <p>
 * Wires the codec, channel router, dedup filter, outbound queue, discovery scheduler and ack manager
 * together and routes decoded frames to the application's {@link MessageRouter}. Only one running
 * engine may use a given {@link RadioInterface}.
 * <p>
 * Lifecycle: {@link #start()} once, {@link #stop()} once. Messages sent before start are queued.
 */
@Slf4j
public class BeaconMesh implements AutoCloseable {
    private static final Set<RadioInterface> radiosInUse = Collections.newSetFromMap(new IdentityHashMap<>());

    @Getter
    private final MeshConf conf;
    private final RadioInterface radio;
    private final MessageRouter messageRouter;
    private final MeshEventLoop eventLoop;
    private final boolean ownEventLoop;

    @Getter
    private final MeshStatistics statistics = new MeshStatistics();
    @Getter
    private final ChannelRouter channelRouter;
    private final BeaconCodec codec;
    private final OutboundQueue outboundQueue;
    private final AckManager ackManager;
    private final DiscoveryScheduler scheduler;
    private final PresenceBeacon presenceBeacon;

    private final Lock sentLock = new ReentrantLock();
    private final LRUMap<String, Message> sentMessages;

    private volatile EngineState state = EngineState.NEW;

    private enum EngineState {
        NEW,
        RUNNING,
        STOPPED,
    }

    public BeaconMesh(MeshConf conf, RadioInterface radio, MessageRouter messageRouter, PeerTracker peerTracker) {
        this(conf, radio, messageRouter, peerTracker, new NettyMeshEventLoop("beacon-mesh-" + conf.getSenderId()), true);
    }

    /**
     * @param eventLoop loop the engine runs on. Not shut down by {@link #stop()}.
     */
    public BeaconMesh(
            MeshConf conf,
            RadioInterface radio,
            MessageRouter messageRouter,
            PeerTracker peerTracker,
            MeshEventLoop eventLoop
    ) {
        this(conf, radio, messageRouter, peerTracker, eventLoop, false);
    }

    private BeaconMesh(
            @NonNull MeshConf conf,
            @NonNull RadioInterface radio,
            @NonNull MessageRouter messageRouter,
            @NonNull PeerTracker peerTracker,
            @NonNull MeshEventLoop eventLoop,
            boolean ownEventLoop
    ) {
        this.conf = conf.validate();
        this.radio = radio;
        this.messageRouter = messageRouter;
        this.eventLoop = eventLoop;
        this.ownEventLoop = ownEventLoop;

        this.channelRouter = new ChannelRouter(messageRouter::resolveChannelByHash, conf.isRejectHashCollisions());
        this.codec = new BeaconCodec(channelRouter);
        this.outboundQueue = new OutboundQueue(conf.getOutboundQueueCapacity());
        this.sentMessages = new LRUMap<>(conf.getAckCacheCapacity());
        this.ackManager = new AckManager(
                eventLoop,
                conf.ackRetryInterval(),
                conf.getAckMaxAttempts(),
                conf.getAckCacheCapacity(),
                this::retry
        );
        this.scheduler = new DiscoveryScheduler(
                conf,
                radio,
                codec,
                outboundQueue,
                new DedupFilter(conf.getDedupCapacity()),
                eventLoop,
                peerTracker,
                this::onFrame,
                statistics
        );

        if (conf.isHeartbeatEnabled()) {
            this.presenceBeacon = new PresenceBeacon(eventLoop, conf.heartbeatInterval(), this::sendHeartbeat);
            scheduler.addScanStateListener(presenceBeacon::onScanStateChanged);
        } else {
            this.presenceBeacon = null;
        }
    }

    /**
     * @param configPath YAML file, or a directory holding {@value io.beaconmesh.constant.MeshConstant#CONFIG_FILE_NAME}
     */
    public static BeaconMesh fromConfig(
            @NonNull Path configPath,
            RadioInterface radio,
            MessageRouter messageRouter,
            PeerTracker peerTracker
    ) throws IOException {
        var configFile = Files.isDirectory(configPath) ? configPath.resolve(CONFIG_FILE_NAME) : configPath;
        log.info("Loading mesh configuration from {}", configFile);
        var config = ConfigObj.initConfig(configFile);

        return new BeaconMesh(config.getMesh(), radio, messageRouter, peerTracker);
    }

    public void start() {
        if (state != EngineState.NEW) {
            throw new MeshException(ENGINE_STOPPED, "Engine " + conf.getSenderId() + " can only be started once");
        }
        synchronized (radiosInUse) {
            if (!radiosInUse.add(radio)) {
                throw new MeshException(RADIO_IN_USE, "Radio " + radio.getInterfaceName() + " is used by another engine");
            }
        }
        state = EngineState.RUNNING;
        log.info("Beacon mesh {} starting on {}", conf.getSenderId(), radio.getInterfaceName());
        scheduler.start();
    }

    /**
     * Stop radio activity, cancel every timer and release the radio. Queued and unacknowledged messages are dropped.
     */
    public void stop() {
        if (state == EngineState.STOPPED) {
            return;
        }
        if (state == EngineState.NEW) {
            state = EngineState.STOPPED;
            shutdownEventLoop();
            return;
        }
        state = EngineState.STOPPED;

        scheduler.stop();
        ackManager.clearAll();
        if (nonNull(presenceBeacon)) {
            eventLoop.execute(presenceBeacon::stop);
        }
        sentLock.lock();
        try {
            sentMessages.clear();
        } finally {
            sentLock.unlock();
        }
        synchronized (radiosInUse) {
            radiosInUse.remove(radio);
        }
        shutdownEventLoop();
        log.info("Beacon mesh {} stopped. {}", conf.getSenderId(), statistics);
    }

    private void shutdownEventLoop() {
        if (ownEventLoop) {
            eventLoop.shutdown();
        }
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return state == EngineState.RUNNING;
    }

    /**
     * Broadcast a text message. Content longer than the mesh limit is shortened to fit, ending in "...".
     *
     * @return the message as it goes on air
     */
    public Message send(@NonNull Message message) {
        checkNotStopped();

        var outbound = message.toBuilder()
                .content(truncate(message.getContent()))
                .origin(MessageOrigin.MESH)
                .build();
        if (AckManager.requiresAck(outbound.getChannelId(), outbound.getContent())) {
            sentLock.lock();
            try {
                sentMessages.put(outbound.getId(), outbound);
            } finally {
                sentLock.unlock();
            }
            var tracked = ackManager.registerOutbound(outbound.getId(), BeaconCodec.fingerprint(codec.encode(outbound)));
            if (!tracked && !ackManager.isPending(outbound.getId())) {
                forgetSent(outbound.getId());
            }
        }
        scheduler.submit(outbound);

        return outbound;
    }

    public Message send(@NonNull String channelId, @NonNull String text) {
        return send(localMessage(channelId, text));
    }

    /**
     * Invite nearby devices to a channel. The channel name may be shortened on air.
     */
    public void broadcastInvite(@NonNull String channelName, @NonNull String channelId) {
        checkNotStopped();
        log.info("Inviting to channel #{} ({})", channelId, channelName);
        scheduler.submit(localMessage(INVITE_CHANNEL, BeaconCodec.inviteContent(channelName, channelId)));
    }

    public void broadcastDeletion(@NonNull String channelName) {
        checkNotStopped();
        log.info("Announcing deletion of channel {}", channelName);
        scheduler.submit(localMessage(DELETE_CHANNEL, channelName));
    }

    public void ping() {
        checkNotStopped();
        scheduler.submit(localMessage(PRESENCE_CHANNEL, PING_CONTENT));
    }

    public int joinChannel(@NonNull String channelId) {
        return channelRouter.register(channelId);
    }

    public void leaveChannel(@NonNull String channelId) {
        channelRouter.unregister(channelId);
    }

    /**
     * Resume after the platform reported the radio usable again, for example after a permission was granted.
     */
    public void radioRestored() {
        scheduler.radioRestored();
    }

    public RadioStatus getRadioStatus() {
        return scheduler.getRadioStatus();
    }

    public ScanState getScanState() {
        return scheduler.getScanState();
    }

    public AdvertiseState getAdvertiseState() {
        return scheduler.getAdvertiseState();
    }

    public int getQueuedCount() {
        return outboundQueue.size();
    }

    public boolean isAwaitingAck(String messageId) {
        return ackManager.isPending(messageId);
    }

    private void onFrame(DecodedFrame frame, int rssi) {
        switch (frame.getType()) {
            case MESSAGE:
                var message = frame.getMessage();
                statistics.getMessagesDelivered().incrementAndGet();
                try {
                    messageRouter.onMeshMessageReceived(message, rssi);
                } catch (Exception e) {
                    log.error("Error while delivering message {} from {}", message.getId(), message.getSenderId(), e);
                }
                if (AckManager.requiresAck(message.getChannelId(), message.getContent())) {
                    sendAck(frame.getFingerprint());
                }
                break;
            case INVITE:
                var invite = frame.getInvite();
                log.info("Invite to channel #{} ({}) from {}", invite.getChannelId(), invite.getChannelName(), invite.getSenderId());
                try {
                    messageRouter.onChannelInviteReceived(invite.getChannelHash(), invite.getChannelName(), invite.getSenderId());
                } catch (Exception e) {
                    log.error("Error while delivering invite from {}", invite.getSenderId(), e);
                }
                break;
            case DELETION:
                var deletion = frame.getDeletion();
                log.info("Channel {} deleted by {}", deletion.getChannelName(), deletion.getSenderId());
                try {
                    messageRouter.onChannelDeletionReceived(deletion.getChannelName(), deletion.getSenderId());
                } catch (Exception e) {
                    log.error("Error while delivering deletion from {}", deletion.getSenderId(), e);
                }
                break;
            case ACK:
                var ackId = AckManager.extractAckMessageId(frame.getMessage().getContent());
                if (isNull(ackId)) {
                    log.debug("Malformed ack from {}", frame.getMessage().getSenderId());
                } else if (ackManager.onAckReceived(ackId)) {
                    statistics.getAcksReceived().incrementAndGet();
                }
                break;
            default:
                log.warn("Unhandled frame type {}", frame.getType());
        }
    }

    private void sendAck(String fingerprint) {
        if (state != EngineState.RUNNING) {
            return;
        }
        statistics.getAcksSent().incrementAndGet();
        scheduler.submit(localMessage(ACK_CHANNEL, AckManager.createAckContent(fingerprint)));
    }

    private void sendHeartbeat() {
        if (state == EngineState.RUNNING) {
            scheduler.submit(localMessage(PRESENCE_CHANNEL, HEARTBEAT_CONTENT));
        }
    }

    /**
     * @return false when the radio can't take the message now, so the attempt is not used up
     */
    private boolean retry(String messageId) {
        if (!scheduler.isStarted() || scheduler.getRadioStatus() == RadioStatus.DISABLED) {
            log.debug("Radio unavailable, retry of message {} deferred", messageId);
            return false;
        }

        Message message;
        sentLock.lock();
        try {
            message = sentMessages.get(messageId);
        } finally {
            sentLock.unlock();
        }
        if (isNull(message)) {
            log.debug("Message {} no longer cached, retry abandoned", messageId);
            return true;
        }

        statistics.getRetries().incrementAndGet();
        scheduler.submit(message);

        return true;
    }

    private void forgetSent(String messageId) {
        sentLock.lock();
        try {
            sentMessages.remove(messageId);
        } finally {
            sentLock.unlock();
        }
    }

    private Message localMessage(String channelId, String content) {
        return Message.builder()
                .channelId(channelId)
                .senderId(conf.getSenderId())
                .senderName(conf.getSenderName())
                .content(content)
                .origin(MessageOrigin.MESH)
                .build();
    }

    private void checkNotStopped() {
        if (state == EngineState.STOPPED) {
            throw new MeshException(ENGINE_STOPPED, "Engine " + conf.getSenderId() + " is stopped");
        }
    }

    static String truncate(String content) {
        return abbreviate(content, ELLIPSIS, MAX_MESH_TEXT_CHARS);
    }
}
