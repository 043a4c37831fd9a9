package io.beaconmesh.ack;

import io.beaconmesh.channel.ChannelRouter;
import io.beaconmesh.utils.MeshEventLoop;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.collections4.map.LRUMap;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.function.Predicate;

import static io.beaconmesh.constant.MeshConstant.ACK_PREFIX;
import static io.beaconmesh.constant.MeshConstant.ACK_SUFFIX;
import static io.beaconmesh.constant.MeshConstant.HEARTBEAT_CONTENT;
import static io.beaconmesh.constant.MeshConstant.PING_CONTENT;
import static java.util.Objects.isNull;
import static java.util.Objects.nonNull;

/**
 * Tracks outbound messages that expect an ack and retransmits them until one arrives.
 * <p>
 * Records are keyed by message id and matched to incoming acks by the frame fingerprint. At most
 * {@code capacity} records are kept; the least recently used one is dropped when a new one arrives,
 * and its retries stop with it. A record is retried every {@code retryInterval} until
 * {@code maxAttempts} transmissions were made, then it fails. A retry the callback could not put on air
 * does not count as an attempt.
 */
@Slf4j
public class AckManager {
    private final MeshEventLoop eventLoop;
    private final Duration retryInterval;
    private final int maxAttempts;
    private final Predicate<String> retryCallback;

    private final LRUMap<String, AckRecord> records;
    private final Map<String, String> messageIdsByFingerprint = new HashMap<>();

    /**
     * @param retryCallback receives the id of a message to transmit again and answers whether it went out.
     *                      Invoked on the event loop.
     */
    public AckManager(
            @NonNull MeshEventLoop eventLoop,
            @NonNull Duration retryInterval,
            int maxAttempts,
            int capacity,
            @NonNull Predicate<String> retryCallback
    ) {
        this.eventLoop = eventLoop;
        this.retryInterval = retryInterval;
        this.maxAttempts = maxAttempts;
        this.retryCallback = retryCallback;
        this.records = new LRUMap<>(capacity) {
            @Override
            protected boolean removeLRU(LinkEntry<String, AckRecord> entry) {
                var evicted = entry.getValue();
                evicted.cancelRetry();
                messageIdsByFingerprint.remove(evicted.getFingerprint());
                log.warn("Ack cache full, message {} is no longer tracked", evicted.getMessageId());

                return true;
            }
        };
    }

    public static boolean requiresAck(String channelId, String content) {
        if (ChannelRouter.isReserved(channelId)) {
            return false;
        }

        return !HEARTBEAT_CONTENT.equals(content)
                && !PING_CONTENT.equals(content)
                && isNull(extractAckMessageId(content));
    }

    public static String createAckContent(@NonNull String ackId) {
        return ACK_PREFIX + ackId + ACK_SUFFIX;
    }

    /**
     * @return id carried by ack content, or null when the content is not an ack
     */
    public static String extractAckMessageId(String content) {
        if (isNull(content)
                || content.length() < ACK_PREFIX.length() + ACK_SUFFIX.length()
                || !content.startsWith(ACK_PREFIX)
                || !content.endsWith(ACK_SUFFIX)) {
            return null;
        }

        return content.substring(ACK_PREFIX.length(), content.length() - ACK_SUFFIX.length());
    }

    /**
     * Start tracking a message that was just handed over for its first transmission.
     *
     * @return false if the message is already tracked, or if another pending message has the same fingerprint
     */
    public synchronized boolean registerOutbound(@NonNull String messageId, @NonNull String fingerprint) {
        if (records.containsKey(messageId)) {
            log.debug("Message {} already waits for an ack", messageId);
            return false;
        }
        var clash = messageIdsByFingerprint.get(fingerprint);
        if (nonNull(clash)) {
            log.warn("Fingerprint {} of message {} already belongs to pending message {}. Message {} is not tracked.",
                    fingerprint, messageId, clash, messageId);
            return false;
        }

        var record = new AckRecord(messageId, fingerprint);
        records.put(messageId, record);
        messageIdsByFingerprint.put(fingerprint, messageId);
        scheduleRetry(record);
        log.debug("Waiting for ack of message {} (fingerprint {})", messageId, fingerprint);

        return true;
    }

    /**
     * @return true if the ack matched a pending message. Unknown and repeated acks are ignored.
     */
    public synchronized boolean onAckReceived(String fingerprint) {
        var messageId = messageIdsByFingerprint.remove(fingerprint);
        if (isNull(messageId)) {
            log.trace("Ack {} matches no pending message", fingerprint);
            return false;
        }

        var record = records.remove(messageId);
        if (isNull(record)) {
            return false;
        }
        record.cancelRetry();
        record.setStatus(AckStatus.DELIVERED);
        log.debug("Message {} delivered after {} attempt(s)", messageId, record.getAttempts());

        return true;
    }

    public synchronized boolean isPending(String messageId) {
        var record = records.get(messageId, false);

        return nonNull(record) && record.isPending();
    }

    public synchronized int pendingCount() {
        return records.size();
    }

    public synchronized void clearAll() {
        records.values().forEach(AckRecord::cancelRetry);
        records.clear();
        messageIdsByFingerprint.clear();
    }

    private void scheduleRetry(AckRecord record) {
        record.setRetryTask(eventLoop.schedule(() -> onRetryTimeout(record), retryInterval));
    }

    private void onRetryTimeout(AckRecord record) {
        synchronized (this) {
            if (records.get(record.getMessageId(), false) != record || !record.isPending()) {
                return;
            }
            if (record.getAttempts() >= maxAttempts) {
                record.setStatus(AckStatus.FAILED);
                record.setRetryTask(null);
                records.remove(record.getMessageId());
                messageIdsByFingerprint.remove(record.getFingerprint());
                log.warn("No ack for message {} after {} attempts", record.getMessageId(), record.getAttempts());
                return;
            }
            record.setAttempts(record.getAttempts() + 1);
            scheduleRetry(record);
        }

        log.debug("Retrying message {}, attempt {}", record.getMessageId(), record.getAttempts());
        boolean sent;
        try {
            sent = retryCallback.test(record.getMessageId());
        } catch (Exception e) {
            log.error("Error while retrying message {}", record.getMessageId(), e);
            sent = true;
        }
        if (!sent) {
            synchronized (this) {
                record.setAttempts(record.getAttempts() - 1);
            }
            log.debug("Retry of message {} deferred", record.getMessageId());
        }
    }
}
