package io.beaconmesh.config;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.beaconmesh.exception.MeshException;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.time.Duration;

import static io.beaconmesh.constant.MeshConstant.ACK_CACHE_CAPACITY;
import static io.beaconmesh.constant.MeshConstant.ACK_MAX_ATTEMPTS;
import static io.beaconmesh.constant.MeshConstant.ACK_RETRY_INTERVAL;
import static io.beaconmesh.constant.MeshConstant.ADVERTISE_DURATION;
import static io.beaconmesh.constant.MeshConstant.ADVERTISE_RETRY_DELAY;
import static io.beaconmesh.constant.MeshConstant.DEDUP_CAPACITY;
import static io.beaconmesh.constant.MeshConstant.HEARTBEAT_INTERVAL;
import static io.beaconmesh.constant.MeshConstant.OUTBOUND_QUEUE_CAPACITY;
import static io.beaconmesh.constant.MeshConstant.SCAN_IDLE_TIMEOUT;
import static io.beaconmesh.constant.MeshConstant.SCAN_RETRY_DELAY;
import static io.beaconmesh.constant.MeshConstant.SERVICE_UUID;
import static io.beaconmesh.exception.MeshExceptionType.INVALID_CONFIG;
import static org.apache.commons.lang3.StringUtils.isBlank;

/**
 * Engine settings. Every field carries its default, so a YAML file only has to name what it overrides.
 */
@Getter
@Setter
@ToString
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class MeshConf {

    @JsonProperty("sender_id")
    private String senderId;

    @JsonProperty("sender_name")
    private String senderName;

    @JsonAlias({"service_uuid", "uuid"})
    @Builder.Default
    private String serviceUuid = SERVICE_UUID;

    @JsonProperty("scan_idle_timeout_ms")
    @Builder.Default
    private long scanIdleTimeout = SCAN_IDLE_TIMEOUT;

    @JsonProperty("advertise_duration_ms")
    @Builder.Default
    private long advertiseDuration = ADVERTISE_DURATION;

    @JsonProperty("scan_retry_delay_ms")
    @Builder.Default
    private long scanRetryDelay = SCAN_RETRY_DELAY;

    @JsonProperty("advertise_retry_delay_ms")
    @Builder.Default
    private long advertiseRetryDelay = ADVERTISE_RETRY_DELAY;

    @JsonProperty("outbound_queue_capacity")
    @Builder.Default
    private int outboundQueueCapacity = OUTBOUND_QUEUE_CAPACITY;

    @JsonProperty("dedup_capacity")
    @Builder.Default
    private int dedupCapacity = DEDUP_CAPACITY;

    @JsonProperty("ack_cache_capacity")
    @Builder.Default
    private int ackCacheCapacity = ACK_CACHE_CAPACITY;

    @JsonProperty("ack_retry_interval_ms")
    @Builder.Default
    private long ackRetryInterval = ACK_RETRY_INTERVAL;

    @JsonProperty("ack_max_attempts")
    @Builder.Default
    private int ackMaxAttempts = ACK_MAX_ATTEMPTS;

    @JsonProperty("heartbeat_enabled")
    @Builder.Default
    private boolean heartbeatEnabled = true;

    @JsonProperty("heartbeat_interval_ms")
    @Builder.Default
    private long heartbeatInterval = HEARTBEAT_INTERVAL;

    /**
     * When true, joining a channel whose hash is already taken by another joined channel fails.
     * Off by default: colliding channels then cross-deliver, which is logged.
     */
    @JsonProperty("reject_hash_collisions")
    @Builder.Default
    private boolean rejectHashCollisions = false;

    public Duration scanIdleTimeout() {
        return Duration.ofMillis(scanIdleTimeout);
    }

    public Duration advertiseDuration() {
        return Duration.ofMillis(advertiseDuration);
    }

    public Duration scanRetryDelay() {
        return Duration.ofMillis(scanRetryDelay);
    }

    public Duration advertiseRetryDelay() {
        return Duration.ofMillis(advertiseRetryDelay);
    }

    public Duration ackRetryInterval() {
        return Duration.ofMillis(ackRetryInterval);
    }

    public Duration heartbeatInterval() {
        return Duration.ofMillis(heartbeatInterval);
    }

    public MeshConf validate() {
        if (isBlank(senderId)) {
            throw new MeshException(INVALID_CONFIG, "sender_id must be set");
        }
        requirePositive("scan_idle_timeout_ms", scanIdleTimeout);
        requirePositive("advertise_duration_ms", advertiseDuration);
        requirePositive("scan_retry_delay_ms", scanRetryDelay);
        requirePositive("advertise_retry_delay_ms", advertiseRetryDelay);
        requirePositive("outbound_queue_capacity", outboundQueueCapacity);
        requirePositive("dedup_capacity", dedupCapacity);
        requirePositive("ack_cache_capacity", ackCacheCapacity);
        requirePositive("ack_retry_interval_ms", ackRetryInterval);
        requirePositive("ack_max_attempts", ackMaxAttempts);
        requirePositive("heartbeat_interval_ms", heartbeatInterval);

        return this;
    }

    private static void requirePositive(String key, long value) {
        if (value <= 0) {
            throw new MeshException(INVALID_CONFIG, key + " must be positive, got " + value);
        }
    }
}
