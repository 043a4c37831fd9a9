package io.beaconmesh.channel;

import io.beaconmesh.exception.MeshException;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.IntFunction;

import static io.beaconmesh.constant.MeshConstant.ACK_CHANNEL;
import static io.beaconmesh.constant.MeshConstant.ACK_CHANNEL_HASH;
import static io.beaconmesh.constant.MeshConstant.CHANNEL_HASH_MASK;
import static io.beaconmesh.constant.MeshConstant.DELETE_CHANNEL;
import static io.beaconmesh.constant.MeshConstant.DELETE_CHANNEL_HASH;
import static io.beaconmesh.constant.MeshConstant.INVITE_CHANNEL;
import static io.beaconmesh.constant.MeshConstant.INVITE_CHANNEL_HASH;
import static io.beaconmesh.constant.MeshConstant.PRESENCE_CHANNEL;
import static io.beaconmesh.exception.MeshExceptionType.CHANNEL_HASH_COLLISION;
import static io.beaconmesh.exception.MeshExceptionType.RESERVED_CHANNEL;
import static java.util.Objects.isNull;
import static java.util.Objects.nonNull;

/**
 * Maps channel ids into the 15 bit hash space of the wire frame and back.
 * <p>
 * Resolution is deny-by-default: a hash resolves only to a channel this device has joined, either
 * registered here or known to the membership directory. Traffic for any other channel is invisible.
 * Two joined channels may share a hash; this is detected and logged at join time but not prevented
 * unless {@code rejectCollisions} is set.
 */
@Slf4j
public class ChannelRouter {
    private static final int SENTINEL_FOLD_MASK = 0x7FFC;

    private final Map<Integer, String> joined = new ConcurrentHashMap<>();
    private final IntFunction<String> directory;
    private final boolean rejectCollisions;

    public ChannelRouter() {
        this(hash -> null, false);
    }

    /**
     * @param directory        external membership lookup consulted when no local registration matches
     * @param rejectCollisions fail {@link #register(String)} instead of replacing a colliding channel
     */
    public ChannelRouter(@NonNull IntFunction<String> directory, boolean rejectCollisions) {
        this.directory = directory;
        this.rejectCollisions = rejectCollisions;
    }

    /**
     * 15 bit hash of a channel id. Never equal to one of the control frame sentinels.
     */
    public static int hash(@NonNull String channelId) {
        var hash = channelId.hashCode() & CHANNEL_HASH_MASK;
        if (hash >= ACK_CHANNEL_HASH) {
            hash &= SENTINEL_FOLD_MASK;
        }

        return hash;
    }

    public static boolean isSentinel(int channelHash) {
        return channelHash == INVITE_CHANNEL_HASH
                || channelHash == DELETE_CHANNEL_HASH
                || channelHash == ACK_CHANNEL_HASH;
    }

    public static boolean isReserved(String channelId) {
        return PRESENCE_CHANNEL.equals(channelId)
                || ACK_CHANNEL.equals(channelId)
                || INVITE_CHANNEL.equals(channelId)
                || DELETE_CHANNEL.equals(channelId);
    }

    /**
     * Join a channel.
     *
     * @return hash the channel is now reachable under
     */
    public int register(@NonNull String channelId) {
        if (isReserved(channelId)) {
            throw new MeshException(RESERVED_CHANNEL, "Channel " + channelId + " is reserved and can't be joined");
        }

        var hash = hash(channelId);
        var previous = joined.get(hash);
        if (nonNull(previous) && !previous.equals(channelId)) {
            if (rejectCollisions) {
                throw new MeshException(
                        CHANNEL_HASH_COLLISION,
                        "Channel " + channelId + " collides with joined channel " + previous + " on hash " + hash
                );
            }
            log.warn("Channel #{} collides with joined channel #{} on hash {}. #{} replaces it.", channelId, previous, hash, channelId);
        }
        joined.put(hash, channelId);
        log.info("Joined channel #{} (hash: {})", channelId, hash);

        return hash;
    }

    public void unregister(@NonNull String channelId) {
        if (joined.remove(hash(channelId), channelId)) {
            log.info("Left channel #{}", channelId);
        }
    }

    /**
     * @return joined channel id for the hash, or null when the channel is not joined
     */
    public String resolve(int channelHash) {
        var hash = channelHash & CHANNEL_HASH_MASK;
        if (isSentinel(hash)) {
            return null;
        }

        var channelId = joined.get(hash);
        if (nonNull(channelId)) {
            return channelId;
        }

        try {
            channelId = directory.apply(hash);
        } catch (Exception e) {
            log.error("Error while resolving channel hash {} in membership directory", hash, e);
            return null;
        }
        if (isNull(channelId) || hash(channelId) != hash) {
            return null;
        }

        return channelId;
    }

    public boolean isJoined(String channelId) {
        return nonNull(channelId) && channelId.equals(joined.get(hash(channelId)));
    }

    public Set<String> joinedChannels() {
        return Set.copyOf(joined.values());
    }
}
