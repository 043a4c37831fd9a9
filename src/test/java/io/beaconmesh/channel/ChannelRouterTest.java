package io.beaconmesh.channel;

import io.beaconmesh.exception.MeshException;
import io.beaconmesh.exception.MeshExceptionType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Set;

import static io.beaconmesh.constant.MeshConstant.ACK_CHANNEL_HASH;
import static io.beaconmesh.constant.MeshConstant.DELETE_CHANNEL_HASH;
import static io.beaconmesh.constant.MeshConstant.INVITE_CHANNEL_HASH;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ChannelRouterTest {

    @ParameterizedTest
    @CsvSource({
            "general, 2280",
            "random, 25795",
            "fun-1, 12131",
    })
    void hash(String channelId, int expected) {
        assertEquals(expected, ChannelRouter.hash(channelId));
        assertEquals(ChannelRouter.hash(channelId), ChannelRouter.hash(new String(channelId)));
    }

    /**
     * These ids hash to the ack, delete and invite sentinels before folding.
     */
    @ParameterizedTest
    @ValueSource(strings = {"jxra", "iuoa", "hrla"})
    void hashNeverProducesSentinel(String channelId) {
        var hash = ChannelRouter.hash(channelId);

        assertEquals(0x7FFC, hash);
        assertFalse(ChannelRouter.isSentinel(hash));
    }

    @Test
    void sentinels() {
        assertTrue(ChannelRouter.isSentinel(INVITE_CHANNEL_HASH));
        assertTrue(ChannelRouter.isSentinel(DELETE_CHANNEL_HASH));
        assertTrue(ChannelRouter.isSentinel(ACK_CHANNEL_HASH));
        assertFalse(ChannelRouter.isSentinel(0x7FFC));
    }

    @Test
    void registerAndResolve() {
        var router = new ChannelRouter();

        var hash = router.register("general");

        assertEquals(ChannelRouter.hash("general"), hash);
        assertEquals("general", router.resolve(hash));
        assertTrue(router.isJoined("general"));
        assertEquals(Set.of("general"), router.joinedChannels());
    }

    @Test
    void notJoinedResolvesToNull() {
        var router = new ChannelRouter();
        router.register("general");

        assertNull(router.resolve(ChannelRouter.hash("random")));
        assertNull(router.resolve(INVITE_CHANNEL_HASH));
        assertFalse(router.isJoined("random"));
        assertFalse(router.isJoined(null));
    }

    @Test
    void unregister() {
        var router = new ChannelRouter();
        router.register("general");

        router.unregister("general");

        assertNull(router.resolve(ChannelRouter.hash("general")));
        assertTrue(router.joinedChannels().isEmpty());
    }

    @ParameterizedTest
    @ValueSource(strings = {"_presence", "_ack", "_invite", "_delete"})
    void reservedChannelsCanNotBeJoined(String channelId) {
        var router = new ChannelRouter();

        var e = assertThrows(MeshException.class, () -> router.register(channelId));

        assertEquals(MeshExceptionType.RESERVED_CHANNEL, e.getType());
    }

    @Test
    void collidingChannelReplacesPrevious() {
        var router = new ChannelRouter();
        router.register("Aa");

        router.register("BB");

        assertEquals("BB", router.resolve(ChannelRouter.hash("Aa")));
        assertFalse(router.isJoined("Aa"));
        assertTrue(router.isJoined("BB"));
    }

    @Test
    void leavingReplacedChannelKeepsNewOne() {
        var router = new ChannelRouter();
        router.register("Aa");
        router.register("BB");

        router.unregister("Aa");

        assertTrue(router.isJoined("BB"));
    }

    @Test
    void collisionRejectedWhenConfigured() {
        var router = new ChannelRouter(hash -> null, true);
        router.register("Aa");

        var e = assertThrows(MeshException.class, () -> router.register("BB"));

        assertEquals(MeshExceptionType.CHANNEL_HASH_COLLISION, e.getType());
        assertTrue(router.isJoined("Aa"));
        assertEquals(ChannelRouter.hash("Aa"), router.register("Aa"));
    }

    @Test
    void directoryFallback() {
        var remoteHash = ChannelRouter.hash("remote");
        var router = new ChannelRouter(hash -> hash == remoteHash ? "remote" : null, false);

        assertEquals("remote", router.resolve(remoteHash));
        assertNull(router.resolve(ChannelRouter.hash("general")));
    }

    @Test
    void directoryAnswerMustMatchHash() {
        var router = new ChannelRouter(hash -> "remote", false);

        assertNull(router.resolve(ChannelRouter.hash("general")));
    }

    @Test
    void failingDirectoryResolvesToNull() {
        var router = new ChannelRouter(hash -> {
            throw new IllegalStateException("directory offline");
        }, false);

        assertNull(router.resolve(ChannelRouter.hash("general")));
    }
}
