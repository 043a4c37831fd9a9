package io.beaconmesh;

import io.beaconmesh.channel.ChannelRouter;
import io.beaconmesh.config.MeshConf;
import io.beaconmesh.exception.MeshException;
import io.beaconmesh.exception.MeshExceptionType;
import io.beaconmesh.interfaces.FakeRadio;
import io.beaconmesh.interfaces.RadioFailure;
import io.beaconmesh.interfaces.RadioStatus;
import io.beaconmesh.message.Message;
import io.beaconmesh.message.MessageOrigin;
import io.beaconmesh.scheduler.ScanState;
import io.beaconmesh.upstream.MessageRouter;
import io.beaconmesh.upstream.PeerTracker;
import io.beaconmesh.utils.ManualEventLoop;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;

import static io.beaconmesh.constant.MeshConstant.PRESENCE_CHANNEL;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.apache.commons.lang3.ArrayUtils.subarray;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class BeaconMeshTest {

    @Mock
    private MessageRouter aliceRouter;
    @Mock
    private MessageRouter bobRouter;
    @Mock
    private PeerTracker alicePeers;
    @Mock
    private PeerTracker bobPeers;

    private ManualEventLoop eventLoop;
    private FakeRadio aliceRadio;
    private FakeRadio bobRadio;
    private BeaconMesh alice;
    private BeaconMesh bob;

    @BeforeEach
    void setUp() {
        eventLoop = new ManualEventLoop();
        aliceRadio = new FakeRadio("alice-radio");
        bobRadio = new FakeRadio("bob-radio").connect(aliceRadio);
        alice = new BeaconMesh(conf("A1"), aliceRadio, aliceRouter, alicePeers, eventLoop);
        bob = new BeaconMesh(conf("B1"), bobRadio, bobRouter, bobPeers, eventLoop);
    }

    @AfterEach
    void tearDown() {
        alice.stop();
        bob.stop();
    }

    @Test
    void messageIsDeliveredAndAcknowledged() {
        alice.joinChannel("general");
        bob.joinChannel("general");
        alice.start();
        bob.start();

        var sent = alice.send("general", "hello");

        verify(bobRouter).onMeshMessageReceived(argThat(message -> "hello".equals(message.getContent())
                && "general".equals(message.getChannelId())
                && "A1".equals(message.getSenderId())
                && message.getOrigin() == MessageOrigin.MESH), eq(-60));
        verify(bobPeers).onPeerSeen("A1", -60);
        assertEquals(1, bob.getStatistics().getAcksSent().get());
        assertEquals(1, alice.getStatistics().getAcksReceived().get());
        assertFalse(alice.isAwaitingAck(sent.getId()));

        eventLoop.advance(Duration.ofSeconds(30));
        assertEquals(0, alice.getStatistics().getRetries().get());
        verify(aliceRouter, never()).onMeshMessageReceived(argThat(message -> true), anyInt());
    }

    @Test
    void unacknowledgedMessageIsRetried() {
        alice.joinChannel("general");
        alice.start();

        var sent = alice.send("general", "anyone?");
        assertTrue(alice.isAwaitingAck(sent.getId()));

        eventLoop.advance(Duration.ofMillis(1750));
        assertEquals(1, alice.getStatistics().getRetries().get());
        assertEquals(2, aliceRadio.getAdvertised().size());
        assertArrayEquals(aliceRadio.getAdvertised().get(0), aliceRadio.getAdvertised().get(1));

        eventLoop.advance(Duration.ofSeconds(30));
        assertEquals(2, alice.getStatistics().getRetries().get());
        assertFalse(alice.isAwaitingAck(sent.getId()));
    }

    @Test
    void messagesOfTheSameSecondAreAckedSeparately() {
        alice.joinChannel("general");
        bob.joinChannel("general");
        var first = alice.send(outgoing("first", 1_700_000_000_000L));
        var second = alice.send(outgoing("second", 1_700_000_000_400L));

        bob.start();
        alice.start();
        eventLoop.advance(Duration.ofSeconds(30));

        verify(bobRouter, times(2)).onMeshMessageReceived(argThat(message -> true), anyInt());
        assertEquals(2, bob.getStatistics().getAcksSent().get());
        assertEquals(2, alice.getStatistics().getAcksReceived().get());
        assertFalse(alice.isAwaitingAck(first.getId()));
        assertFalse(alice.isAwaitingAck(second.getId()));
    }

    @Test
    void retryWhileRadioDisabledDoesNotQueueCopies() {
        alice.joinChannel("general");
        alice.start();
        aliceRadio.failNextAdvertise(RadioFailure.PERMISSION_DENIED);

        var sent = alice.send("general", "held");
        eventLoop.advance(Duration.ofSeconds(30));

        assertEquals(RadioStatus.DISABLED, alice.getRadioStatus());
        assertEquals(1, alice.getQueuedCount());
        assertEquals(0, alice.getStatistics().getRetries().get());
        assertTrue(alice.isAwaitingAck(sent.getId()));

        alice.radioRestored();

        assertEquals(0, alice.getQueuedCount());
        assertEquals(2, aliceRadio.getAdvertised().size());
        assertArrayEquals(aliceRadio.getAdvertised().get(0), aliceRadio.lastAdvertised());
    }

    @Test
    void longMessageIsTruncated() {
        alice.joinChannel("general");
        bob.joinChannel("general");
        alice.start();
        bob.start();

        var sent = alice.send("general", "this is a long message");

        assertEquals("this is...", sent.getContent());
        assertTrue(aliceRadio.lastAdvertised().length <= 20);
        verify(bobRouter).onMeshMessageReceived(argThat(message -> "this is...".equals(message.getContent())), eq(-60));
    }

    @Test
    void identicalFramesAreDeliveredOnce() {
        bob.joinChannel("general");
        bob.start();
        alice.start();
        alice.send("general", "once");
        var frame = aliceRadio.lastAdvertised();

        for (int i = 0; i < 10; i++) {
            bobRadio.hear(frame, -40);
        }

        verify(bobRouter).onMeshMessageReceived(argThat(message -> "once".equals(message.getContent())), eq(-60));
        verify(bobRouter, never()).onMeshMessageReceived(argThat(message -> true), eq(-40));
        assertEquals(10, bob.getStatistics().getDuplicatesDropped().get());
    }

    @Test
    void unjoinedChannelIsNotDelivered() {
        bob.joinChannel("general");
        alice.start();
        bob.start();

        alice.send("secret", "psst");

        verify(bobRouter, never()).onMeshMessageReceived(argThat(message -> true), anyInt());
        verify(bobPeers).onPeerSeen("A1", -60);
        assertEquals(0, bob.getStatistics().getAcksSent().get());
    }

    @Test
    void channelFromMembershipDirectory() {
        lenient().when(bobRouter.resolveChannelByHash(ChannelRouter.hash("team"))).thenReturn("team");
        alice.start();
        bob.start();

        alice.send("team", "standup");

        verify(bobRouter).onMeshMessageReceived(argThat(message -> "team".equals(message.getChannelId())), eq(-60));
        assertEquals(1, alice.getStatistics().getAcksReceived().get());
    }

    @Test
    void invite() {
        alice.start();
        bob.start();

        alice.broadcastInvite("Fun", "fun");

        verify(bobRouter).onChannelInviteReceived(ChannelRouter.hash("fun"), "Fun", "A1");
        assertEquals(0, bob.getStatistics().getAcksSent().get());
    }

    @Test
    void deletion() {
        alice.start();
        bob.start();

        alice.broadcastDeletion("fun");

        verify(bobRouter).onChannelDeletionReceived("fun", "A1");
    }

    @Test
    void heartbeatWhileScanning() {
        var heartbeatRadio = new FakeRadio("heartbeat-radio");
        var listenerRadio = new FakeRadio("listener-radio").connect(heartbeatRadio);
        var heartbeating = new BeaconMesh(conf("H1").toBuilder().heartbeatEnabled(true).build(), heartbeatRadio, aliceRouter, alicePeers, eventLoop);
        var listener = new BeaconMesh(conf("L1"), listenerRadio, bobRouter, bobPeers, eventLoop);
        listener.start();

        heartbeating.start();
        assertEquals(1, heartbeatRadio.getAdvertised().size());
        eventLoop.advance(Duration.ofSeconds(36));

        assertEquals(2, heartbeatRadio.getAdvertised().size());
        verify(bobPeers, times(2)).onPeerSeen("H1", -60);
        verify(bobRouter, never()).onMeshMessageReceived(argThat(message -> true), anyInt());
        assertEquals(0, listener.getStatistics().getAcksSent().get());
        heartbeating.stop();
        listener.stop();
    }

    @Test
    void ping() {
        alice.start();

        alice.ping();

        var frame = aliceRadio.lastAdvertised();
        assertEquals(ChannelRouter.hash(PRESENCE_CHANNEL), ((frame[4] & 0xFF) << 8) | (frame[5] & 0xFF));
        assertEquals("[ping]", new String(subarray(frame, 10, frame.length), UTF_8));
    }

    @Test
    void messagesSentBeforeStartAreQueued() {
        alice.send("general", "early");
        assertEquals(1, alice.getQueuedCount());
        assertTrue(aliceRadio.getAdvertised().isEmpty());

        alice.start();

        assertEquals(0, alice.getQueuedCount());
        assertEquals(1, aliceRadio.getAdvertised().size());
    }

    @Test
    void oneEnginePerRadio() {
        alice.start();
        var second = new BeaconMesh(conf("A2"), aliceRadio, aliceRouter, alicePeers, eventLoop);

        var e = assertThrows(MeshException.class, second::start);
        assertEquals(MeshExceptionType.RADIO_IN_USE, e.getType());

        alice.stop();
        var third = new BeaconMesh(conf("A3"), aliceRadio, aliceRouter, alicePeers, eventLoop);
        third.start();
        assertTrue(third.isRunning());
        third.stop();
    }

    @Test
    void stoppedEngineRejectsUse() {
        alice.start();

        alice.stop();

        assertFalse(alice.isRunning());
        assertEquals(ScanState.STOPPED, alice.getScanState());
        assertFalse(eventLoop.isShutdown());
        var e = assertThrows(MeshException.class, () -> alice.send("general", "late"));
        assertEquals(MeshExceptionType.ENGINE_STOPPED, e.getType());
        assertThrows(MeshException.class, alice::start);
    }

    @Test
    void fromConfig() throws IOException {
        var engine = BeaconMesh.fromConfig(Path.of("src/test/resources/beaconmesh-test.yml"), new FakeRadio("configured"), aliceRouter, alicePeers);

        assertEquals("t1", engine.getConf().getSenderId());
        assertEquals(2000, engine.getConf().getAdvertiseDuration());
        assertFalse(engine.isRunning());
        engine.stop();
    }

    @Test
    void reservedChannelCanNotBeJoined() {
        var e = assertThrows(MeshException.class, () -> alice.joinChannel(PRESENCE_CHANNEL));

        assertEquals(MeshExceptionType.RESERVED_CHANNEL, e.getType());
    }

    @Test
    void radioRestoredAfterPermissionDenied() {
        alice.start();
        aliceRadio.failNextAdvertise(RadioFailure.PERMISSION_DENIED);

        alice.send(Message.builder().senderId("A1").channelId("general").content("hi").build());
        assertEquals(RadioStatus.DISABLED, alice.getRadioStatus());
        assertEquals(1, alice.getQueuedCount());

        alice.radioRestored();

        assertEquals(RadioStatus.READY, alice.getRadioStatus());
        assertEquals(0, alice.getQueuedCount());
        assertEquals(2, aliceRadio.getAdvertised().size());
    }

    private static Message outgoing(String content, long timestamp) {
        return Message.builder()
                .senderId("A1")
                .channelId("general")
                .content(content)
                .timestamp(timestamp)
                .build();
    }

    private static MeshConf conf(String senderId) {
        return MeshConf.builder()
                .senderId(senderId)
                .senderName(senderId)
                .heartbeatEnabled(false)
                .build();
    }
}
