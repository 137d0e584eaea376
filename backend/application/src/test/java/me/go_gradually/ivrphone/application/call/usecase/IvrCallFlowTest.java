package me.go_gradually.ivrphone.application.call.usecase;

import me.go_gradually.ivrphone.application.call.model.IncomingCallRequest;
import me.go_gradually.ivrphone.application.call.model.OngoingCall;
import me.go_gradually.ivrphone.application.call.policy.CallPolicy;
import me.go_gradually.ivrphone.application.call.port.MediaSession;
import me.go_gradually.ivrphone.application.call.port.MediaSessionFactory;
import me.go_gradually.ivrphone.application.shared.port.MetricsPort;
import me.go_gradually.ivrphone.domain.call.CallId;
import me.go_gradually.ivrphone.domain.call.CallPhase;
import me.go_gradually.ivrphone.domain.sound.SoundCatalog;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.logging.Level;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class IvrCallFlowTest {

    @Mock
    private MediaSessionFactory mediaSessionFactory;
    @Mock
    private MediaSession mediaSession;
    @Mock
    private CallPolicy callPolicy;
    @Mock
    private MetricsPort metrics;

    private final IncomingCallRequest request = new TestRequest();
    private InMemoryTestRegistry registry;
    private FakeUserAgent userAgent;
    private ScriptedAudioPlayer player;

    @BeforeEach
    void setUp() {
        registry = new InMemoryTestRegistry();
        userAgent = new FakeUserAgent("call-1");
        player = new ScriptedAudioPlayer();
        lenient().when(callPolicy.answerTimeoutMs()).thenReturn(1_000L);
        lenient().when(mediaSessionFactory.create(any())).thenReturn(mediaSession);
    }

    @Test
    void answerAndGreet_registersCallAndPlaysWelcome() {
        IvrCallFlow flow = newFlow();

        assertTrue(flow.accept());
        flow.answerAndGreet();

        assertEquals(List.of("welcome"), player.played());
        assertEquals(CallPhase.AWAITING_DIGITS, flow.getPhase());
        assertEquals(CallId.of("call-1"), flow.getCallId());
        assertTrue(registry.find(CallId.of("call-1")).isPresent());
        verify(metrics).incrementCallAccepted();
        verify(metrics).recordGreetingLatency(any(Duration.class));
    }

    @Test
    void pound_playsCollectedDigitsInOrderAndClearsThem() {
        IvrCallFlow flow = answeredFlow();

        try (CapturedLog log = new CapturedLog(IvrCallFlow.class)) {
            userAgent.press('1');
            userAgent.press('2');
            userAgent.press('3');
            assertEquals(3, flow.pendingDigits());

            userAgent.press('#');

            assertEquals(List.of("welcome", "one", "two", "three"), player.played());
            assertEquals(0, flow.pendingDigits());
            assertTrue(log.contains(Level.INFO, "ivr.digits.cleared"));
            assertEquals(4, log.count("ivr.dtmf.received"));
        }
        verify(metrics).recordPlaybackLatency(any(Duration.class));
    }

    @Test
    void pound_withNothingCollected_playsNumbersNotFound() {
        answeredFlow();

        userAgent.press('#');

        assertEquals(List.of("welcome", "numbers-not-found"), player.played());
    }

    @Test
    void star_playsExplanationAndKeepsDigits() {
        IvrCallFlow flow = answeredFlow();

        userAgent.press('4');
        userAgent.press('*');
        userAgent.press('#');

        assertEquals(List.of("welcome", "explanation", "four"), player.played());
        assertEquals(0, flow.pendingDigits());
    }

    @Test
    void unknownToneCode_isIgnoredWithWarning() {
        IvrCallFlow flow = answeredFlow();

        try (CapturedLog log = new CapturedLog(IvrCallFlow.class)) {
            userAgent.listener().onDtmfTone((byte) 14, 80);

            assertTrue(log.contains(Level.WARNING, "ivr.dtmf.unrecognized"));
        }
        assertEquals(List.of("welcome"), player.played());
        assertEquals(0, flow.pendingDigits());
        verify(metrics).incrementUnrecognizedTone();
    }

    @Test
    void toneDuringGreeting_isHeldUntilGreetingFinished() throws Exception {
        player.holdOn(SoundCatalog.WELCOME);
        IvrCallFlow flow = newFlow();
        assertTrue(flow.accept());
        Thread greeting = new Thread(flow::answerAndGreet);
        greeting.start();
        assertTrue(player.awaitHeld());

        Thread tones = new Thread(() -> {
            userAgent.press('5');
            userAgent.press('#');
        });
        tones.start();
        tones.join(200);
        assertTrue(tones.isAlive());
        assertEquals(List.of("welcome"), player.played());

        player.release();
        greeting.join(2_000);
        tones.join(2_000);

        assertFalse(tones.isAlive());
        assertEquals(List.of("welcome", "five"), player.played());
        assertEquals(CallPhase.AWAITING_DIGITS, flow.getPhase());
    }

    @Test
    void remoteHangupDuringPlayback_stopsAudioAndUnregisters() throws Exception {
        player.holdOn(SoundCatalog.ONE);
        IvrCallFlow flow = answeredFlow();
        userAgent.press('1');
        userAgent.press('2');
        Thread playback = new Thread(() -> userAgent.press('#'));
        playback.start();
        assertTrue(player.awaitHeld());

        userAgent.listener().onCallHungUp(CallId.of("call-1"));
        playback.join(2_000);

        assertFalse(playback.isAlive());
        assertEquals(List.of("welcome", "one"), player.played());
        assertTrue(player.stops.get() >= 1);
        assertTrue(registry.find(CallId.of("call-1")).isEmpty());
        assertEquals(CallPhase.ENDED, flow.getPhase());
        verify(metrics).incrementCallEnded("remote_hangup");
        verify(mediaSession).close();
    }

    @Test
    void remoteHangupDuringGreeting_releasesGreetingAndHeldTones() throws Exception {
        player.holdOn(SoundCatalog.WELCOME);
        IvrCallFlow flow = newFlow();
        assertTrue(flow.accept());
        Thread greeting = new Thread(flow::answerAndGreet);
        greeting.start();
        assertTrue(player.awaitHeld());
        Thread tones = new Thread(() -> {
            userAgent.press('3');
            userAgent.press('#');
        });
        tones.start();
        tones.join(200);
        assertTrue(tones.isAlive());

        userAgent.listener().onCallHungUp(CallId.of("call-1"));
        greeting.join(2_000);
        tones.join(2_000);

        assertFalse(greeting.isAlive());
        assertFalse(tones.isAlive());
        assertTrue(player.stops.get() >= 1);
        assertEquals(List.of("welcome"), player.played());
        assertEquals(0, flow.pendingDigits());
        assertTrue(registry.calls.isEmpty());
        assertEquals(CallPhase.ENDED, flow.getPhase());
        verify(metrics).incrementCallEnded("remote_hangup");
        verify(metrics, never()).recordGreetingLatency(any(Duration.class));
    }

    @Test
    void tonesAfterHangup_areDropped() {
        IvrCallFlow flow = answeredFlow();
        userAgent.listener().onCallHungUp(CallId.of("call-1"));

        userAgent.press('7');
        userAgent.press('#');

        assertEquals(List.of("welcome"), player.played());
        assertEquals(0, flow.pendingDigits());
    }

    @Test
    void hangupTwice_endsOnce() {
        IvrCallFlow flow = answeredFlow();
        OngoingCall call = registry.find(CallId.of("call-1")).orElseThrow();

        assertTrue(call.hangup());
        assertFalse(call.hangup());
        userAgent.listener().onCallHungUp(CallId.of("call-1"));

        assertTrue(flow.isEnded());
        assertEquals(1, userAgent.serverCall.hangups.get());
        verify(metrics, times(1)).incrementCallEnded(any());
        verify(metrics).incrementCallEnded("local_hangup");
    }

    @Test
    void registryConflict_logsWarningAndCallContinues() {
        OngoingCall other = new OngoingCall(CallId.of("call-1"), new FakeUserAgent("call-1"),
                new FakeUserAgent.FakeServerCall(), new ScriptedAudioPlayer(), Instant.now(), null, null);
        registry.tryAdd(CallId.of("call-1"), other);
        IvrCallFlow flow = newFlow();

        try (CapturedLog log = new CapturedLog(IvrCallFlow.class)) {
            assertTrue(flow.accept());
            flow.answerAndGreet();

            assertTrue(log.contains(Level.WARNING, "Could not add call to active calls"));
        }
        assertEquals(List.of("welcome"), player.played());
        assertEquals(CallPhase.AWAITING_DIGITS, flow.getPhase());
        assertSame(other, registry.find(CallId.of("call-1")).orElseThrow());
        verify(metrics).incrementRegistryConflict();

        userAgent.press('9');
        userAgent.press('#');
        assertEquals(List.of("welcome", "nine"), player.played());
    }

    @Test
    void ringTimeout_hangsUpAndUnregisters() {
        IvrCallFlow flow = answeredFlow();

        try (CapturedLog log = new CapturedLog(IvrCallFlow.class)) {
            userAgent.listener().onRingTimeout();

            assertTrue(log.contains(Level.WARNING, "ivr.ring.timeout"));
        }
        assertTrue(userAgent.hangups.get() >= 1);
        assertTrue(registry.find(CallId.of("call-1")).isEmpty());
        assertEquals(CallPhase.ENDED, flow.getPhase());
        verify(metrics).incrementRingTimeout();
        verify(metrics).incrementCallEnded("ring_timeout");
    }

    @Test
    void failedAnswer_endsWithoutGreeting() {
        userAgent.answerWith(false);
        IvrCallFlow flow = newFlow();

        assertTrue(flow.accept());
        flow.answerAndGreet();

        assertTrue(player.played().isEmpty());
        assertTrue(registry.calls.isEmpty());
        assertEquals(CallPhase.ENDED, flow.getPhase());
        verify(metrics).incrementCallEnded("answer_failed");
    }

    @Test
    void greetingPlaybackFailure_endsCall() {
        player.failOn(SoundCatalog.WELCOME);
        IvrCallFlow flow = newFlow();

        assertTrue(flow.accept());
        flow.answerAndGreet();

        assertEquals(CallPhase.ENDED, flow.getPhase());
        assertTrue(registry.calls.isEmpty());
        assertEquals(1, userAgent.hangups.get());
        verify(metrics).incrementPlaybackError();
        verify(metrics).incrementCallEnded("playback_failed");
    }

    @Test
    void cancelledBeforeAccept_hasNoSideEffects() {
        userAgent.cancelledBeforeAccept();
        IvrCallFlow flow = newFlow();

        try (CapturedLog log = new CapturedLog(IvrCallFlow.class)) {
            assertFalse(flow.accept());

            assertTrue(log.contains(Level.INFO, "ivr.call.cancelled"));
        }
        assertEquals(CallPhase.ENDED, flow.getPhase());
        assertEquals(0, userAgent.hangups.get());
        assertEquals(1, userAgent.releases.get());
        assertEquals(0, player.stops.get());
        verify(metrics).incrementCallCancelled();
        verify(metrics, never()).incrementCallEnded(any());
        verify(mediaSessionFactory, never()).create(any());
    }

    @Test
    void failedAccept_releasesUserAgentWithoutSignaling() {
        userAgent.failAcceptWith(new IllegalStateException("transaction already exists"));
        IvrCallFlow flow = newFlow();

        assertFalse(flow.accept());

        assertTrue(flow.isEnded());
        assertEquals(1, userAgent.releases.get());
        assertEquals(0, userAgent.hangups.get());
        assertTrue(registry.calls.isEmpty());
        verify(metrics, never()).incrementCallAccepted();
    }

    private IvrCallFlow newFlow() {
        return new IvrCallFlow(request, userAgent, player, mediaSessionFactory, registry, callPolicy, metrics);
    }

    private IvrCallFlow answeredFlow() {
        IvrCallFlow flow = newFlow();
        assertTrue(flow.accept());
        flow.answerAndGreet();
        return flow;
    }

    static class TestRequest implements IncomingCallRequest {
        @Override
        public String localEndpoint() {
            return "udp:127.0.0.1:5060";
        }

        @Override
        public String remoteEndpoint() {
            return "udp:127.0.0.1:5070";
        }

        @Override
        public String requestUri() {
            return "sip:ivr@127.0.0.1";
        }
    }
}
