package me.go_gradually.ivrphone.application.call.usecase;

import me.go_gradually.ivrphone.application.call.model.AudioPlaybackException;
import me.go_gradually.ivrphone.application.call.model.IncomingCallRequest;
import me.go_gradually.ivrphone.application.call.model.OngoingCall;
import me.go_gradually.ivrphone.application.call.policy.CallPolicy;
import me.go_gradually.ivrphone.application.call.port.AudioPlayer;
import me.go_gradually.ivrphone.application.call.port.CallRegistryPort;
import me.go_gradually.ivrphone.application.call.port.MediaSession;
import me.go_gradually.ivrphone.application.call.port.MediaSessionFactory;
import me.go_gradually.ivrphone.application.call.port.ServerCallHandle;
import me.go_gradually.ivrphone.application.call.port.UserAgent;
import me.go_gradually.ivrphone.application.call.port.UserAgentListener;
import me.go_gradually.ivrphone.application.shared.port.MetricsPort;
import me.go_gradually.ivrphone.domain.call.CallEndReason;
import me.go_gradually.ivrphone.domain.call.CallId;
import me.go_gradually.ivrphone.domain.call.CallPhase;
import me.go_gradually.ivrphone.domain.dtmf.DtmfKey;
import me.go_gradually.ivrphone.domain.dtmf.KeyCollector;
import me.go_gradually.ivrphone.domain.dtmf.KeyPressPolicy;
import me.go_gradually.ivrphone.domain.sound.Sound;
import me.go_gradually.ivrphone.domain.sound.SoundCatalog;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * One inbound IVR call: accept, answer, greet, then echo the digits the caller types.
 * <p>
 * Tone events may arrive on any thread and before the greeting finished. They wait on
 * {@code greetingGate} instead of being dropped. Playback rounds are serialized by
 * {@code playbackLock}; a hangup never takes that lock, it stops the player so the
 * round in flight returns.
 */
public class IvrCallFlow implements UserAgentListener {
    private static final Logger log = Logger.getLogger(IvrCallFlow.class.getName());

    private final IncomingCallRequest request;
    private final UserAgent userAgent;
    private final AudioPlayer audioPlayer;
    private final MediaSessionFactory mediaSessionFactory;
    private final CallRegistryPort callRegistry;
    private final CallPolicy callPolicy;
    private final MetricsPort metrics;
    private final KeyCollector keyCollector = new KeyCollector();
    private final Object playbackLock = new Object();
    private final CountDownLatch greetingGate = new CountDownLatch(1);
    private final AtomicReference<CallPhase> phase = new AtomicReference<>(CallPhase.RINGING);
    private final AtomicBoolean ended = new AtomicBoolean(false);
    private volatile ServerCallHandle serverCall;
    private volatile MediaSession mediaSession;
    private volatile OngoingCall ongoingCall;
    private volatile CallId callId;

    public IvrCallFlow(IncomingCallRequest request,
                       UserAgent userAgent,
                       AudioPlayer audioPlayer,
                       MediaSessionFactory mediaSessionFactory,
                       CallRegistryPort callRegistry,
                       CallPolicy callPolicy,
                       MetricsPort metrics) {
        this.request = request;
        this.userAgent = userAgent;
        this.audioPlayer = audioPlayer;
        this.mediaSessionFactory = mediaSessionFactory;
        this.callRegistry = callRegistry;
        this.callPolicy = callPolicy;
        this.metrics = metrics;
    }

    /**
     * Accepts the call on the signaling layer.
     *
     * @return false when the caller cancelled before the call could be accepted
     */
    public boolean accept() {
        log.info(() -> "ivr.call.incoming request=" + request.describe());
        userAgent.setListener(this);
        try {
            serverCall = userAgent.acceptCall(request);
        } catch (RuntimeException e) {
            log.log(Level.SEVERE, e, () -> "ivr.call.accept_failed request=" + request.describe());
            userAgent.release();
            closeWithoutSideEffects();
            return false;
        }
        if (serverCall.isCancelled()) {
            userAgent.release();
            closeWithoutSideEffects();
            metrics.incrementCallCancelled();
            log.info("ivr.call.cancelled message=Incoming call cancelled by remote party");
            return false;
        }
        metrics.incrementCallAccepted();
        return true;
    }

    /**
     * Answers, registers the call and plays the greeting. Blocks for the length of the greeting.
     */
    public void answerAndGreet() {
        try {
            if (!answer() || !register()) {
                return;
            }
            playGreeting();
        } catch (RuntimeException e) {
            fail(CallEndReason.ANSWER_FAILED, e);
        } finally {
            greetingGate.countDown();
        }
    }

    @Override
    public void onDtmfTone(byte key, int durationMs) {
        try {
            greetingGate.await();
            if (ended.get()) {
                log.fine(() -> "ivr.dtmf.dropped callId=" + callIdText() + " reason=call_ended");
                return;
            }
            handleTone(Byte.toUnsignedInt(key), durationMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (AudioPlaybackException e) {
            metrics.incrementPlaybackError();
            fail(CallEndReason.PLAYBACK_FAILED, e);
        } catch (RuntimeException e) {
            fail(CallEndReason.PLAYBACK_FAILED, e);
        }
    }

    @Override
    public void onCallHungUp(CallId dialogueId) {
        CallId target = dialogueId == null ? callId : dialogueId;
        log.info(() -> "ivr.call.hungup callId=" + (target == null ? "unknown" : target.value()));
        if (target != null) {
            callRegistry.tryRemove(target).ifPresent(call -> hangupQuietly(call, CallEndReason.REMOTE_HANGUP));
        }
        end(CallEndReason.REMOTE_HANGUP);
    }

    @Override
    public void onRingTimeout() {
        metrics.incrementRingTimeout();
        log.warning(() -> "ivr.ring.timeout callId=" + callIdText() + " phase=" + phase.get()
                + " message=Incoming call timed out waiting for client ACK, terminating");
        try {
            userAgent.hangup();
        } catch (RuntimeException e) {
            log.log(Level.WARNING, e, () -> "ivr.ring.timeout hangup_failed callId=" + callIdText());
        }
        end(CallEndReason.RING_TIMEOUT);
    }

    public CallPhase getPhase() {
        return phase.get();
    }

    public CallId getCallId() {
        return callId;
    }

    public boolean isEnded() {
        return ended.get();
    }

    public int pendingDigits() {
        return keyCollector.size();
    }

    private boolean answer() {
        if (!phase.compareAndSet(CallPhase.RINGING, CallPhase.ANSWERING)) {
            return false;
        }
        mediaSession = mediaSessionFactory.create(request);
        boolean answered = awaitAnswer(userAgent.answer(serverCall, mediaSession));
        if (ended.get()) {
            return false;
        }
        if (!answered || !userAgent.isCallActive()) {
            if (serverCall.isCancelled()) {
                metrics.incrementCallCancelled();
                log.info("ivr.call.cancelled message=Incoming call cancelled by remote party");
                end(CallEndReason.CANCELLED);
            } else {
                log.warning(() -> "ivr.call.answer_failed request=" + request.describe());
                end(CallEndReason.ANSWER_FAILED);
            }
            return false;
        }
        callId = userAgent.dialogue();
        log.info(() -> "ivr.call.answered callId=" + callIdText());
        return true;
    }

    private boolean awaitAnswer(CompletableFuture<Boolean> answer) {
        try {
            return Boolean.TRUE.equals(answer.get(callPolicy.answerTimeoutMs(), TimeUnit.MILLISECONDS));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (TimeoutException e) {
            answer.cancel(true);
            log.warning(() -> "ivr.call.answer_timeout timeoutMs=" + callPolicy.answerTimeoutMs());
            return false;
        } catch (ExecutionException e) {
            log.log(Level.WARNING, e.getCause(), () -> "ivr.call.answer_error request=" + request.describe());
            return false;
        }
    }

    private boolean register() {
        OngoingCall call = new OngoingCall(
                callId,
                userAgent,
                serverCall,
                audioPlayer,
                Instant.now(),
                phase::get,
                this::end
        );
        ongoingCall = call;
        if (!callRegistry.tryAdd(callId, call)) {
            metrics.incrementRegistryConflict();
            log.warning(() -> "ivr.registry.conflict callId=" + callIdText()
                    + " message=Could not add call to active calls");
        }
        if (ended.get()) {
            // hung up while answering; end() may have run before ongoingCall was visible
            callRegistry.remove(callId, call);
            hangupQuietly(call, CallEndReason.REMOTE_HANGUP);
            return false;
        }
        return true;
    }

    private void playGreeting() {
        if (!phase.compareAndSet(CallPhase.ANSWERING, CallPhase.GREETING_PLAYING)) {
            return;
        }
        Instant startedAt = Instant.now();
        try {
            audioPlayer.play(SoundCatalog.WELCOME);
        } catch (AudioPlaybackException e) {
            metrics.incrementPlaybackError();
            fail(CallEndReason.PLAYBACK_FAILED, e);
            return;
        }
        if (ended.get()) {
            log.fine(() -> "ivr.greeting.interrupted callId=" + callIdText());
            return;
        }
        metrics.recordGreetingLatency(Duration.between(startedAt, Instant.now()));
        // phase first, so a held '#' finds the call awaiting digits
        if (phase.compareAndSet(CallPhase.GREETING_PLAYING, CallPhase.AWAITING_DIGITS)) {
            log.info(() -> "ivr.greeting.finished callId=" + callIdText());
        }
        greetingGate.countDown();
    }

    private void handleTone(int code, int durationMs) {
        DtmfKey key = DtmfKey.fromCode(code);
        log.info(() -> "ivr.dtmf.received callId=" + callIdText() + " key=" + code
                + " symbol=" + (key == null ? "?" : key.symbol()) + " durationMs=" + durationMs);
        switch (KeyPressPolicy.decide(key)) {
            case APPEND -> keyCollector.append(key.symbol());
            case EXPLAIN -> playExplanation();
            case PLAY_BACK -> playCollectedDigits();
            case IGNORE -> {
                metrics.incrementUnrecognizedTone();
                log.warning(() -> "ivr.dtmf.unrecognized callId=" + callIdText() + " key=" + code);
            }
        }
    }

    private void playExplanation() {
        synchronized (playbackLock) {
            if (!enterPlayback()) {
                return;
            }
            try {
                audioPlayer.play(SoundCatalog.EXPLANATION);
            } finally {
                leavePlayback();
            }
        }
    }

    private void playCollectedDigits() {
        synchronized (playbackLock) {
            if (!enterPlayback()) {
                return;
            }
            Instant startedAt = Instant.now();
            try {
                List<Character> digits = keyCollector.drainAndClear();
                log.info(() -> "ivr.digits.cleared callId=" + callIdText() + " count=" + digits.size());
                if (digits.isEmpty()) {
                    audioPlayer.play(SoundCatalog.NUMBERS_NOT_FOUND);
                    return;
                }
                for (char digit : digits) {
                    if (ended.get()) {
                        return;
                    }
                    Sound sound = SoundCatalog.forDigit(digit);
                    if (sound != null) {
                        audioPlayer.play(sound);
                    }
                }
                log.info(() -> "ivr.digits.played callId=" + callIdText() + " digits=" + join(digits));
            } finally {
                leavePlayback();
                metrics.recordPlaybackLatency(Duration.between(startedAt, Instant.now()));
            }
        }
    }

    private boolean enterPlayback() {
        if (ended.get()) {
            return false;
        }
        return phase.compareAndSet(CallPhase.AWAITING_DIGITS, CallPhase.PLAYING_DIGITS);
    }

    private void leavePlayback() {
        phase.compareAndSet(CallPhase.PLAYING_DIGITS, CallPhase.AWAITING_DIGITS);
    }

    private void fail(CallEndReason reason, RuntimeException e) {
        log.log(Level.SEVERE, e, () -> "ivr.call.failed callId=" + callIdText() + " reason=" + reason.code());
        end(reason);
    }

    private void end(CallEndReason reason) {
        if (!ended.compareAndSet(false, true)) {
            return;
        }
        CallPhase previous = phase.getAndSet(CallPhase.ENDED);
        greetingGate.countDown();
        audioPlayer.stop();
        log.info(() -> "ivr.audio.stopped callId=" + callIdText() + " reason=" + reason.code());
        OngoingCall call = ongoingCall;
        if (call != null) {
            callRegistry.remove(call.getCallId(), call);
            hangupQuietly(call, reason);
        } else if (previous != CallPhase.RINGING) {
            try {
                userAgent.hangup();
            } catch (RuntimeException e) {
                log.log(Level.WARNING, e, () -> "ivr.call.hangup_failed request=" + request.describe());
            }
        }
        closeMediaSession();
        metrics.incrementCallEnded(reason.code());
    }

    private void closeWithoutSideEffects() {
        ended.set(true);
        phase.set(CallPhase.ENDED);
        greetingGate.countDown();
    }

    private void hangupQuietly(OngoingCall call, CallEndReason reason) {
        try {
            call.hangup(reason);
        } catch (RuntimeException e) {
            log.log(Level.WARNING, e, () -> "ivr.call.hangup_failed callId=" + call.getCallId().value());
        }
    }

    private void closeMediaSession() {
        MediaSession session = mediaSession;
        if (session == null) {
            return;
        }
        try {
            session.close();
        } catch (RuntimeException e) {
            log.log(Level.FINE, e, () -> "ivr.media.close_failed callId=" + callIdText());
        }
    }

    private String callIdText() {
        CallId current = callId;
        return current == null ? "pending" : current.value();
    }

    private static String join(List<Character> digits) {
        StringBuilder builder = new StringBuilder(digits.size());
        for (char digit : digits) {
            builder.append(digit);
        }
        return builder.toString();
    }
}
