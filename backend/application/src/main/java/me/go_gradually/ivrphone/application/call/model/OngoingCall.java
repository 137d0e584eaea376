package me.go_gradually.ivrphone.application.call.model;

import me.go_gradually.ivrphone.application.call.port.AudioPlayer;
import me.go_gradually.ivrphone.application.call.port.ServerCallHandle;
import me.go_gradually.ivrphone.application.call.port.UserAgent;
import me.go_gradually.ivrphone.domain.call.CallEndReason;
import me.go_gradually.ivrphone.domain.call.CallId;
import me.go_gradually.ivrphone.domain.call.CallPhase;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.function.Supplier;

public class OngoingCall {
    private final CallId callId;
    private final UserAgent userAgent;
    private final ServerCallHandle serverCall;
    private final AudioPlayer audioPlayer;
    private final Instant startedAt;
    private final Supplier<CallPhase> phaseSource;
    private final Consumer<CallEndReason> endListener;
    private final AtomicBoolean hungUp = new AtomicBoolean(false);

    public OngoingCall(CallId callId,
                       UserAgent userAgent,
                       ServerCallHandle serverCall,
                       AudioPlayer audioPlayer,
                       Instant startedAt,
                       Supplier<CallPhase> phaseSource,
                       Consumer<CallEndReason> endListener) {
        if (callId == null) {
            throw new IllegalArgumentException("CallId is required");
        }
        this.callId = callId;
        this.userAgent = userAgent;
        this.serverCall = serverCall;
        this.audioPlayer = audioPlayer;
        this.startedAt = startedAt == null ? Instant.now() : startedAt;
        this.phaseSource = phaseSource == null ? () -> CallPhase.AWAITING_DIGITS : phaseSource;
        this.endListener = endListener == null ? reason -> { } : endListener;
    }

    public CallId getCallId() {
        return callId;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public CallPhase getPhase() {
        return hungUp.get() ? CallPhase.ENDED : phaseSource.get();
    }

    public boolean isHungUp() {
        return hungUp.get();
    }

    public CallSnapshot snapshot() {
        return new CallSnapshot(callId.value(), getPhase(), startedAt);
    }

    public boolean hangup() {
        return hangup(CallEndReason.LOCAL_HANGUP);
    }

    /**
     * Hangs up both call legs and stops the call's audio. Only the first invocation has an effect.
     *
     * @return whether this invocation performed the hangup
     */
    public boolean hangup(CallEndReason reason) {
        if (!hungUp.compareAndSet(false, true)) {
            return false;
        }
        try {
            userAgent.hangup();
            serverCall.hangup();
        } finally {
            audioPlayer.stop();
            endListener.accept(reason == null ? CallEndReason.LOCAL_HANGUP : reason);
        }
        return true;
    }
}
