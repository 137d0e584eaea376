package me.go_gradually.ivrphone.infrastructure.sip;

import me.go_gradually.ivrphone.application.call.model.IncomingCallRequest;
import me.go_gradually.ivrphone.application.call.model.SignalingException;
import me.go_gradually.ivrphone.application.call.port.MediaSession;
import me.go_gradually.ivrphone.application.call.port.ServerCallHandle;
import me.go_gradually.ivrphone.application.call.port.UserAgent;
import me.go_gradually.ivrphone.application.call.port.UserAgentListener;
import me.go_gradually.ivrphone.domain.call.CallId;

import javax.sip.ClientTransaction;
import javax.sip.Dialog;
import javax.sip.SipException;
import javax.sip.message.Request;
import javax.sip.message.Response;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Signaling for one inbound call. Tones are handed to the listener one at a time on a
 * dedicated thread, in arrival order. Hangup and ring timeout are delivered directly so
 * they can interrupt a tone handler that is busy playing audio.
 */
public class JainSipUserAgent implements UserAgent {
    private static final Logger log = Logger.getLogger(JainSipUserAgent.class.getName());
    private static final UserAgentListener NO_LISTENER = new UserAgentListener() {
        @Override
        public void onCallHungUp(CallId dialogueId) {
        }

        @Override
        public void onDtmfTone(byte key, int durationMs) {
        }

        @Override
        public void onRingTimeout() {
        }
    };

    private final JainSipRuntime runtime;
    private final long ringingDelayMs;
    private final long ackTimeoutMs;
    private final String localTag = Long.toHexString(ThreadLocalRandom.current().nextLong());
    private final ExecutorService toneDispatcher = Executors.newSingleThreadExecutor();
    private final AtomicBoolean answered = new AtomicBoolean(false);
    private final AtomicBoolean terminated = new AtomicBoolean(false);
    private final AtomicBoolean byeReceived = new AtomicBoolean(false);
    private volatile UserAgentListener listener = NO_LISTENER;
    private volatile JainSipServerCall serverCall;
    private volatile String callId;
    private volatile Dialog dialog;
    private volatile ScheduledFuture<?> ackTimer;

    public JainSipUserAgent(JainSipRuntime runtime, long ringingDelayMs, long ackTimeoutMs) {
        this.runtime = runtime;
        this.ringingDelayMs = ringingDelayMs;
        this.ackTimeoutMs = ackTimeoutMs;
    }

    @Override
    public ServerCallHandle acceptCall(IncomingCallRequest request) {
        if (!(request instanceof JainSipInboundRequest inbound)) {
            throw new IllegalArgumentException("Not a SIP request: " + request);
        }
        try {
            callId = inbound.callIdValue();
            serverCall = new JainSipServerCall(runtime.context(), inbound.serverTransaction(), inbound.request(), localTag);
        } catch (SipException e) {
            throw new SignalingException("Could not create server transaction for " + inbound.describe(), e);
        }
        runtime.register(callId, this);
        try {
            serverCall.respond(Response.TRYING);
            serverCall.respond(Response.RINGING);
        } catch (RuntimeException e) {
            release();
            throw e;
        }
        log.fine(() -> "sip.invite.ringing callId=" + callId);
        return serverCall;
    }

    @Override
    public CompletableFuture<Boolean> answer(ServerCallHandle call, MediaSession mediaSession) {
        CompletableFuture<Boolean> result = new CompletableFuture<>();
        runtime.scheduler().schedule(() -> completeAnswer(result, mediaSession), ringingDelayMs, TimeUnit.MILLISECONDS);
        return result;
    }

    @Override
    public CallId dialogue() {
        String current = callId;
        if (current == null) {
            throw new IllegalStateException("Call was not accepted yet");
        }
        return CallId.of(current);
    }

    @Override
    public boolean isCallActive() {
        return answered.get() && !terminated.get();
    }

    @Override
    public void hangup() {
        if (!terminated.compareAndSet(false, true)) {
            return;
        }
        cancelAckTimer();
        toneDispatcher.shutdown();
        runtime.unregister(callId, this);
        if (!answered.get()) {
            JainSipServerCall call = serverCall;
            if (call != null) {
                call.hangup();
            }
            return;
        }
        if (!byeReceived.get()) {
            sendBye();
        }
    }

    @Override
    public void release() {
        if (!terminated.compareAndSet(false, true)) {
            return;
        }
        cancelAckTimer();
        toneDispatcher.shutdown();
        runtime.unregister(callId, this);
        log.fine(() -> "sip.call.released callId=" + callId);
    }

    @Override
    public void setListener(UserAgentListener listener) {
        this.listener = listener == null ? NO_LISTENER : listener;
    }

    void onAck() {
        cancelAckTimer();
        log.fine(() -> "sip.ack.received callId=" + callId);
    }

    void onBye(JainSipInboundRequest bye) {
        byeReceived.set(true);
        bye.respond(Response.OK);
        cancelAckTimer();
        listener.onCallHungUp(dialogue());
    }

    void onInfo(JainSipInboundRequest info) {
        var signal = DtmfRelayParser.parse(info.contentSubType(), info.rawContent());
        info.respond(Response.OK);
        if (signal.isEmpty()) {
            log.fine(() -> "sip.info.ignored callId=" + callId + " contentType=" + info.contentSubType());
            return;
        }
        byte code = signal.get().code();
        int durationMs = signal.get().durationMs();
        try {
            toneDispatcher.execute(() -> listener.onDtmfTone(code, durationMs));
        } catch (RejectedExecutionException e) {
            log.fine(() -> "sip.info.dropped callId=" + callId + " reason=call_ended");
        }
    }

    void onCancel(JainSipInboundRequest cancel) {
        cancel.respond(Response.OK);
        JainSipServerCall call = serverCall;
        if (call == null) {
            return;
        }
        call.markCancelled();
        if (call.claimFinalResponse()) {
            call.respond(Response.REQUEST_TERMINATED);
        }
        log.info(() -> "sip.invite.cancelled callId=" + callId);
    }

    private void completeAnswer(CompletableFuture<Boolean> result, MediaSession mediaSession) {
        JainSipServerCall call = serverCall;
        try {
            if (call == null || terminated.get() || call.isCancelled() || !call.claimFinalResponse()) {
                result.complete(false);
                return;
            }
            call.answer(mediaSession.localDescription());
            dialog = call.dialog();
            answered.set(true);
            ackTimer = runtime.scheduler().schedule(this::ringTimedOut, ackTimeoutMs, TimeUnit.MILLISECONDS);
            result.complete(true);
        } catch (RuntimeException e) {
            result.completeExceptionally(e);
        }
    }

    private void ringTimedOut() {
        if (!terminated.get()) {
            listener.onRingTimeout();
        }
    }

    private void cancelAckTimer() {
        ScheduledFuture<?> timer = ackTimer;
        if (timer != null) {
            timer.cancel(false);
        }
    }

    private void sendBye() {
        Dialog current = dialog;
        if (current == null) {
            return;
        }
        try {
            Request bye = current.createRequest(Request.BYE);
            ClientTransaction transaction = runtime.context().provider().getNewClientTransaction(bye);
            current.sendRequest(transaction);
            log.fine(() -> "sip.bye.sent callId=" + callId);
        } catch (SipException | IllegalStateException e) {
            log.log(Level.WARNING, e, () -> "sip.bye.failed callId=" + callId);
            throw new SignalingException("Could not send BYE for " + callId, e);
        }
    }
}
