package me.go_gradually.ivrphone.application.call.port;

import me.go_gradually.ivrphone.application.call.model.IncomingCallRequest;
import me.go_gradually.ivrphone.domain.call.CallId;

import java.util.concurrent.CompletableFuture;

/**
 * The part of the signaling stack one inbound call needs.
 */
public interface UserAgent {
    ServerCallHandle acceptCall(IncomingCallRequest request);

    CompletableFuture<Boolean> answer(ServerCallHandle serverCall, MediaSession mediaSession);

    /**
     * Only available once the call was answered.
     */
    CallId dialogue();

    boolean isCallActive();

    /**
     * Ends the call. Calling it on a call that already ended does nothing.
     */
    void hangup();

    /**
     * Drops what the stack keeps for this call without sending anything. For calls that
     * were never accepted, e.g. cancelled while ringing.
     */
    void release();

    void setListener(UserAgentListener listener);
}
