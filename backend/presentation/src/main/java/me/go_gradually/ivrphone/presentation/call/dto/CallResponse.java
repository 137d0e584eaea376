package me.go_gradually.ivrphone.presentation.call.dto;

import me.go_gradually.ivrphone.domain.call.CallPhase;

import java.time.Instant;

public class CallResponse {
    private String callId;
    private CallPhase phase;
    private Instant startedAt;

    public String getCallId() {
        return callId;
    }

    public void setCallId(String callId) {
        this.callId = callId;
    }

    public CallPhase getPhase() {
        return phase;
    }

    public void setPhase(CallPhase phase) {
        this.phase = phase;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public void setStartedAt(Instant startedAt) {
        this.startedAt = startedAt;
    }
}
