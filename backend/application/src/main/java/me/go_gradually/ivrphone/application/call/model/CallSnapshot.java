package me.go_gradually.ivrphone.application.call.model;

import me.go_gradually.ivrphone.domain.call.CallPhase;

import java.time.Instant;

public record CallSnapshot(String callId, CallPhase phase, Instant startedAt) {
}
