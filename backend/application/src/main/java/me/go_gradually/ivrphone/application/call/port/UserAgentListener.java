package me.go_gradually.ivrphone.application.call.port;

import me.go_gradually.ivrphone.domain.call.CallId;

public interface UserAgentListener {
    void onCallHungUp(CallId dialogueId);

    void onDtmfTone(byte key, int durationMs);

    void onRingTimeout();
}
