package me.go_gradually.ivrphone.application.shared.port;

import java.time.Duration;

public interface MetricsPort {
    void recordGreetingLatency(Duration duration);

    void recordPlaybackLatency(Duration duration);

    void incrementCallAccepted();

    void incrementCallCancelled();

    void incrementCallEnded(String reason);

    void incrementRegistryConflict();

    void incrementPlaybackError();

    void incrementUnrecognizedTone();

    void incrementRingTimeout();
}
