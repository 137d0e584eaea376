package me.go_gradually.ivrphone.infrastructure.shared.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import me.go_gradually.ivrphone.application.shared.port.MetricsPort;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
public class MicrometerMetricsAdapter implements MetricsPort {
    private final MeterRegistry meterRegistry;

    public MicrometerMetricsAdapter(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    @Override
    public void recordGreetingLatency(Duration duration) {
        record("ivr.greeting.latency", duration);
    }

    @Override
    public void recordPlaybackLatency(Duration duration) {
        record("ivr.playback.latency", duration);
    }

    @Override
    public void incrementCallAccepted() {
        meterRegistry.counter("ivr.calls.accepted").increment();
    }

    @Override
    public void incrementCallCancelled() {
        meterRegistry.counter("ivr.calls.cancelled").increment();
    }

    @Override
    public void incrementCallEnded(String reason) {
        meterRegistry.counter("ivr.calls.ended", "reason", reason == null ? "unknown" : reason).increment();
    }

    @Override
    public void incrementRegistryConflict() {
        meterRegistry.counter("ivr.registry.conflicts").increment();
    }

    @Override
    public void incrementPlaybackError() {
        meterRegistry.counter("ivr.playback.errors").increment();
    }

    @Override
    public void incrementUnrecognizedTone() {
        meterRegistry.counter("ivr.dtmf.unrecognized").increment();
    }

    @Override
    public void incrementRingTimeout() {
        meterRegistry.counter("ivr.ring.timeouts").increment();
    }

    private void record(String name, Duration duration) {
        Timer.builder(name)
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry)
                .record(duration);
    }
}
