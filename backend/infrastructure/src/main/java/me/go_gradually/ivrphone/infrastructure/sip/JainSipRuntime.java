package me.go_gradually.ivrphone.infrastructure.sip;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Holds what exists only while the stack runs: the context, the timer pool and the
 * user agents of live calls keyed by Call-ID.
 */
@Component
public class JainSipRuntime {
    private final Map<String, JainSipUserAgent> userAgents = new ConcurrentHashMap<>();
    private volatile JainSipContext context;
    private volatile ScheduledExecutorService scheduler;

    void attach(JainSipContext context) {
        this.scheduler = Executors.newScheduledThreadPool(2);
        this.context = context;
    }

    void detach() {
        context = null;
        userAgents.clear();
        ScheduledExecutorService current = scheduler;
        scheduler = null;
        if (current != null) {
            current.shutdownNow();
        }
    }

    public boolean isRunning() {
        return context != null;
    }

    public JainSipContext context() {
        JainSipContext current = context;
        if (current == null) {
            throw new IllegalStateException("SIP stack is not running");
        }
        return current;
    }

    public ScheduledExecutorService scheduler() {
        ScheduledExecutorService current = scheduler;
        if (current == null) {
            throw new IllegalStateException("SIP stack is not running");
        }
        return current;
    }

    void register(String callId, JainSipUserAgent userAgent) {
        userAgents.put(callId, userAgent);
    }

    void unregister(String callId, JainSipUserAgent userAgent) {
        if (callId != null) {
            userAgents.remove(callId, userAgent);
        }
    }

    Optional<JainSipUserAgent> find(String callId) {
        if (callId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(userAgents.get(callId));
    }
}
