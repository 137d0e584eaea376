package me.go_gradually.ivrphone.infrastructure.call.registry;

import me.go_gradually.ivrphone.application.call.model.OngoingCall;
import me.go_gradually.ivrphone.application.call.port.CallRegistryPort;
import me.go_gradually.ivrphone.domain.call.CallId;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class InMemoryCallRegistry implements CallRegistryPort {
    private final Map<CallId, OngoingCall> calls = new ConcurrentHashMap<>();

    @Override
    public boolean tryAdd(CallId callId, OngoingCall call) {
        if (callId == null || call == null) {
            return false;
        }
        return calls.putIfAbsent(callId, call) == null;
    }

    @Override
    public Optional<OngoingCall> tryRemove(CallId callId) {
        if (callId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(calls.remove(callId));
    }

    @Override
    public boolean remove(CallId callId, OngoingCall call) {
        if (callId == null || call == null) {
            return false;
        }
        return calls.remove(callId, call);
    }

    @Override
    public Optional<OngoingCall> find(CallId callId) {
        if (callId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(calls.get(callId));
    }

    @Override
    public List<OngoingCall> findAll() {
        return List.copyOf(calls.values());
    }

    @Override
    public List<OngoingCall> removeAll() {
        List<OngoingCall> removed = new ArrayList<>();
        for (CallId callId : List.copyOf(calls.keySet())) {
            OngoingCall call = calls.remove(callId);
            if (call != null) {
                removed.add(call);
            }
        }
        return removed;
    }
}
