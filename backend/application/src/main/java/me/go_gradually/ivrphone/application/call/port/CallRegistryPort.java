package me.go_gradually.ivrphone.application.call.port;

import me.go_gradually.ivrphone.application.call.model.OngoingCall;
import me.go_gradually.ivrphone.domain.call.CallId;

import java.util.List;
import java.util.Optional;

public interface CallRegistryPort {
    /**
     * @return false, without touching the stored entry, if the id is already registered
     */
    boolean tryAdd(CallId callId, OngoingCall call);

    Optional<OngoingCall> tryRemove(CallId callId);

    /**
     * Removes the entry only while it still maps to the given call.
     */
    boolean remove(CallId callId, OngoingCall call);

    Optional<OngoingCall> find(CallId callId);

    List<OngoingCall> findAll();

    List<OngoingCall> removeAll();
}
