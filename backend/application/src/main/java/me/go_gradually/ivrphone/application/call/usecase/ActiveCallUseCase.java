package me.go_gradually.ivrphone.application.call.usecase;

import me.go_gradually.ivrphone.application.call.model.CallSnapshot;
import me.go_gradually.ivrphone.application.call.model.OngoingCall;
import me.go_gradually.ivrphone.application.call.port.CallRegistryPort;
import me.go_gradually.ivrphone.domain.call.CallEndReason;
import me.go_gradually.ivrphone.domain.call.CallId;

import java.util.Comparator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.logging.Level;
import java.util.logging.Logger;

public class ActiveCallUseCase {
    private static final Logger log = Logger.getLogger(ActiveCallUseCase.class.getName());
    private final CallRegistryPort callRegistry;

    public ActiveCallUseCase(CallRegistryPort callRegistry) {
        this.callRegistry = callRegistry;
    }

    public List<CallSnapshot> list() {
        return callRegistry.findAll().stream()
                .sorted(Comparator.comparing(OngoingCall::getStartedAt))
                .map(OngoingCall::snapshot)
                .toList();
    }

    public CallSnapshot get(String callId) {
        return callRegistry.find(CallId.of(callId))
                .map(OngoingCall::snapshot)
                .orElseThrow(() -> new NoSuchElementException("Unknown call: " + callId));
    }

    public void hangup(String callId) {
        OngoingCall call = callRegistry.tryRemove(CallId.of(callId))
                .orElseThrow(() -> new NoSuchElementException("Unknown call: " + callId));
        log.info(() -> "ivr.call.local_hangup callId=" + callId);
        call.hangup(CallEndReason.LOCAL_HANGUP);
    }

    /**
     * Hangs up every registered call; used when the SIP server shuts down.
     *
     * @return how many calls were hung up
     */
    public int hangupAll() {
        List<OngoingCall> calls = callRegistry.removeAll();
        for (OngoingCall call : calls) {
            try {
                call.hangup(CallEndReason.SHUTDOWN);
            } catch (RuntimeException e) {
                log.log(Level.WARNING, e, () -> "ivr.call.hangup_failed callId=" + call.getCallId().value());
            }
        }
        return calls.size();
    }
}
