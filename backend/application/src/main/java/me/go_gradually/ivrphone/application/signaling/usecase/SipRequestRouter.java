package me.go_gradually.ivrphone.application.signaling.usecase;

import me.go_gradually.ivrphone.application.call.usecase.IncomingCallUseCase;
import me.go_gradually.ivrphone.application.signaling.port.InboundRequest;
import me.go_gradually.ivrphone.domain.signaling.HousekeepingPolicy;
import me.go_gradually.ivrphone.domain.signaling.SipMethod;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point for out-of-dialog requests. Only INVITE reaches the call flow; the
 * housekeeping methods get their canned response.
 */
public class SipRequestRouter {
    private static final Logger log = Logger.getLogger(SipRequestRouter.class.getName());
    private final IncomingCallUseCase incomingCallUseCase;

    public SipRequestRouter(IncomingCallUseCase incomingCallUseCase) {
        this.incomingCallUseCase = incomingCallUseCase;
    }

    public void route(InboundRequest request) {
        if (request == null) {
            return;
        }
        if (request.isInDialog()) {
            log.fine(() -> "sip.request.skipped reason=in_dialog method=" + request.method());
            return;
        }
        SipMethod method = request.method();
        if (method == SipMethod.INVITE) {
            incomingCallUseCase.accept(request);
            return;
        }
        Integer status = HousekeepingPolicy.responseFor(method);
        if (status == null) {
            log.fine(() -> "sip.request.ignored method=" + method + " request=" + request.describe());
            return;
        }
        try {
            request.respond(status);
        } catch (RuntimeException e) {
            log.log(Level.WARNING, e, () -> "sip.response.failed method=" + method + " status=" + status);
        }
    }
}
