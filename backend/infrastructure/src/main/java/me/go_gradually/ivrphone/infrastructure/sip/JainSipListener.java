package me.go_gradually.ivrphone.infrastructure.sip;

import me.go_gradually.ivrphone.application.signaling.usecase.SipRequestRouter;

import javax.sip.ClientTransaction;
import javax.sip.DialogTerminatedEvent;
import javax.sip.IOExceptionEvent;
import javax.sip.RequestEvent;
import javax.sip.ResponseEvent;
import javax.sip.SipListener;
import javax.sip.TimeoutEvent;
import javax.sip.TransactionTerminatedEvent;
import javax.sip.header.CSeqHeader;
import javax.sip.message.Request;
import javax.sip.message.Response;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point for everything the stack receives. Requests belonging to a live call go to
 * its {@link JainSipUserAgent}; the rest goes to the {@link SipRequestRouter}.
 */
public class JainSipListener implements SipListener {
    private static final Logger log = Logger.getLogger(JainSipListener.class.getName());

    private final JainSipRuntime runtime;
    private final SipRequestRouter router;
    private final JainSipRegistrationAgent registrationAgent;

    public JainSipListener(JainSipRuntime runtime, SipRequestRouter router, JainSipRegistrationAgent registrationAgent) {
        this.runtime = runtime;
        this.router = router;
        this.registrationAgent = registrationAgent;
    }

    @Override
    public void processRequest(RequestEvent event) {
        try {
            dispatch(new JainSipInboundRequest(event, runtime.context()));
        } catch (RuntimeException e) {
            log.log(Level.SEVERE, e, () -> "sip.request.failed method=" + event.getRequest().getMethod());
        }
    }

    void dispatch(JainSipInboundRequest request) {
        String method = request.request().getMethod();
        Optional<JainSipUserAgent> owner = runtime.find(request.callIdValue());
        log.fine(() -> "sip.request.received method=" + method + " callId=" + request.callIdValue()
                + " inDialog=" + request.isInDialog());

        if (Request.ACK.equals(method)) {
            owner.ifPresent(JainSipUserAgent::onAck);
            return;
        }
        if (Request.CANCEL.equals(method)) {
            if (owner.isPresent()) {
                owner.get().onCancel(request);
            } else {
                request.respond(Response.CALL_OR_TRANSACTION_DOES_NOT_EXIST);
            }
            return;
        }
        if (request.isInDialog()) {
            if (owner.isEmpty()) {
                request.respond(Response.CALL_OR_TRANSACTION_DOES_NOT_EXIST);
                return;
            }
            switch (method) {
                case Request.BYE -> owner.get().onBye(request);
                case Request.INFO -> owner.get().onInfo(request);
                case Request.OPTIONS -> request.respond(Response.OK);
                default -> request.respond(Response.NOT_IMPLEMENTED);
            }
            return;
        }
        router.route(request);
    }

    @Override
    public void processResponse(ResponseEvent event) {
        Response response = event.getResponse();
        CSeqHeader cseq = (CSeqHeader) response.getHeader(CSeqHeader.NAME);
        if (cseq != null && Request.REGISTER.equals(cseq.getMethod())) {
            registrationAgent.processResponse(event);
            return;
        }
        log.fine(() -> "sip.response.received status=" + response.getStatusCode()
                + " method=" + (cseq == null ? "unknown" : cseq.getMethod()));
    }

    @Override
    public void processTimeout(TimeoutEvent event) {
        if (event.isServerTransaction()) {
            log.fine(() -> "sip.transaction.timeout side=server");
            return;
        }
        ClientTransaction transaction = event.getClientTransaction();
        if (transaction != null && Request.REGISTER.equals(transaction.getRequest().getMethod())) {
            registrationAgent.processTimeout(transaction);
            return;
        }
        log.warning(() -> "sip.transaction.timeout side=client method="
                + (transaction == null ? "unknown" : transaction.getRequest().getMethod()));
    }

    @Override
    public void processIOException(IOExceptionEvent event) {
        log.warning(() -> "sip.transport.io_error host=" + event.getHost() + " port=" + event.getPort()
                + " transport=" + event.getTransport());
    }

    @Override
    public void processTransactionTerminated(TransactionTerminatedEvent event) {
        log.finest("sip.transaction.terminated");
    }

    @Override
    public void processDialogTerminated(DialogTerminatedEvent event) {
        log.finest(() -> "sip.dialog.terminated callId=" + event.getDialog().getCallId().getCallId());
    }
}
