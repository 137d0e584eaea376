package me.go_gradually.ivrphone.infrastructure.sip;

import me.go_gradually.ivrphone.application.call.model.SignalingException;
import me.go_gradually.ivrphone.application.call.port.ServerCallHandle;

import javax.sip.Dialog;
import javax.sip.InvalidArgumentException;
import javax.sip.ServerTransaction;
import javax.sip.SipException;
import javax.sip.header.ContentTypeHeader;
import javax.sip.header.ToHeader;
import javax.sip.message.Request;
import javax.sip.message.Response;
import java.text.ParseException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Server side of one INVITE transaction. Exactly one final response is ever sent.
 */
public class JainSipServerCall implements ServerCallHandle {
    private static final Logger log = Logger.getLogger(JainSipServerCall.class.getName());

    private final JainSipContext context;
    private final ServerTransaction transaction;
    private final Request invite;
    private final String localTag;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final AtomicBoolean finalResponseSent = new AtomicBoolean(false);

    public JainSipServerCall(JainSipContext context, ServerTransaction transaction, Request invite, String localTag) {
        this.context = context;
        this.transaction = transaction;
        this.invite = invite;
        this.localTag = localTag;
    }

    @Override
    public boolean isCancelled() {
        return cancelled.get();
    }

    void markCancelled() {
        cancelled.set(true);
    }

    boolean claimFinalResponse() {
        return finalResponseSent.compareAndSet(false, true);
    }

    Dialog dialog() {
        return transaction.getDialog();
    }

    void respond(int statusCode) {
        try {
            transaction.sendResponse(createResponse(statusCode));
        } catch (ParseException | SipException | InvalidArgumentException e) {
            throw new SignalingException("Could not send " + statusCode + " to INVITE", e);
        }
    }

    void answer(String sessionDescription) {
        try {
            Response response = createResponse(Response.OK);
            response.addHeader(context.contactHeader("ivrphone"));
            ContentTypeHeader contentType = context.headerFactory().createContentTypeHeader("application", "sdp");
            response.setContent(sessionDescription, contentType);
            transaction.sendResponse(response);
        } catch (ParseException | SipException | InvalidArgumentException e) {
            throw new SignalingException("Could not send 200 OK to INVITE", e);
        }
    }

    /**
     * Rejects the INVITE if no final response went out yet; afterwards the dialog owns the call.
     */
    @Override
    public void hangup() {
        if (!claimFinalResponse()) {
            return;
        }
        try {
            respond(Response.TEMPORARILY_UNAVAILABLE);
        } catch (SignalingException e) {
            log.log(Level.WARNING, e, () -> "sip.invite.reject_failed");
        }
    }

    private Response createResponse(int statusCode) throws ParseException {
        Response response = context.messageFactory().createResponse(statusCode, invite);
        if (statusCode != Response.TRYING) {
            ToHeader to = (ToHeader) response.getHeader(ToHeader.NAME);
            if (to != null && to.getTag() == null) {
                to.setTag(localTag);
            }
        }
        return response;
    }
}
