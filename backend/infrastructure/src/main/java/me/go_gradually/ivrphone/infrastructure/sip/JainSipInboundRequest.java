package me.go_gradually.ivrphone.infrastructure.sip;

import me.go_gradually.ivrphone.application.call.model.SignalingException;
import me.go_gradually.ivrphone.application.signaling.port.InboundRequest;
import me.go_gradually.ivrphone.domain.signaling.SipMethod;

import javax.sip.InvalidArgumentException;
import javax.sip.RequestEvent;
import javax.sip.ServerTransaction;
import javax.sip.SipException;
import javax.sip.header.CallIdHeader;
import javax.sip.header.ContentTypeHeader;
import javax.sip.header.FromHeader;
import javax.sip.header.ToHeader;
import javax.sip.header.ViaHeader;
import javax.sip.message.Request;
import javax.sip.message.Response;
import java.text.ParseException;

public class JainSipInboundRequest implements InboundRequest {
    private final RequestEvent event;
    private final JainSipContext context;
    private ServerTransaction transaction;

    public JainSipInboundRequest(RequestEvent event, JainSipContext context) {
        this.event = event;
        this.context = context;
    }

    public Request request() {
        return event.getRequest();
    }

    public String callIdValue() {
        CallIdHeader header = (CallIdHeader) request().getHeader(CallIdHeader.NAME);
        return header == null ? null : header.getCallId();
    }

    public String contentSubType() {
        ContentTypeHeader header = (ContentTypeHeader) request().getHeader(ContentTypeHeader.NAME);
        return header == null ? null : header.getContentSubType();
    }

    public byte[] rawContent() {
        return request().getRawContent();
    }

    @Override
    public SipMethod method() {
        return SipMethod.of(request().getMethod());
    }

    @Override
    public boolean isInDialog() {
        FromHeader from = (FromHeader) request().getHeader(FromHeader.NAME);
        ToHeader to = (ToHeader) request().getHeader(ToHeader.NAME);
        return from != null && from.getTag() != null && to != null && to.getTag() != null;
    }

    @Override
    public void respond(int statusCode) {
        try {
            Response response = context.messageFactory().createResponse(statusCode, request());
            serverTransaction().sendResponse(response);
        } catch (ParseException | SipException | InvalidArgumentException e) {
            throw new SignalingException("Could not send " + statusCode + " for " + request().getMethod(), e);
        }
    }

    /**
     * The transaction the stack created for this request, or a new one.
     */
    public synchronized ServerTransaction serverTransaction() throws SipException {
        if (transaction == null) {
            transaction = event.getServerTransaction();
        }
        if (transaction == null) {
            transaction = context.provider().getNewServerTransaction(request());
        }
        return transaction;
    }

    @Override
    public String localEndpoint() {
        return context.localEndpoint();
    }

    @Override
    public String remoteEndpoint() {
        ViaHeader via = (ViaHeader) request().getHeader(ViaHeader.NAME);
        if (via == null) {
            return "unknown";
        }
        String host = via.getReceived() != null ? via.getReceived() : via.getHost();
        int port = via.getRPort() > 0 ? via.getRPort() : via.getPort();
        return via.getTransport().toLowerCase() + ":" + host + (port > 0 ? ":" + port : "");
    }

    @Override
    public String requestUri() {
        return String.valueOf(request().getRequestURI());
    }
}
