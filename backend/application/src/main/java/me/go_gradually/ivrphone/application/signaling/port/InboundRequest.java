package me.go_gradually.ivrphone.application.signaling.port;

import me.go_gradually.ivrphone.application.call.model.IncomingCallRequest;
import me.go_gradually.ivrphone.domain.signaling.SipMethod;

public interface InboundRequest extends IncomingCallRequest {
    SipMethod method();

    /**
     * True when both the From and the To header carry a tag.
     */
    boolean isInDialog();

    void respond(int statusCode);
}
