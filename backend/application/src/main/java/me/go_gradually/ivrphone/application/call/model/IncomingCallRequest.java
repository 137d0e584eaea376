package me.go_gradually.ivrphone.application.call.model;

public interface IncomingCallRequest {
    String localEndpoint();

    String remoteEndpoint();

    String requestUri();

    default String describe() {
        return localEndpoint() + "<-" + remoteEndpoint() + " " + requestUri();
    }
}
