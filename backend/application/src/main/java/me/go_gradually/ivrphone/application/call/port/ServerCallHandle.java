package me.go_gradually.ivrphone.application.call.port;

public interface ServerCallHandle {
    boolean isCancelled();

    void hangup();
}
