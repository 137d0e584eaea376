package me.go_gradually.ivrphone.application.call.port;

public interface MediaSession {
    /**
     * Session description offered to the caller when the call is answered.
     */
    String localDescription();

    void close();
}
