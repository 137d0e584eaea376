package me.go_gradually.ivrphone.application.call.model;

public class AudioPlaybackException extends RuntimeException {
    public AudioPlaybackException(String message) {
        super(message);
    }

    public AudioPlaybackException(String message, Throwable cause) {
        super(message, cause);
    }
}
