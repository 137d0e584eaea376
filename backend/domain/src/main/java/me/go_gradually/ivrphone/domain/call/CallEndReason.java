package me.go_gradually.ivrphone.domain.call;

public enum CallEndReason {
    REMOTE_HANGUP("remote_hangup"),
    LOCAL_HANGUP("local_hangup"),
    CANCELLED("cancelled"),
    RING_TIMEOUT("ring_timeout"),
    ANSWER_FAILED("answer_failed"),
    PLAYBACK_FAILED("playback_failed"),
    SHUTDOWN("shutdown");

    private final String code;

    CallEndReason(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
