package me.go_gradually.ivrphone.domain.call;

public enum CallPhase {
    RINGING,
    ANSWERING,
    GREETING_PLAYING,
    AWAITING_DIGITS,
    PLAYING_DIGITS,
    ENDED
}
