package me.go_gradually.ivrphone.domain.signaling;

import java.util.Locale;

public enum SipMethod {
    INVITE,
    ACK,
    BYE,
    CANCEL,
    INFO,
    OPTIONS,
    REGISTER,
    SUBSCRIBE,
    NOTIFY,
    OTHER;

    public static SipMethod of(String raw) {
        if (raw == null || raw.isBlank()) {
            return OTHER;
        }
        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return OTHER;
        }
    }
}
