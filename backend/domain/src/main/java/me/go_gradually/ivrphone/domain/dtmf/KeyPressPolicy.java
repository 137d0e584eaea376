package me.go_gradually.ivrphone.domain.dtmf;

public final class KeyPressPolicy {
    public static final DtmfKey TERMINATOR = DtmfKey.POUND;
    public static final DtmfKey HELP = DtmfKey.STAR;

    private KeyPressPolicy() {
    }

    public static KeyAction decide(DtmfKey key) {
        if (key == null) {
            return KeyAction.IGNORE;
        }
        if (key == TERMINATOR) {
            return KeyAction.PLAY_BACK;
        }
        if (key == HELP) {
            return KeyAction.EXPLAIN;
        }
        return key.isDigit() ? KeyAction.APPEND : KeyAction.IGNORE;
    }

    public enum KeyAction {
        APPEND,
        EXPLAIN,
        PLAY_BACK,
        IGNORE
    }
}
