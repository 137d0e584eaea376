package me.go_gradually.ivrphone.domain.dtmf;

/**
 * Touch-tone keys the IVR understands, keyed by their RFC 4733 event code.
 */
public enum DtmfKey {
    ZERO(0, '0'),
    ONE(1, '1'),
    TWO(2, '2'),
    THREE(3, '3'),
    FOUR(4, '4'),
    FIVE(5, '5'),
    SIX(6, '6'),
    SEVEN(7, '7'),
    EIGHT(8, '8'),
    NINE(9, '9'),
    STAR(10, '*'),
    POUND(11, '#');

    private final int code;
    private final char symbol;

    DtmfKey(int code, char symbol) {
        this.code = code;
        this.symbol = symbol;
    }

    public int code() {
        return code;
    }

    public char symbol() {
        return symbol;
    }

    public boolean isDigit() {
        return code <= 9;
    }

    /**
     * @return the key for the event code, or {@code null} when the code has no mapping
     */
    public static DtmfKey fromCode(int code) {
        for (DtmfKey key : values()) {
            if (key.code == code) {
                return key;
            }
        }
        return null;
    }

    public static DtmfKey fromSymbol(char symbol) {
        for (DtmfKey key : values()) {
            if (key.symbol == symbol) {
                return key;
            }
        }
        return null;
    }
}
