package me.go_gradually.ivrphone.infrastructure.sip;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Optional;

/**
 * Reads DTMF out of SIP INFO bodies, either {@code application/dtmf-relay}
 * ({@code Signal=5\r\nDuration=160}) or {@code application/dtmf} (a bare code).
 * Signals map to RFC 4733 event codes.
 */
public final class DtmfRelayParser {
    static final int DEFAULT_DURATION_MS = 250;

    private DtmfRelayParser() {
    }

    public static Optional<DtmfSignal> parse(String contentSubType, byte[] body) {
        if (contentSubType == null || body == null || body.length == 0) {
            return Optional.empty();
        }
        String text = new String(body, StandardCharsets.US_ASCII).trim();
        String subType = contentSubType.toLowerCase(Locale.ROOT);
        if ("dtmf-relay".equals(subType)) {
            return parseRelay(text);
        }
        if ("dtmf".equals(subType)) {
            Integer code = codeOf(text);
            return code == null ? Optional.empty() : Optional.of(new DtmfSignal(code.byteValue(), DEFAULT_DURATION_MS));
        }
        return Optional.empty();
    }

    private static Optional<DtmfSignal> parseRelay(String text) {
        Integer code = null;
        int duration = DEFAULT_DURATION_MS;
        for (String line : text.split("\r?\n")) {
            int separator = line.indexOf('=');
            if (separator < 0) {
                continue;
            }
            String key = line.substring(0, separator).trim();
            String value = line.substring(separator + 1).trim();
            if ("signal".equalsIgnoreCase(key)) {
                code = codeOf(value);
            } else if ("duration".equalsIgnoreCase(key)) {
                duration = parseDuration(value);
            }
        }
        return code == null ? Optional.empty() : Optional.of(new DtmfSignal(code.byteValue(), duration));
    }

    static Integer codeOf(String signal) {
        if (signal == null || signal.isEmpty()) {
            return null;
        }
        if (signal.length() == 1) {
            char c = Character.toUpperCase(signal.charAt(0));
            if (c >= '0' && c <= '9') {
                return c - '0';
            }
            return switch (c) {
                case '*' -> 10;
                case '#' -> 11;
                case 'A', 'B', 'C', 'D' -> 12 + (c - 'A');
                default -> null;
            };
        }
        try {
            int code = Integer.parseInt(signal);
            return code >= 0 && code <= 255 ? code : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static int parseDuration(String value) {
        try {
            int duration = Integer.parseInt(value);
            return duration > 0 ? duration : DEFAULT_DURATION_MS;
        } catch (NumberFormatException e) {
            return DEFAULT_DURATION_MS;
        }
    }

    public record DtmfSignal(byte code, int durationMs) {
    }
}
