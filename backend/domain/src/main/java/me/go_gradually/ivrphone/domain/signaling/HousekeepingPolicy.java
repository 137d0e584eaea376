package me.go_gradually.ivrphone.domain.signaling;

/**
 * Canned responses for out-of-dialog requests that never reach the call flow.
 */
public final class HousekeepingPolicy {
    public static final int OK = 200;
    public static final int METHOD_NOT_ALLOWED = 405;
    public static final int CALL_OR_TRANSACTION_DOES_NOT_EXIST = 481;

    private HousekeepingPolicy() {
    }

    /**
     * @return the status code to answer with, or {@code null} if the method is not housekeeping
     */
    public static Integer responseFor(SipMethod method) {
        if (method == null) {
            return null;
        }
        return switch (method) {
            case BYE -> CALL_OR_TRANSACTION_DOES_NOT_EXIST;
            case SUBSCRIBE -> METHOD_NOT_ALLOWED;
            case OPTIONS, REGISTER -> OK;
            default -> null;
        };
    }
}
