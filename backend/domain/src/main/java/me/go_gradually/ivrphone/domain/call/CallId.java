package me.go_gradually.ivrphone.domain.call;

public record CallId(String value) {
    public CallId {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("CallId is required");
        }
    }

    public static CallId of(String value) {
        return new CallId(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
