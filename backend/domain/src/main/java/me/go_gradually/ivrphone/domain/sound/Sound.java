package me.go_gradually.ivrphone.domain.sound;

import java.time.Duration;

public record Sound(String name, String path, Duration nominalDuration) {
    public Sound {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Sound name is required");
        }
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("Sound path is required");
        }
        if (nominalDuration == null || nominalDuration.isNegative()) {
            throw new IllegalArgumentException("Sound duration must not be negative");
        }
    }

    static Sound of(String name, String path, int seconds) {
        return new Sound(name, path, Duration.ofSeconds(seconds));
    }
}
