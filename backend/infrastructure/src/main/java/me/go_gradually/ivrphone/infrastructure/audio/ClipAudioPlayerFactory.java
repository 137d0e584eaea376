package me.go_gradually.ivrphone.infrastructure.audio;

import me.go_gradually.ivrphone.application.call.port.AudioPlayer;
import me.go_gradually.ivrphone.application.call.port.AudioPlayerFactory;
import me.go_gradually.ivrphone.domain.sound.Sound;
import me.go_gradually.ivrphone.domain.sound.SoundCatalog;
import me.go_gradually.ivrphone.infrastructure.shared.config.AppProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.logging.Logger;

/**
 * Refuses to start a SIP-enabled service whose sound directory lacks any catalog file;
 * otherwise every call would end on the greeting.
 */
@Component
public class ClipAudioPlayerFactory implements AudioPlayerFactory {
    private static final Logger log = Logger.getLogger(ClipAudioPlayerFactory.class.getName());

    private final Path baseDir;

    public ClipAudioPlayerFactory(AppProperties properties) {
        this.baseDir = Path.of(properties.getSounds().getBaseDir());
        if (!properties.getSip().isEnabled()) {
            return;
        }
        List<Path> missing = missingSounds(baseDir);
        if (!missing.isEmpty()) {
            throw new IllegalStateException("Missing sound files under " + baseDir.toAbsolutePath()
                    + " (ivrphone.sounds.base-dir): " + missing);
        }
        log.info(() -> "audio.sounds.ready baseDir=" + baseDir.toAbsolutePath()
                + " count=" + SoundCatalog.values().size());
    }

    @Override
    public AudioPlayer create() {
        return new ClipAudioPlayer(baseDir);
    }

    static List<Path> missingSounds(Path baseDir) {
        return SoundCatalog.values().stream()
                .map(Sound::path)
                .map(baseDir::resolve)
                .filter(file -> !Files.isRegularFile(file))
                .toList();
    }
}
