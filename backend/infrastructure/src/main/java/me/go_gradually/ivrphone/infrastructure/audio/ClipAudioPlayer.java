package me.go_gradually.ivrphone.infrastructure.audio;

import me.go_gradually.ivrphone.application.call.model.AudioPlaybackException;
import me.go_gradually.ivrphone.application.call.port.AudioPlayer;
import me.go_gradually.ivrphone.domain.sound.Sound;

import javax.sound.sampled.AudioInputStream;
import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.Clip;
import javax.sound.sampled.LineEvent;
import javax.sound.sampled.LineUnavailableException;
import javax.sound.sampled.UnsupportedAudioFileException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/**
 * Plays catalog sounds on the local mixer through a {@link Clip}. One instance per call,
 * so {@link #stop()} is final: a sound still being opened when the call hangs up never starts.
 */
public class ClipAudioPlayer implements AudioPlayer {
    private static final Logger log = Logger.getLogger(ClipAudioPlayer.class.getName());
    private static final long COMPLETION_SLACK_MS = 1_000;

    private final Path baseDir;
    private final Object lock = new Object();
    private Clip current;
    private CountDownLatch currentDone;
    private boolean stopped;

    public ClipAudioPlayer(Path baseDir) {
        this.baseDir = baseDir;
    }

    @Override
    public void play(Sound sound) {
        if (isStopped()) {
            log.fine(() -> "audio.play.skipped sound=" + sound.name() + " reason=stopped");
            return;
        }
        Path file = resolve(sound);
        if (isStopped()) {
            log.fine(() -> "audio.play.skipped sound=" + sound.name() + " reason=stopped");
            return;
        }
        CountDownLatch done = new CountDownLatch(1);
        Clip clip;
        try (AudioInputStream stream = AudioSystem.getAudioInputStream(file.toFile())) {
            clip = AudioSystem.getClip();
            clip.addLineListener(event -> {
                if (event.getType() == LineEvent.Type.STOP) {
                    done.countDown();
                }
            });
            clip.open(stream);
        } catch (UnsupportedAudioFileException | IOException e) {
            throw new AudioPlaybackException("Cannot read sound " + sound.name() + " from " + file, e);
        } catch (LineUnavailableException | IllegalArgumentException | SecurityException e) {
            throw new AudioPlaybackException("No audio line available for sound " + sound.name(), e);
        }

        synchronized (lock) {
            if (stopped) {
                clip.close();
                log.fine(() -> "audio.play.skipped sound=" + sound.name() + " reason=stopped");
                return;
            }
            current = clip;
            currentDone = done;
        }
        long startedAt = System.nanoTime();
        try {
            clip.start();
            long waitMs = TimeUnit.MICROSECONDS.toMillis(clip.getMicrosecondLength()) + COMPLETION_SLACK_MS;
            if (!done.await(waitMs, TimeUnit.MILLISECONDS)) {
                log.fine(() -> "audio.play.completion_missed sound=" + sound.name());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            synchronized (lock) {
                if (current == clip) {
                    current = null;
                    currentDone = null;
                }
            }
            clip.close();
        }
        log.fine(() -> "audio.play.finished sound=" + sound.name()
                + " elapsedMs=" + TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAt));
    }

    @Override
    public void stop() {
        synchronized (lock) {
            stopped = true;
            if (current == null) {
                return;
            }
            current.stop();
            currentDone.countDown();
        }
    }

    private boolean isStopped() {
        synchronized (lock) {
            return stopped;
        }
    }

    Path resolve(Sound sound) {
        Path file = baseDir.resolve(sound.path());
        if (!Files.isRegularFile(file)) {
            throw new AudioPlaybackException("Sound file not found: " + file.toAbsolutePath());
        }
        return file;
    }
}
