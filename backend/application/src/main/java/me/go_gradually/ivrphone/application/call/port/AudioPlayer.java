package me.go_gradually.ivrphone.application.call.port;

import me.go_gradually.ivrphone.domain.sound.Sound;

public interface AudioPlayer {
    /**
     * Plays the sound and blocks until it finished or {@link #stop()} was called.
     *
     * @throws me.go_gradually.ivrphone.application.call.model.AudioPlaybackException if the sound cannot be played
     */
    void play(Sound sound);

    /**
     * Makes an in-flight {@link #play(Sound)} return early. A stopped player stays stopped:
     * later calls to {@link #play(Sound)} return without playing anything.
     */
    void stop();
}
