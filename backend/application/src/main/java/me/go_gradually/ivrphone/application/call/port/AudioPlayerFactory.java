package me.go_gradually.ivrphone.application.call.port;

public interface AudioPlayerFactory {
    AudioPlayer create();
}
