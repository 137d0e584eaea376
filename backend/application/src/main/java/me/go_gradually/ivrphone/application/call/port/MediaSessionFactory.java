package me.go_gradually.ivrphone.application.call.port;

import me.go_gradually.ivrphone.application.call.model.IncomingCallRequest;

public interface MediaSessionFactory {
    MediaSession create(IncomingCallRequest request);
}
