package me.go_gradually.ivrphone.infrastructure.sip;

import me.go_gradually.ivrphone.application.call.model.IncomingCallRequest;
import me.go_gradually.ivrphone.application.call.port.MediaSession;
import me.go_gradually.ivrphone.application.call.port.MediaSessionFactory;
import me.go_gradually.ivrphone.infrastructure.shared.config.AppProperties;
import org.springframework.stereotype.Component;

@Component
public class SdpMediaSessionFactory implements MediaSessionFactory {
    private final AppProperties properties;

    public SdpMediaSessionFactory(AppProperties properties) {
        this.properties = properties;
    }

    @Override
    public MediaSession create(IncomingCallRequest request) {
        String host = ListenAddressResolver.resolve(properties.getSip().getListenAddress()).host();
        return new SdpMediaSession(host, properties.getMedia().getRtpPort(), System.currentTimeMillis());
    }
}
