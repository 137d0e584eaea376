package me.go_gradually.ivrphone.infrastructure.sip;

import me.go_gradually.ivrphone.application.call.port.MediaSession;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Advertises an audio stream offering PCMU, PCMA and telephone-event 0-15.
 * No RTP is sent or received.
 */
public class SdpMediaSession implements MediaSession {
    private static final String CRLF = "\r\n";

    private final String host;
    private final int rtpPort;
    private final long sessionId;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public SdpMediaSession(String host, int rtpPort, long sessionId) {
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("host is required");
        }
        if (rtpPort <= 0 || rtpPort > 65535) {
            throw new IllegalArgumentException("rtpPort out of range: " + rtpPort);
        }
        this.host = host;
        this.rtpPort = rtpPort;
        this.sessionId = sessionId;
    }

    @Override
    public String localDescription() {
        String addressType = host.indexOf(':') >= 0 ? "IP6" : "IP4";
        return "v=0" + CRLF
                + "o=- " + sessionId + " " + sessionId + " IN " + addressType + " " + host + CRLF
                + "s=ivrphone" + CRLF
                + "c=IN " + addressType + " " + host + CRLF
                + "t=0 0" + CRLF
                + "m=audio " + rtpPort + " RTP/AVP 0 8 101" + CRLF
                + "a=rtpmap:0 PCMU/8000" + CRLF
                + "a=rtpmap:8 PCMA/8000" + CRLF
                + "a=rtpmap:101 telephone-event/8000" + CRLF
                + "a=fmtp:101 0-15" + CRLF
                + "a=ptime:20" + CRLF
                + "a=sendrecv" + CRLF;
    }

    @Override
    public void close() {
        closed.set(true);
    }

    public boolean isClosed() {
        return closed.get();
    }
}
