package me.go_gradually.ivrphone.infrastructure.sip;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SdpMediaSessionTest {

    @Test
    void localDescription_offersG711AndTelephoneEvents() {
        String sdp = new SdpMediaSession("127.0.0.1", 49170, 42L).localDescription();

        assertTrue(sdp.startsWith("v=0\r\n"));
        assertTrue(sdp.contains("c=IN IP4 127.0.0.1\r\n"));
        assertTrue(sdp.contains("m=audio 49170 RTP/AVP 0 8 101\r\n"));
        assertTrue(sdp.contains("a=rtpmap:0 PCMU/8000\r\n"));
        assertTrue(sdp.contains("a=rtpmap:8 PCMA/8000\r\n"));
        assertTrue(sdp.contains("a=fmtp:101 0-15\r\n"));
    }

    @Test
    void localDescription_usesIp6ForIpv6Hosts() {
        String sdp = new SdpMediaSession("::1", 40000, 1L).localDescription();

        assertTrue(sdp.contains("c=IN IP6 ::1\r\n"));
    }

    @Test
    void close_marksSessionClosed() {
        SdpMediaSession session = new SdpMediaSession("127.0.0.1", 49170, 1L);

        session.close();

        assertTrue(session.isClosed());
    }

    @Test
    void constructor_rejectsBadPort() {
        assertThrows(IllegalArgumentException.class, () -> new SdpMediaSession("127.0.0.1", 0, 1L));
    }
}
