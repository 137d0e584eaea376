package me.go_gradually.ivrphone.infrastructure.sip;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DtmfRelayParserTest {

    @Test
    void relayBody_yieldsSignalAndDuration() {
        Optional<DtmfRelayParser.DtmfSignal> signal = DtmfRelayParser.parse("dtmf-relay", body("Signal=7\r\nDuration=160\r\n"));

        assertEquals(new DtmfRelayParser.DtmfSignal((byte) 7, 160), signal.orElseThrow());
    }

    @Test
    void relayBody_mapsStarPoundAndLetters() {
        assertEquals(10, DtmfRelayParser.parse("dtmf-relay", body("Signal=*")).orElseThrow().code());
        assertEquals(11, DtmfRelayParser.parse("dtmf-relay", body("Signal=#")).orElseThrow().code());
        assertEquals(12, DtmfRelayParser.parse("dtmf-relay", body("Signal=A")).orElseThrow().code());
        assertEquals(15, DtmfRelayParser.parse("dtmf-relay", body("signal = d")).orElseThrow().code());
    }

    @Test
    void relayBody_withoutDuration_usesDefault() {
        assertEquals(DtmfRelayParser.DEFAULT_DURATION_MS,
                DtmfRelayParser.parse("DTMF-Relay", body("Signal=3")).orElseThrow().durationMs());
    }

    @Test
    void plainDtmfBody_isAnEventCode() {
        assertEquals(11, DtmfRelayParser.parse("dtmf", body("11")).orElseThrow().code());
        assertEquals(4, DtmfRelayParser.parse("dtmf", body("4\r\n")).orElseThrow().code());
    }

    @Test
    void unusableBodies_yieldNothing() {
        assertTrue(DtmfRelayParser.parse("dtmf-relay", body("Duration=100")).isEmpty());
        assertTrue(DtmfRelayParser.parse("dtmf-relay", body("Signal=x")).isEmpty());
        assertTrue(DtmfRelayParser.parse("sdp", body("Signal=1")).isEmpty());
        assertTrue(DtmfRelayParser.parse("dtmf", new byte[0]).isEmpty());
        assertTrue(DtmfRelayParser.parse(null, body("Signal=1")).isEmpty());
    }

    private static byte[] body(String text) {
        return text.getBytes(StandardCharsets.US_ASCII);
    }
}
