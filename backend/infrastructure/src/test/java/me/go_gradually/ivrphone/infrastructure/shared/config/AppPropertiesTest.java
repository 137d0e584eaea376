package me.go_gradually.ivrphone.infrastructure.shared.config;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AppPropertiesTest {

    @Test
    void defaults_matchDocumentedValues() {
        AppProperties properties = new AppProperties();

        assertTrue(properties.getSip().isEnabled());
        assertEquals("lv4", properties.getSip().getListenAddress());
        assertEquals(5060, properties.getSip().getPort());
        assertEquals("udp", properties.getSip().getTransport());
        assertEquals(500, properties.getSip().getRingingDelayMs());
        assertEquals(32_000, properties.getSip().getAckTimeoutMs());
        assertEquals(10_000, properties.answerTimeoutMs());
        assertEquals(49170, properties.getMedia().getRtpPort());
        assertEquals("sounds", properties.getSounds().getBaseDir());
        assertTrue(properties.getAccounts().isEmpty());
    }

    @Test
    void policyGetters_delegateToNestedProperties() {
        AppProperties properties = new AppProperties();
        properties.getSip().setAnswerTimeoutMs(2_500);

        AppProperties.Account account = new AppProperties.Account();
        account.setUsername("1001");
        account.setPassword("secret");
        account.setDomain("pbx.local");
        properties.setAccounts(List.of(account));

        assertEquals(2_500, properties.answerTimeoutMs());
        assertEquals(120, properties.getAccounts().get(0).getExpiry());
        assertEquals("sip:1001@pbx.local", properties.getAccounts().get(0).addressOfRecord());
    }

    @Test
    void setAccounts_null_becomesEmpty() {
        AppProperties properties = new AppProperties();

        properties.setAccounts(null);

        assertTrue(properties.getAccounts().isEmpty());
    }
}
