package me.go_gradually.ivrphone.infrastructure.sip;

import me.go_gradually.ivrphone.application.call.usecase.ActiveCallUseCase;
import me.go_gradually.ivrphone.application.signaling.usecase.SipRequestRouter;
import me.go_gradually.ivrphone.infrastructure.shared.config.AppProperties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class JainSipServerTest {

    @Mock
    private JainSipRegistrationAgent registrationAgent;
    @Mock
    private ActiveCallUseCase activeCallUseCase;
    @Mock
    private SipRequestRouter router;

    @Test
    void start_whenDisabled_leavesStackDown() {
        AppProperties properties = new AppProperties();
        properties.getSip().setEnabled(false);
        JainSipRuntime runtime = new JainSipRuntime();
        JainSipServer server = new JainSipServer(properties, runtime, registrationAgent, activeCallUseCase, router);

        server.start();
        server.stop();

        assertFalse(server.isRunning());
        assertFalse(runtime.isRunning());
        verifyNoInteractions(registrationAgent);
        verify(activeCallUseCase, never()).hangupAll();
    }

    @Test
    void start_withInvalidListenAddress_fails() {
        AppProperties properties = new AppProperties();
        properties.getSip().setListenAddress("not-an-address");
        JainSipServer server = new JainSipServer(properties, new JainSipRuntime(), registrationAgent,
                activeCallUseCase, router);

        assertThrows(IllegalArgumentException.class, server::start);
        assertFalse(server.isRunning());
    }

    @Test
    void registrationAgent_withoutAccounts_needsNoStack() {
        JainSipRegistrationAgent agent = new JainSipRegistrationAgent(new AppProperties(), new JainSipRuntime());

        agent.start();
        agent.stop();

        assertFalse(agent.activeRegistrations() > 0);
    }
}
