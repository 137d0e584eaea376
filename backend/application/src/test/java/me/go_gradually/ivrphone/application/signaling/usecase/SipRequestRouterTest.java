package me.go_gradually.ivrphone.application.signaling.usecase;

import me.go_gradually.ivrphone.application.call.usecase.IncomingCallUseCase;
import me.go_gradually.ivrphone.application.signaling.port.InboundRequest;
import me.go_gradually.ivrphone.domain.signaling.SipMethod;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SipRequestRouterTest {

    @Mock
    private IncomingCallUseCase incomingCallUseCase;
    @Mock
    private InboundRequest request;

    private SipRequestRouter router;

    @BeforeEach
    void setUp() {
        router = new SipRequestRouter(incomingCallUseCase);
    }

    @Test
    void invite_goesToIncomingCallUseCase() {
        when(request.method()).thenReturn(SipMethod.INVITE);

        router.route(request);

        verify(incomingCallUseCase).accept(request);
        verify(request, never()).respond(anyInt());
    }

    @Test
    void byeOutsideDialog_gets481() {
        when(request.method()).thenReturn(SipMethod.BYE);

        router.route(request);

        verify(request).respond(481);
        verify(incomingCallUseCase, never()).accept(any());
    }

    @Test
    void subscribe_gets405() {
        when(request.method()).thenReturn(SipMethod.SUBSCRIBE);

        router.route(request);

        verify(request).respond(405);
    }

    @Test
    void optionsAndRegister_get200() {
        when(request.method()).thenReturn(SipMethod.OPTIONS, SipMethod.REGISTER);

        router.route(request);
        router.route(request);

        verify(request, times(2)).respond(200);
    }

    @Test
    void inDialogRequest_isLeftToTheUserAgent() {
        when(request.isInDialog()).thenReturn(true);

        router.route(request);

        verify(request, never()).respond(anyInt());
        verify(incomingCallUseCase, never()).accept(any());
    }

    @Test
    void unknownMethod_isIgnored() {
        when(request.method()).thenReturn(SipMethod.NOTIFY);

        router.route(request);

        verify(request, never()).respond(anyInt());
    }

    @Test
    void responseFailure_isNotPropagated() {
        when(request.method()).thenReturn(SipMethod.OPTIONS);
        doThrow(new IllegalStateException("transport closed")).when(request).respond(200);

        assertDoesNotThrow(() -> router.route(request));
    }
}
