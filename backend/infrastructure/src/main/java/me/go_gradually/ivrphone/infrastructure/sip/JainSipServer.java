package me.go_gradually.ivrphone.infrastructure.sip;

import me.go_gradually.ivrphone.application.call.model.SignalingException;
import me.go_gradually.ivrphone.application.call.usecase.ActiveCallUseCase;
import me.go_gradually.ivrphone.application.signaling.usecase.SipRequestRouter;
import me.go_gradually.ivrphone.infrastructure.shared.config.AppProperties;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import javax.sip.InvalidArgumentException;
import javax.sip.ListeningPoint;
import javax.sip.ObjectInUseException;
import javax.sip.SipException;
import javax.sip.SipFactory;
import javax.sip.SipProvider;
import javax.sip.SipStack;
import java.util.Properties;
import java.util.TooManyListenersException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Owns the JAIN-SIP stack: binds the listening point when the application starts, and on
 * shutdown hangs up every live call before the transport goes away.
 */
@Component
public class JainSipServer implements SmartLifecycle {
    private static final Logger log = Logger.getLogger(JainSipServer.class.getName());

    private final AppProperties properties;
    private final JainSipRuntime runtime;
    private final JainSipRegistrationAgent registrationAgent;
    private final ActiveCallUseCase activeCallUseCase;
    private final JainSipListener listener;
    private final Object lifecycleLock = new Object();
    private SipStack sipStack;
    private ListeningPoint listeningPoint;
    private SipProvider sipProvider;
    private volatile boolean running;

    public JainSipServer(AppProperties properties,
                         JainSipRuntime runtime,
                         JainSipRegistrationAgent registrationAgent,
                         ActiveCallUseCase activeCallUseCase,
                         SipRequestRouter router) {
        this.properties = properties;
        this.runtime = runtime;
        this.registrationAgent = registrationAgent;
        this.activeCallUseCase = activeCallUseCase;
        this.listener = new JainSipListener(runtime, router, registrationAgent);
    }

    @Override
    public void start() {
        AppProperties.Sip sip = properties.getSip();
        if (!sip.isEnabled()) {
            log.info("sip.server.disabled");
            return;
        }
        ListenAddressResolver.ListenAddress address = ListenAddressResolver.resolve(sip.getListenAddress());
        synchronized (lifecycleLock) {
            if (running) {
                return;
            }
            try {
                SipFactory sipFactory = SipFactory.getInstance();
                sipFactory.setPathName("gov.nist");
                Properties stackProperties = new Properties();
                stackProperties.setProperty("javax.sip.STACK_NAME", sip.getStackName());
                stackProperties.setProperty("gov.nist.javax.sip.LOG_MESSAGE_CONTENT", "false");
                sipStack = sipFactory.createSipStack(stackProperties);
                listeningPoint = sipStack.createListeningPoint(address.host(), sip.getPort(), sip.getTransport());
                sipProvider = sipStack.createSipProvider(listeningPoint);
                sipProvider.addSipListener(listener);
                runtime.attach(new JainSipContext(
                        sipStack,
                        sipProvider,
                        sipFactory.createMessageFactory(),
                        sipFactory.createHeaderFactory(),
                        sipFactory.createAddressFactory(),
                        address,
                        sip.getPort(),
                        sip.getTransport()
                ));
                sipStack.start();
            } catch (SipException | InvalidArgumentException | TooManyListenersException e) {
                runtime.detach();
                throw new SignalingException("Could not start SIP stack on " + address.uriHost() + ":" + sip.getPort(), e);
            }
            registrationAgent.start();
            running = true;
        }
        log.info(() -> "sip.server.started address=" + address.uriHost() + ":" + sip.getPort()
                + " transport=" + sip.getTransport() + " localhost=" + address.label());
    }

    @Override
    public void stop() {
        synchronized (lifecycleLock) {
            if (!running) {
                return;
            }
            log.info("sip.server.exiting");
            int hungUp = activeCallUseCase.hangupAll();
            log.info(() -> "sip.server.calls_hungup count=" + hungUp);
            registrationAgent.stop();
            try {
                sipProvider.removeSipListener(listener);
                sipStack.deleteSipProvider(sipProvider);
                sipStack.deleteListeningPoint(listeningPoint);
            } catch (ObjectInUseException e) {
                log.log(Level.WARNING, e, () -> "sip.transport.release_failed");
            }
            sipStack.stop();
            runtime.detach();
            running = false;
        }
        log.info("sip.transport.shutdown");
    }

    @Override
    public boolean isRunning() {
        return running;
    }
}
