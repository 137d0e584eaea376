package me.go_gradually.ivrphone.infrastructure.sip;

import gov.nist.javax.sip.SipStackExt;
import gov.nist.javax.sip.clientauthutils.AccountManager;
import gov.nist.javax.sip.clientauthutils.AuthenticationHelper;
import gov.nist.javax.sip.clientauthutils.UserCredentials;
import me.go_gradually.ivrphone.infrastructure.shared.config.AppProperties;
import org.springframework.stereotype.Component;

import javax.sip.ClientTransaction;
import javax.sip.InvalidArgumentException;
import javax.sip.ResponseEvent;
import javax.sip.SipException;
import javax.sip.address.Address;
import javax.sip.address.SipURI;
import javax.sip.header.CSeqHeader;
import javax.sip.header.CallIdHeader;
import javax.sip.header.ContactHeader;
import javax.sip.header.ExpiresHeader;
import javax.sip.header.FromHeader;
import javax.sip.header.ToHeader;
import javax.sip.header.ViaHeader;
import javax.sip.message.Request;
import javax.sip.message.Response;
import java.text.ParseException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Keeps every configured account registered with its registrar. Digest challenges are
 * answered with the stack's {@link AuthenticationHelper}; registrations are refreshed
 * before they expire and removed on shutdown.
 */
@Component
public class JainSipRegistrationAgent {
    private static final Logger log = Logger.getLogger(JainSipRegistrationAgent.class.getName());
    private static final int MAX_CHALLENGES = 2;
    private static final long RETRY_DELAY_SECONDS = 30;
    private static final double REFRESH_RATIO = 0.9;

    private final AppProperties properties;
    private final JainSipRuntime runtime;
    private final Map<String, Registration> registrations = new ConcurrentHashMap<>();
    private volatile AuthenticationHelper authenticationHelper;

    public JainSipRegistrationAgent(AppProperties properties, JainSipRuntime runtime) {
        this.properties = properties;
        this.runtime = runtime;
    }

    public void start() {
        List<AppProperties.Account> accounts = properties.getAccounts();
        if (accounts.isEmpty()) {
            return;
        }
        JainSipContext context = runtime.context();
        authenticationHelper = ((SipStackExt) context.stack())
                .getAuthenticationHelper(new ConfiguredAccounts(), context.headerFactory());
        for (AppProperties.Account account : accounts) {
            Registration registration = new Registration(account, context.provider().getNewCallId());
            registrations.put(registration.callId.getCallId(), registration);
            send(registration, account.getExpiry());
        }
    }

    public void stop() {
        for (Registration registration : registrations.values()) {
            registration.cancelRefresh();
            if (registration.registered) {
                try {
                    sendRegister(registration, 0);
                } catch (RuntimeException | ParseException | SipException | InvalidArgumentException e) {
                    log.log(Level.FINE, e, () -> "sip.registration.remove_failed uri=" + registration.uri());
                }
            }
        }
        registrations.clear();
    }

    public int activeRegistrations() {
        return (int) registrations.values().stream().filter(r -> r.registered).count();
    }

    public void processResponse(ResponseEvent event) {
        Response response = event.getResponse();
        CallIdHeader callId = (CallIdHeader) response.getHeader(CallIdHeader.NAME);
        Registration registration = callId == null ? null : registrations.get(callId.getCallId());
        if (registration == null) {
            return;
        }
        int status = response.getStatusCode();
        if (status < Response.OK) {
            return;
        }
        if (status < 300) {
            succeeded(registration, response);
        } else if (status == Response.UNAUTHORIZED || status == Response.PROXY_AUTHENTICATION_REQUIRED) {
            challenged(registration, response, event.getClientTransaction());
        } else if (status == Response.REQUEST_TIMEOUT || status == Response.TEMPORARILY_UNAVAILABLE
                || status == Response.SERVICE_UNAVAILABLE || status == Response.SERVER_INTERNAL_ERROR) {
            temporaryFailure(registration, status);
        } else {
            registration.registered = false;
            log.warning(() -> "sip.registration.failed uri=" + registration.uri() + " status=" + status);
        }
    }

    public void processTimeout(ClientTransaction transaction) {
        CallIdHeader callId = (CallIdHeader) transaction.getRequest().getHeader(CallIdHeader.NAME);
        Registration registration = callId == null ? null : registrations.get(callId.getCallId());
        if (registration != null) {
            temporaryFailure(registration, Response.REQUEST_TIMEOUT);
        }
    }

    private void succeeded(Registration registration, Response response) {
        registration.challenges = 0;
        if (registration.requestedExpiry == 0) {
            registration.registered = false;
            return;
        }
        registration.registered = true;
        int granted = grantedExpiry(response, registration.requestedExpiry);
        long refreshSeconds = Math.max(1, (long) (granted * REFRESH_RATIO));
        log.info(() -> "sip.registration.succeeded uri=" + registration.uri() + " expiry=" + granted);
        schedule(registration, refreshSeconds);
    }

    private void challenged(Registration registration, Response response, ClientTransaction transaction) {
        if (registration.challenges >= MAX_CHALLENGES || transaction == null) {
            registration.registered = false;
            log.warning(() -> "sip.registration.failed uri=" + registration.uri() + " reason=authentication");
            return;
        }
        registration.challenges += 1;
        try {
            ClientTransaction retry = authenticationHelper.handleChallenge(
                    response, transaction, runtime.context().provider(), 5);
            registration.cseq.set(((CSeqHeader) retry.getRequest().getHeader(CSeqHeader.NAME)).getSeqNumber());
            retry.sendRequest();
        } catch (SipException | RuntimeException e) {
            registration.registered = false;
            log.log(Level.WARNING, e, () -> "sip.registration.failed uri=" + registration.uri() + " reason=challenge");
        }
    }

    private void temporaryFailure(Registration registration, int status) {
        log.warning(() -> "sip.registration.temporary_failure uri=" + registration.uri() + " status=" + status
                + " retryInSeconds=" + RETRY_DELAY_SECONDS);
        schedule(registration, RETRY_DELAY_SECONDS);
    }

    private void schedule(Registration registration, long delaySeconds) {
        registration.cancelRefresh();
        try {
            registration.refresh = runtime.scheduler().schedule(
                    () -> send(registration, registration.account.getExpiry()),
                    delaySeconds, TimeUnit.SECONDS);
        } catch (IllegalStateException e) {
            log.fine(() -> "sip.registration.refresh_skipped uri=" + registration.uri() + " reason=stack_stopped");
        }
    }

    private void send(Registration registration, int expiry) {
        try {
            sendRegister(registration, expiry);
        } catch (ParseException | SipException | InvalidArgumentException | RuntimeException e) {
            log.log(Level.WARNING, e, () -> "sip.registration.failed uri=" + registration.uri() + " reason=send");
            temporaryFailure(registration, Response.SERVICE_UNAVAILABLE);
        }
    }

    private void sendRegister(Registration registration, int expiry)
            throws ParseException, SipException, InvalidArgumentException {
        JainSipContext context = runtime.context();
        AppProperties.Account account = registration.account;
        SipURI registrar = context.addressFactory().createSipURI(null, account.getDomain());
        Address addressOfRecord = context.addressFactory().createAddress(
                context.addressFactory().createSipURI(account.getUsername(), account.getDomain()));
        FromHeader from = context.headerFactory().createFromHeader(addressOfRecord, registration.fromTag);
        ToHeader to = context.headerFactory().createToHeader(addressOfRecord, null);
        CSeqHeader cseq = context.headerFactory().createCSeqHeader(registration.cseq.incrementAndGet(), Request.REGISTER);
        ViaHeader via = context.headerFactory().createViaHeader(
                context.listenAddress().host(), context.port(), context.transport(), null);
        Request request = context.messageFactory().createRequest(
                registrar,
                Request.REGISTER,
                registration.callId,
                cseq,
                from,
                to,
                List.of(via),
                context.headerFactory().createMaxForwardsHeader(70));
        ContactHeader contact = context.contactHeader(account.getUsername());
        request.addHeader(contact);
        ExpiresHeader expires = context.headerFactory().createExpiresHeader(expiry);
        request.addHeader(expires);

        registration.requestedExpiry = expiry;
        ClientTransaction transaction = context.provider().getNewClientTransaction(request);
        transaction.sendRequest();
        log.fine(() -> "sip.registration.sent uri=" + registration.uri() + " expiry=" + expiry);
    }

    private static int grantedExpiry(Response response, int requested) {
        ContactHeader contact = (ContactHeader) response.getHeader(ContactHeader.NAME);
        if (contact != null && contact.getExpires() > 0) {
            return contact.getExpires();
        }
        ExpiresHeader expires = response.getExpires();
        if (expires != null && expires.getExpires() > 0) {
            return expires.getExpires();
        }
        return requested;
    }

    private final class ConfiguredAccounts implements AccountManager {
        @Override
        public UserCredentials getCredentials(ClientTransaction challengedTransaction, String realm) {
            CallIdHeader callId = (CallIdHeader) challengedTransaction.getRequest().getHeader(CallIdHeader.NAME);
            Registration registration = registrations.get(callId.getCallId());
            if (registration == null) {
                return null;
            }
            AppProperties.Account account = registration.account;
            return new UserCredentials() {
                @Override
                public String getUserName() {
                    return account.getUsername();
                }

                @Override
                public String getPassword() {
                    return account.getPassword();
                }

                @Override
                public String getSipDomain() {
                    return account.getDomain();
                }
            };
        }
    }

    private static final class Registration {
        private final AppProperties.Account account;
        private final CallIdHeader callId;
        private final String fromTag = Long.toHexString(ThreadLocalRandom.current().nextLong());
        private final AtomicLong cseq = new AtomicLong();
        private volatile int requestedExpiry;
        private volatile int challenges;
        private volatile boolean registered;
        private volatile ScheduledFuture<?> refresh;

        private Registration(AppProperties.Account account, CallIdHeader callId) {
            this.account = account;
            this.callId = callId;
        }

        private String uri() {
            return account.addressOfRecord();
        }

        private void cancelRefresh() {
            ScheduledFuture<?> current = refresh;
            if (current != null) {
                current.cancel(false);
            }
        }
    }
}
