package me.go_gradually.ivrphone.infrastructure.sip;

import me.go_gradually.ivrphone.application.call.model.IncomingCallRequest;
import me.go_gradually.ivrphone.application.call.port.UserAgent;
import me.go_gradually.ivrphone.application.call.port.UserAgentFactory;
import me.go_gradually.ivrphone.infrastructure.shared.config.AppProperties;
import org.springframework.stereotype.Component;

@Component
public class JainSipUserAgentFactory implements UserAgentFactory {
    private final JainSipRuntime runtime;
    private final AppProperties properties;

    public JainSipUserAgentFactory(JainSipRuntime runtime, AppProperties properties) {
        this.runtime = runtime;
        this.properties = properties;
    }

    @Override
    public UserAgent create(IncomingCallRequest request) {
        return new JainSipUserAgent(
                runtime,
                properties.getSip().getRingingDelayMs(),
                properties.getSip().getAckTimeoutMs()
        );
    }
}
