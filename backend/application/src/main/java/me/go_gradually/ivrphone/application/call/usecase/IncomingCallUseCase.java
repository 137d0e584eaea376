package me.go_gradually.ivrphone.application.call.usecase;

import me.go_gradually.ivrphone.application.call.model.IncomingCallRequest;
import me.go_gradually.ivrphone.application.call.policy.CallPolicy;
import me.go_gradually.ivrphone.application.call.port.AudioPlayerFactory;
import me.go_gradually.ivrphone.application.call.port.CallRegistryPort;
import me.go_gradually.ivrphone.application.call.port.MediaSessionFactory;
import me.go_gradually.ivrphone.application.call.port.UserAgent;
import me.go_gradually.ivrphone.application.call.port.UserAgentFactory;
import me.go_gradually.ivrphone.application.shared.port.AsyncExecutor;
import me.go_gradually.ivrphone.application.shared.port.MetricsPort;

public class IncomingCallUseCase {
    private final UserAgentFactory userAgentFactory;
    private final MediaSessionFactory mediaSessionFactory;
    private final AudioPlayerFactory audioPlayerFactory;
    private final CallRegistryPort callRegistry;
    private final AsyncExecutor asyncExecutor;
    private final CallPolicy callPolicy;
    private final MetricsPort metrics;

    public IncomingCallUseCase(UserAgentFactory userAgentFactory,
                               MediaSessionFactory mediaSessionFactory,
                               AudioPlayerFactory audioPlayerFactory,
                               CallRegistryPort callRegistry,
                               AsyncExecutor asyncExecutor,
                               CallPolicy callPolicy,
                               MetricsPort metrics) {
        this.userAgentFactory = userAgentFactory;
        this.mediaSessionFactory = mediaSessionFactory;
        this.audioPlayerFactory = audioPlayerFactory;
        this.callRegistry = callRegistry;
        this.asyncExecutor = asyncExecutor;
        this.callPolicy = callPolicy;
        this.metrics = metrics;
    }

    /**
     * Accepts the call on the calling thread and hands answering and the greeting to the
     * async executor, so the signaling layer gets its thread back right away.
     */
    public IvrCallFlow accept(IncomingCallRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("incoming call request is required");
        }
        UserAgent userAgent = userAgentFactory.create(request);
        IvrCallFlow flow = new IvrCallFlow(
                request,
                userAgent,
                audioPlayerFactory.create(),
                mediaSessionFactory,
                callRegistry,
                callPolicy,
                metrics
        );
        if (flow.accept()) {
            asyncExecutor.execute(flow::answerAndGreet);
        }
        return flow;
    }
}
