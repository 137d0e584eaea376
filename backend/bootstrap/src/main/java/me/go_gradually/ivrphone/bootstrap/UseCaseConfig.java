package me.go_gradually.ivrphone.bootstrap;

import me.go_gradually.ivrphone.application.call.policy.CallPolicy;
import me.go_gradually.ivrphone.application.call.port.AudioPlayerFactory;
import me.go_gradually.ivrphone.application.call.port.CallRegistryPort;
import me.go_gradually.ivrphone.application.call.port.MediaSessionFactory;
import me.go_gradually.ivrphone.application.call.port.UserAgentFactory;
import me.go_gradually.ivrphone.application.call.usecase.ActiveCallUseCase;
import me.go_gradually.ivrphone.application.call.usecase.IncomingCallUseCase;
import me.go_gradually.ivrphone.application.shared.port.AsyncExecutor;
import me.go_gradually.ivrphone.application.shared.port.MetricsPort;
import me.go_gradually.ivrphone.application.signaling.usecase.SipRequestRouter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class UseCaseConfig {
    @Bean(destroyMethod = "shutdown")
    public ExecutorService callExecutorService() {
        return Executors.newCachedThreadPool();
    }

    @Bean
    public AsyncExecutor asyncExecutor(ExecutorService callExecutorService) {
        return callExecutorService::execute;
    }

    @Bean
    public IncomingCallUseCase incomingCallUseCase(UserAgentFactory userAgentFactory,
                                                   MediaSessionFactory mediaSessionFactory,
                                                   AudioPlayerFactory audioPlayerFactory,
                                                   CallRegistryPort callRegistry,
                                                   AsyncExecutor asyncExecutor,
                                                   CallPolicy callPolicy,
                                                   MetricsPort metricsPort) {
        return new IncomingCallUseCase(
                userAgentFactory,
                mediaSessionFactory,
                audioPlayerFactory,
                callRegistry,
                asyncExecutor,
                callPolicy,
                metricsPort
        );
    }

    @Bean
    public SipRequestRouter sipRequestRouter(IncomingCallUseCase incomingCallUseCase) {
        return new SipRequestRouter(incomingCallUseCase);
    }

    @Bean
    public ActiveCallUseCase activeCallUseCase(CallRegistryPort callRegistry) {
        return new ActiveCallUseCase(callRegistry);
    }
}
