package com.tradinggateway.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationListener;
import org.springframework.stereotype.Component;

/**
 * Starts the first gateway connect cycle once the application has fully started.
 *
 * <p>The cycle runs on the session supervisor thread, so startup is never blocked. If the
 * budget is exhausted the degradation coordinator enters safe mode and its recovery tick
 * keeps trying. Disabled with {@code gateway.auto-connect=false}.
 */
@Component
public class StartupConnectRunner implements ApplicationListener<ApplicationReadyEvent> {

    private static final Logger log = LoggerFactory.getLogger(StartupConnectRunner.class);

    private final SessionManager sessionManager;
    private final boolean autoConnect;

    public StartupConnectRunner(
            SessionManager sessionManager, @Value("${gateway.auto-connect:true}") boolean autoConnect) {
        this.sessionManager = sessionManager;
        this.autoConnect = autoConnect;
    }

    @Override
    public void onApplicationEvent(ApplicationReadyEvent event) {
        if (!autoConnect) {
            log.info("Startup: gateway auto-connect disabled, waiting for POST /api/gateway/connect");
            return;
        }
        log.info("Startup: connecting to gateway...");
        sessionManager.connectAsync().whenComplete((state, error) -> {
            if (error != null) {
                log.error("Startup gateway connect failed: {}", error.getMessage(), error);
            } else if (state == SessionState.READY) {
                log.info("Startup: gateway session READY");
            } else {
                log.error("Startup: gateway connect cycle ended in {}. Safe mode governs recovery.", state);
            }
        });
    }
}
