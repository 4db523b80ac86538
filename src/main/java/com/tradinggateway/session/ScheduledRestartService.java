package com.tradinggateway.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Periodic gateway session restart.
 *
 * <p>The gateway leaks resources over long runtimes, so the deployment restarts it on a
 * schedule. This service cycles the API session at the configured cron so the core
 * reconnects cleanly (new client identity, empty qualification set) instead of treating
 * the restart as a failure. Disabled by default ({@code gateway.restart.cron=-}).
 */
@Service
public class ScheduledRestartService {

    private static final Logger log = LoggerFactory.getLogger(ScheduledRestartService.class);

    private final SessionManager sessionManager;

    public ScheduledRestartService(SessionManager sessionManager) {
        this.sessionManager = sessionManager;
    }

    @Scheduled(cron = "${gateway.restart.cron:-}", zone = "${gateway.market.zone:America/New_York}")
    public void scheduledRestart() {
        restart("scheduled restart");
    }

    /**
     * Testable version. Skips the restart when no session is up, since a connect cycle
     * (or safe-mode recovery) already owns reconnection.
     *
     * @return the session state after the restart, or the unchanged state when skipped
     */
    public SessionState restart(String reason) {
        SessionState state = sessionManager.currentState();
        if (state != SessionState.READY) {
            log.info("Skipping {}: session is {}", reason, state);
            return state;
        }
        SessionState after = sessionManager.restart(reason);
        if (after != SessionState.READY) {
            log.warn("Gateway session not READY after {} (state={})", reason, after);
        }
        return after;
    }
}
