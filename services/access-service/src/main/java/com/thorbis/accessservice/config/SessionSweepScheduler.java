package com.thorbis.accessservice.config;

import com.thorbis.security.session.SessionManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Periodically ends sessions past their idle or absolute timeout. */
@Component
public class SessionSweepScheduler {

    private static final Logger log = LoggerFactory.getLogger(SessionSweepScheduler.class);

    private final SessionManager sessions;

    public SessionSweepScheduler(SessionManager sessions) {
        this.sessions = sessions;
    }

    @Scheduled(
            fixedDelayString = "${thorbis.access.session.sweep-interval:PT1M}",
            initialDelayString = "${thorbis.access.session.sweep-interval:PT1M}")
    public void sweep() {
        int ended = sessions.sweepExpired();
        if (ended > 0) {
            log.info("Session sweep ended {} sessions", ended);
        }
    }
}
