package com.thorbis.accessservice.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.thorbis.security.session.SessionManager;
import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.config.YamlPropertiesFactoryBean;
import org.springframework.core.io.ClassPathResource;

@DisplayName("SessionSweepScheduler")
class SessionSweepSchedulerTest {

    private static final String SWEEP_INTERVAL = "thorbis.access.session.sweep-interval";

    private static String sweepInterval(String file) {
        var yaml = new YamlPropertiesFactoryBean();
        yaml.setResources(new ClassPathResource(file));
        return yaml.getObject().getProperty(SWEEP_INTERVAL);
    }

    @Test
    @DisplayName("the packaged sweep interval is an ISO-8601 duration @Scheduled can parse")
    void productionIntervalIsIso() {
        assertThat(Duration.parse(sweepInterval("application.yml"))).isEqualTo(Duration.ofMinutes(1));
    }

    @Test
    @DisplayName("the test profile sweep interval is an ISO-8601 duration as well")
    void testIntervalIsIso() {
        assertThat(Duration.parse(sweepInterval("application-test.yml"))).isEqualTo(Duration.ofHours(1));
    }

    @Test
    @DisplayName("delegates to the session manager")
    void sweeps() {
        SessionManager sessions = mock(SessionManager.class);
        when(sessions.sweepExpired()).thenReturn(2);

        new SessionSweepScheduler(sessions).sweep();

        verify(sessions).sweepExpired();
    }
}
