package com.delta.taskmonitor;

import com.delta.taskmonitor.config.MonitorProperties;
import com.delta.taskmonitor.monitor.mail.AlertNotifier;
import com.delta.taskmonitor.monitor.mail.MailAlertNotifier;
import com.delta.taskmonitor.monitor.service.TaskMonitorService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = "monitor.stuck-waiting-tolerance=1w")
@ActiveProfiles("test")
class TaskMonitorApplicationTest {

    @Autowired
    private TaskMonitorService monitorService;

    @Autowired
    private AlertNotifier alertNotifier;

    @Autowired
    private MonitorProperties properties;

    @Test
    void contextWiresMonitorWithoutStartingTheTicker() {
        assertThat(monitorService.getStatus().running()).isFalse();
        assertThat(alertNotifier).isInstanceOf(MailAlertNotifier.class);
        assertThat(properties.getTickInterval()).isEqualTo(Duration.ofMinutes(5));
        assertThat(properties.getCooldown()).isEqualTo(Duration.ofMinutes(60));
    }

    @Test
    void durationPropertiesAcceptWeekUnits() {
        assertThat(properties.getStuckWaitingTolerance()).isEqualTo(Duration.ofDays(7));
    }
}
