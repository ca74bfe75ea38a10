package com.delta.taskmonitor.monitor.service;

import com.delta.taskmonitor.config.MonitorProperties;
import com.delta.taskmonitor.monitor.model.MonitorTickSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Runs a single monitoring check at startup when {@code monitor.cli.run-once} is set.
 */
@Component
@Order(1)
public class MonitorCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(MonitorCliRunner.class);

    private final MonitorProperties properties;
    private final TaskMonitorService monitorService;
    private final ConfigurableApplicationContext applicationContext;

    public MonitorCliRunner(
        MonitorProperties properties,
        TaskMonitorService monitorService,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.monitorService = monitorService;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getCli().isRunOnce()) {
            return;
        }

        MonitorTickSummary summary = monitorService.runTick();
        log.info(
            "One-off monitoring check finished in {} ms: jobs={}, sent={}, suppressed={}, failures={}",
            summary.finishedAt().toEpochMilli() - summary.startedAt().toEpochMilli(),
            summary.jobsChecked(),
            summary.alertsSent(),
            summary.alertsSuppressed(),
            summary.deliveryFailures()
        );

        if (properties.getCli().isExitAfterRun()) {
            int exitCode = SpringApplication.exit(applicationContext, () -> summary.deliveryFailures() == 0 ? 0 : 1);
            System.exit(exitCode);
        }
    }
}
