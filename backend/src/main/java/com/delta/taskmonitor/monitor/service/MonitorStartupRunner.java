package com.delta.taskmonitor.monitor.service;

import com.delta.taskmonitor.monitor.persistence.TaskJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(0)
public class MonitorStartupRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(MonitorStartupRunner.class);

    private final TaskJdbcRepository repository;

    public MonitorStartupRunner(TaskJdbcRepository repository) {
        this.repository = repository;
    }

    @Override
    public void run(ApplicationArguments args) {
        try {
            if (!repository.isDbReachable()) {
                log.warn("Task database did not answer the connectivity check");
                return;
            }
            log.info("Task database reachable, {} active tasks to monitor", repository.countActiveJobs());
        } catch (Exception e) {
            log.warn("Task database is unreachable at startup, monitoring checks will keep retrying", e);
        }
    }
}
