package com.delta.taskmonitor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class TaskMonitorApplication {

  public static void main(String[] args) {
    SpringApplication.run(TaskMonitorApplication.class, args);
  }
}
