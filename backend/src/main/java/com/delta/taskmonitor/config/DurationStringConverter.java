package com.delta.taskmonitor.config;

import com.delta.taskmonitor.monitor.util.TimeStrings;
import org.springframework.boot.context.properties.ConfigurationPropertiesBinding;
import org.springframework.core.convert.converter.Converter;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Binds {@code monitor.*} durations. Accepts everything Spring Boot does and adds week and
 * year units ({@code 2w}, {@code 1y}).
 */
@Component
@ConfigurationPropertiesBinding
public class DurationStringConverter implements Converter<String, Duration> {

    @Override
    public Duration convert(String source) {
        return TimeStrings.parseDuration(source);
    }
}
