package com.architecture.memory.mergeflow.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Enables the periodic merge queue sweep and asynchronous event listeners.
 */
@Configuration
@EnableAsync
@EnableScheduling
public class SchedulingConfig {
}
