package com.library.circulation.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

@Configuration
@EnableScheduling
@ConditionalOnProperty(name = "library.circulation.overdue-sweep.enabled", havingValue = "true")
public class SchedulingConfig {
}
