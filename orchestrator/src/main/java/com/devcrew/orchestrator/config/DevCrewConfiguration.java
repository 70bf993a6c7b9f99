package com.devcrew.orchestrator.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(DevCrewProperties.class)
public class DevCrewConfiguration {
}
