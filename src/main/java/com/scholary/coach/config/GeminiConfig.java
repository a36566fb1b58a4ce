package com.scholary.coach.config;

import com.scholary.coach.gemini.GeminiProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the Gemini client.
 *
 * <p>Enables the GeminiProperties to be loaded from application.yml.
 */
@Configuration
@EnableConfigurationProperties(GeminiProperties.class)
public class GeminiConfig {}
