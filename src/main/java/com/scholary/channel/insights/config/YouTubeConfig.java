package com.scholary.channel.insights.config;

import com.scholary.channel.insights.youtube.YouTubeProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the YouTube client.
 *
 * <p>Enables the YouTubeProperties to be loaded from application.yml.
 */
@Configuration
@EnableConfigurationProperties(YouTubeProperties.class)
public class YouTubeConfig {}
