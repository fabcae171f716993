package com.whereq.indexnode.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Enables binding of the {@code indexnode.*} properties.
 */
@Configuration
@EnableConfigurationProperties(IndexNodeProperties.class)
public class IndexNodeConfig {
}
