package com.whereq.indexnode.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for the index node.
 *
 * @author WhereQ Inc.
 */
@ConfigurationProperties(prefix = "indexnode")
@Data
public class IndexNodeProperties {

    /**
     * Maximum time the node waits on shutdown for in-progress tasks to finish.
     * Tasks still running afterwards are logged and torn down with the node.
     */
    private Duration gracefulStopTimeout = Duration.ofSeconds(30);

    /**
     * How often the shutdown drain re-checks for in-progress tasks.
     */
    private Duration drainPollInterval = Duration.ofSeconds(1);
}
