package com.whereq.indexnode.registry;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.springframework.stereotype.Component;

/**
 * Exposes the size of the {@link TaskRegistry} as gauges.
 */
@Component
public class TaskRegistryMetrics implements MeterBinder {

    private final TaskRegistry taskRegistry;

    public TaskRegistryMetrics(TaskRegistry taskRegistry) {
        this.taskRegistry = taskRegistry;
    }

    @Override
    public void bindTo(MeterRegistry meterRegistry) {
        Gauge.builder("indexnode.tasks.index", taskRegistry, TaskRegistry::indexTaskCount)
            .description("Number of index-build tasks tracked by the node")
            .register(meterRegistry);

        Gauge.builder("indexnode.tasks.analysis", taskRegistry, TaskRegistry::analysisTaskCount)
            .description("Number of analysis tasks tracked by the node")
            .register(meterRegistry);

        Gauge.builder("indexnode.tasks.in_progress", taskRegistry, TaskRegistry::inProgressTaskCount)
            .description("Number of tasks of either kind currently in progress")
            .register(meterRegistry);
    }
}
