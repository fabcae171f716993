package com.whereq.indexnode.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TaskKeyTest {

    @Test
    void comparesByValue() {
        assertThat(TaskKey.of("C1", 100)).isEqualTo(new TaskKey("C1", 100));
        assertThat(TaskKey.of("C1", 100)).hasSameHashCodeAs(new TaskKey("C1", 100));
        assertThat(TaskKey.of("C1", 100)).isNotEqualTo(TaskKey.of("C2", 100));
        assertThat(TaskKey.of("C1", 100)).isNotEqualTo(TaskKey.of("C1", 101));
    }

    @Test
    void rendersBothFields() {
        assertThat(TaskKey.of("C1", 100).toString()).contains("clusterId=C1", "taskId=100");
    }

    @Test
    void requiresClusterId() {
        assertThatThrownBy(() -> TaskKey.of(null, 1)).isInstanceOf(NullPointerException.class);
    }
}
