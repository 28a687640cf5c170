package org.neuralchilli.lazyagent.domain;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class CycleDetectedExceptionTest {

    @Test
    void shouldNameTasksOnCycle() {
        CycleDetectedException exception = new CycleDetectedException(List.of("a", "b"));

        assertThat(exception).isInstanceOf(ValidationException.class);
        assertThat(exception.getMessage()).isEqualTo("Circular dependency detected among tasks: [a, b]");
        assertThat(exception.cycleTasks()).containsExactly("a", "b");
    }

    @Test
    void shouldCopyCycleTasks() {
        List<String> members = new ArrayList<>(List.of("a"));
        CycleDetectedException exception = new CycleDetectedException(members);

        members.add("b");

        assertThat(exception.cycleTasks()).containsExactly("a");
    }

    @Test
    void shouldCreateWithPlainMessage() {
        CycleDetectedException exception = new CycleDetectedException("Cycle detected");

        assertThat(exception.getMessage()).isEqualTo("Cycle detected");
        assertThat(exception.cycleTasks()).isEmpty();
        assertThat(exception.getCause()).isNull();
    }

    @Test
    void shouldBeUncheckedValidationFailure() {
        assertThatThrownBy(() -> {
            throw new CycleDetectedException(List.of("x"));
        })
                .isInstanceOf(ValidationException.class)
                .isInstanceOf(RuntimeException.class)
                .hasMessageContaining("[x]");
    }
}
