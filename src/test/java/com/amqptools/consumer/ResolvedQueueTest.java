package com.amqptools.consumer;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Resolved Queue Tests")
class ResolvedQueueTest {

    @Test
    @DisplayName("Should print plain names unchanged")
    void testPlainName() {
        assertThat(ResolvedQueue.of("amq.gen-JzTY20BRgKO").toDisplayString()).isEqualTo("amq.gen-JzTY20BRgKO");
    }

    @Test
    @DisplayName("Should escape control bytes and DEL as octal")
    void testEscapeControlBytes() {
        byte[] name = {'a', 0, 'b', '\n', 127, 31};

        assertThat(ResolvedQueue.escape(name)).isEqualTo("a\\000b\\012\\177\\037");
    }

    @Test
    @DisplayName("Should keep multi-byte UTF-8 names readable")
    void testUtf8Name() {
        ResolvedQueue queue = ResolvedQueue.of("tâches");

        assertThat(queue.toDisplayString()).isEqualTo("tâches");
        assertThat(queue.getBytes()).isEqualTo("tâches".getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("Should treat a missing name as empty")
    void testNullName() {
        assertThat(ResolvedQueue.of(null).isEmpty()).isTrue();
    }

    @Test
    @DisplayName("Should not be changed through its byte arrays")
    void testDefensiveCopies() {
        byte[] source = "work".getBytes(StandardCharsets.UTF_8);
        ResolvedQueue queue = new ResolvedQueue(source);

        source[0] = 'X';
        queue.getBytes()[1] = 'X';

        assertThat(queue.toDisplayString()).isEqualTo("work");
        assertThat(queue).isEqualTo(ResolvedQueue.of("work"));
        assertThat(queue).hasSameHashCodeAs(ResolvedQueue.of("work"));
    }
}
