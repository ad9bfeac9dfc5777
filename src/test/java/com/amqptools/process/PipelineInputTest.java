package com.amqptools.process;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Pipeline Input Tests")
class PipelineInputTest {

    /**
     * Accepts {@code capacity} bytes, then fails every call like a closed pipe.
     */
    private static class BrokenPipe extends OutputStream {
        private final ByteArrayOutputStream accepted = new ByteArrayOutputStream();
        private final int capacity;
        private int writeCalls;

        BrokenPipe(int capacity) {
            this.capacity = capacity;
        }

        @Override
        public void write(int b) throws IOException {
            write(new byte[]{(byte) b}, 0, 1);
        }

        @Override
        public void write(byte[] b, int off, int len) throws IOException {
            writeCalls++;
            if (accepted.size() + len > capacity) {
                throw new IOException("Broken pipe");
            }
            accepted.write(b, off, len);
        }

        @Override
        public void close() throws IOException {
            throw new IOException("Broken pipe");
        }
    }

    @Test
    @DisplayName("Should pass bytes through while the target accepts them")
    void testPassThrough() {
        ByteArrayOutputStream target = new ByteArrayOutputStream();
        PipelineInput input = new PipelineInput(target);

        input.write('a');
        input.write(new byte[]{'b', 'c'}, 0, 2);
        input.close();

        assertThat(target.toByteArray()).containsExactly('a', 'b', 'c');
        assertThat(input.getBytesWritten()).isEqualTo(3);
        assertThat(input.hasFailed()).isFalse();
    }

    @Test
    @DisplayName("Should record the first failure and discard later writes")
    void testFailureDiscardsLaterWrites() {
        BrokenPipe target = new BrokenPipe(4);
        PipelineInput input = new PipelineInput(target);

        input.write(new byte[]{1, 2, 3}, 0, 3);
        input.write(new byte[]{4, 5, 6}, 0, 3);
        input.write(new byte[]{7}, 0, 1);

        assertThat(input.hasFailed()).isTrue();
        assertThat(input.getFailure()).hasMessage("Broken pipe");
        assertThat(input.getBytesWritten()).isEqualTo(3);
        assertThat(target.writeCalls).isEqualTo(2);
    }

    @Test
    @DisplayName("Should attach a close failure to the first write failure")
    void testCloseFailureSuppressed() {
        PipelineInput input = new PipelineInput(new BrokenPipe(0));

        input.write(1);
        input.close();
        input.close();

        assertThat(input.getFailure().getSuppressed()).hasSize(1);
    }

    @Test
    @DisplayName("Should ignore writes after close")
    void testWriteAfterClose() {
        ByteArrayOutputStream target = new ByteArrayOutputStream();
        PipelineInput input = new PipelineInput(target);

        input.close();
        input.write(new byte[]{1}, 0, 1);

        assertThat(target.size()).isZero();
        assertThat(input.hasFailed()).isFalse();
    }
}
