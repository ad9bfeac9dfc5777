package com.amqptools.process;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;

/**
 * Standard input of a consumer command. A command may exit or close its input
 * before the whole message is written; the first write error is recorded and
 * later bytes are discarded. Whether the delivery succeeded is left to the exit
 * status. The message body still has to be read off the connection in full, so
 * writes never throw.
 */
class PipelineInput extends OutputStream {
    private static final Logger logger = LoggerFactory.getLogger(PipelineInput.class);

    private final OutputStream target;
    private IOException failure;
    private boolean closed;
    private long bytesWritten;

    PipelineInput(OutputStream target) {
        this.target = target;
    }

    @Override
    public void write(int b) {
        if (failure != null || closed) {
            return;
        }
        try {
            target.write(b);
            bytesWritten++;
        } catch (IOException e) {
            recordFailure(e);
        }
    }

    @Override
    public void write(byte[] b, int off, int len) {
        if (failure != null || closed) {
            return;
        }
        try {
            target.write(b, off, len);
            bytesWritten += len;
        } catch (IOException e) {
            recordFailure(e);
        }
    }

    @Override
    public void flush() {
        if (failure != null || closed) {
            return;
        }
        try {
            target.flush();
        } catch (IOException e) {
            recordFailure(e);
        }
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            target.close();
        } catch (IOException e) {
            if (failure == null) {
                recordFailure(e);
            } else {
                failure.addSuppressed(e);
            }
        }
    }

    boolean hasFailed() {
        return failure != null;
    }

    IOException getFailure() {
        return failure;
    }

    long getBytesWritten() {
        return bytesWritten;
    }

    private void recordFailure(IOException e) {
        failure = e;
        logger.warn("Consumer command stopped reading its input after {} bytes: {}", bytesWritten, e.getMessage());
    }
}
