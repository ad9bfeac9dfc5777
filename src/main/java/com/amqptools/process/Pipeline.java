package com.amqptools.process;

import java.io.OutputStream;

/**
 * One run of the consumer command for one message.
 */
public interface Pipeline extends AutoCloseable {

    /**
     * Sink connected to the command's standard input.
     */
    OutputStream getInput();

    /**
     * Close the input, wait for the command to terminate and report whether it
     * succeeded.
     *
     * @return true iff the command exited with status 0
     */
    boolean finish();

    /**
     * Release the process handle and input stream. Kills the command if
     * {@link #finish()} was never reached.
     */
    @Override
    void close();
}
