package com.amqptools.process;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.OutputStream;
import java.util.List;

/**
 * A consumer command running as a child process. Standard output and error are
 * inherited from this process; only standard input is owned here.
 */
public class ProcessPipeline implements Pipeline {
    private static final Logger logger = LoggerFactory.getLogger(ProcessPipeline.class);

    private final List<String> command;
    private final Process process;
    private final PipelineInput input;
    private Boolean result;

    private ProcessPipeline(List<String> command, Process process, PipelineInput input) {
        this.command = command;
        this.process = process;
        this.input = input;
    }

    static ProcessPipeline started(List<String> command, Process process) {
        return new ProcessPipeline(command, process, new PipelineInput(process.getOutputStream()));
    }

    /**
     * A command that could not be started: input is discarded and the run fails.
     */
    static ProcessPipeline failed(List<String> command) {
        return new ProcessPipeline(command, null, new PipelineInput(OutputStream.nullOutputStream()));
    }

    @Override
    public OutputStream getInput() {
        return input;
    }

    @Override
    public boolean finish() {
        if (result != null) {
            return result;
        }
        input.close();
        if (process == null) {
            result = false;
            return false;
        }

        int status;
        try {
            status = process.waitFor();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while waiting for {}", command);
            process.destroyForcibly();
            result = false;
            return false;
        }

        logger.debug("Command {} (pid {}) exited with status {} after reading {} bytes",
            command, process.pid(), status, input.getBytesWritten());
        if (status == 0 && input.hasFailed()) {
            logger.debug("Command {} exited 0 without reading all of its input", command);
        }
        // Exit status alone decides the ack
        result = status == 0;
        return result;
    }

    @Override
    public void close() {
        input.close();
        if (process != null && process.isAlive() && result == null) {
            logger.warn("Killing unfinished command {} (pid {})", command, process.pid());
            process.destroyForcibly();
            try {
                process.waitFor();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    public boolean isStarted() {
        return process != null;
    }

    public List<String> getCommand() {
        return command;
    }
}
