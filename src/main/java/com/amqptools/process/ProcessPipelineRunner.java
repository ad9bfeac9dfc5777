package com.amqptools.process;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;

/**
 * Starts consumer commands with {@link ProcessBuilder}. Standard output and error
 * pass straight through to this process's own, so interactive and streaming
 * commands behave as they would on a terminal.
 */
public class ProcessPipelineRunner implements PipelineRunner {
    private static final Logger logger = LoggerFactory.getLogger(ProcessPipelineRunner.class);

    @Override
    public Pipeline start(List<String> command) {
        if (command.isEmpty()) {
            throw new IllegalArgumentException("Consumer command is empty");
        }
        ProcessBuilder builder = new ProcessBuilder(command)
            .redirectInput(ProcessBuilder.Redirect.PIPE)
            .redirectOutput(ProcessBuilder.Redirect.INHERIT)
            .redirectError(ProcessBuilder.Redirect.INHERIT);
        try {
            Process process = builder.start();
            logger.debug("Started {} (pid {})", command, process.pid());
            return ProcessPipeline.started(command, process);
        } catch (IOException e) {
            logger.warn("Failed to start consumer command {}: {}", command, e.getMessage());
            return ProcessPipeline.failed(command);
        }
    }
}
