package com.amqptools.process;

import java.util.List;

@FunctionalInterface
public interface PipelineRunner {

    /**
     * Start {@code command}. Never fails: a command that cannot be started yields a
     * pipeline that discards its input and reports failure.
     */
    Pipeline start(List<String> command);
}
