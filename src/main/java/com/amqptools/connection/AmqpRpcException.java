package com.amqptools.connection;

import java.io.IOException;

/**
 * A broker operation failed. The consume session cannot be trusted after one of
 * these, so callers propagate it to the top-level handler rather than retrying.
 */
public class AmqpRpcException extends IOException {
    private final String operation;
    private final int replyCode;
    private final String replyText;

    public AmqpRpcException(String operation, String message) {
        this(operation, message, null);
    }

    public AmqpRpcException(String operation, String message, Throwable cause) {
        super(operation + ": " + message, cause);
        this.operation = operation;
        this.replyCode = 0;
        this.replyText = null;
    }

    /**
     * The server closed the channel or the connection in response to an operation.
     */
    public AmqpRpcException(String operation, boolean connectionClosed, int replyCode, String replyText) {
        super(operation + ": server " + (connectionClosed ? "connection" : "channel") +
              " error " + replyCode + ", message: " + replyText);
        this.operation = operation;
        this.replyCode = replyCode;
        this.replyText = replyText;
    }

    public String getOperation() {
        return operation;
    }

    /**
     * The server's reply code, or 0 when the failure was local (I/O, protocol).
     */
    public int getReplyCode() {
        return replyCode;
    }

    public String getReplyText() {
        return replyText;
    }
}
