package com.amqptools.consumer;

import com.amqptools.connection.AmqpRpcException;
import com.amqptools.connection.BrokerSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Makes sure the queue to consume from exists, declaring and binding it when asked.
 */
public class QueueResolver {
    private static final Logger logger = LoggerFactory.getLogger(QueueResolver.class);

    // Queue, exchange and routing key all travel as AMQP short strings
    static final int MAX_NAME_BYTES = 255;

    private final BrokerSession session;

    public QueueResolver(BrokerSession session) {
        this.session = session;
    }

    /**
     * Reject option combinations that cannot be honoured. Runs before any broker call.
     *
     * @throws IllegalArgumentException if a routing key is given without an exchange,
     *                                  or a name does not fit in a short string
     */
    public static void validate(QueueSpec spec) {
        if (spec.getExchangeName() == null && spec.getRoutingKey() != null) {
            throw new IllegalArgumentException(
                "--routing-key option requires an exchange name to be provided with --exchange");
        }
        checkLength("queue name", spec.getName());
        checkLength("exchange name", spec.getExchangeName());
        checkLength("routing key", spec.getRoutingKey());
    }

    private static void checkLength(String what, String value) {
        if (value == null) {
            return;
        }
        int length = value.getBytes(StandardCharsets.UTF_8).length;
        if (length > MAX_NAME_BYTES) {
            throw new IllegalArgumentException(
                what + " is " + length + " bytes long, at most " + MAX_NAME_BYTES + " are allowed");
        }
    }

    /**
     * Declare the queue when no name was given, when an exchange was given or when
     * declaration was requested, then bind it to the exchange if there is one. A named
     * queue with neither is assumed to exist and no broker call is made.
     */
    public ResolvedQueue resolve(QueueSpec spec) throws AmqpRpcException {
        validate(spec);

        ResolvedQueue queue = ResolvedQueue.of(spec.getName());
        if (spec.getName() != null && spec.getExchangeName() == null && !spec.isDeclare()) {
            logger.debug("Using existing queue {}", queue);
            return queue;
        }

        // Non-durable, exclusive to this connection, deleted when the consumer goes away
        byte[] declared = session.declareQueue(queue.getBytes(), false, true, true);
        if (spec.getName() == null) {
            queue = new ResolvedQueue(declared);
            logger.info("Server provided queue name: {}", queue.toDisplayString());
        } else if (!Arrays.equals(declared, queue.getBytes())) {
            logger.debug("Server echoed queue name {} for {}", new ResolvedQueue(declared), queue);
        }

        if (spec.getExchangeName() != null) {
            String routingKey = spec.getRoutingKey() == null ? "" : spec.getRoutingKey();
            session.bindQueue(queue.getBytes(), spec.getExchangeName(), routingKey);
            logger.debug("Bound queue {} to exchange {} with routing key '{}'",
                queue, spec.getExchangeName(), routingKey);
        }

        return queue;
    }
}
