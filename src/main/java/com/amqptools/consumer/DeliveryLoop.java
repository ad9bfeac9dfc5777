package com.amqptools.consumer;

import com.amqptools.amqp.AmqpConstants;
import com.amqptools.amqp.AmqpFrame;
import com.amqptools.amqp.BasicDeliver;
import com.amqptools.connection.BrokerSession;
import com.amqptools.process.Pipeline;
import com.amqptools.process.PipelineRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Consumes messages from one queue, piping each body to a fresh run of the
 * consumer command and acknowledging the message only when the command succeeds.
 *
 * <p>Deliveries are handled strictly one at a time on the calling thread. With a
 * count limit in the prefetch range the broker is told never to have more than
 * that many messages outstanding, so nothing is delivered that the loop will not
 * process.
 */
public class DeliveryLoop {
    private static final Logger logger = LoggerFactory.getLogger(DeliveryLoop.class);

    public enum State {
        IDLE,
        SUBSCRIBED,
        WAITING_FRAME,
        PROCESSING_DELIVERY,
        DONE
    }

    /**
     * What the loop does with a frame received while waiting for a delivery.
     */
    public enum FrameDisposition {
        SKIP,
        DELIVER
    }

    private static final Map<State, Set<State>> TRANSITIONS = new EnumMap<>(State.class);

    static {
        TRANSITIONS.put(State.IDLE, EnumSet.of(State.SUBSCRIBED));
        TRANSITIONS.put(State.SUBSCRIBED, EnumSet.of(State.WAITING_FRAME, State.DONE));
        // WAITING_FRAME -> WAITING_FRAME is the skip of a frame that is not a delivery
        TRANSITIONS.put(State.WAITING_FRAME, EnumSet.of(State.WAITING_FRAME, State.PROCESSING_DELIVERY));
        TRANSITIONS.put(State.PROCESSING_DELIVERY, EnumSet.of(State.WAITING_FRAME, State.DONE));
        TRANSITIONS.put(State.DONE, EnumSet.noneOf(State.class));
    }

    private final BrokerSession session;
    private final PipelineRunner runner;
    private final List<String> command;
    private final boolean noAck;
    private final int limit;

    private State state = State.IDLE;
    private String consumerTag;
    private int consumedCount;
    private int acknowledgedCount;
    private int failedCount;
    private long skippedFrames;

    /**
     * @param limit number of messages to consume before stopping; negative for no limit
     */
    public DeliveryLoop(BrokerSession session, PipelineRunner runner, List<String> command,
                        boolean noAck, int limit) {
        if (command.isEmpty()) {
            throw new IllegalArgumentException("consuming command not specified");
        }
        this.session = session;
        this.runner = runner;
        this.command = Collections.unmodifiableList(new ArrayList<>(command));
        this.noAck = noAck;
        this.limit = limit;
    }

    /**
     * Whether a count limit is also applied as the channel's prefetch count.
     * Basic.Qos carries the count as an unsigned short, so limits outside
     * 1..65535 leave prefetch unbounded.
     */
    public static boolean appliesPrefetch(int limit) {
        return limit >= AmqpConstants.MIN_PREFETCH_COUNT && limit <= AmqpConstants.MAX_PREFETCH_COUNT;
    }

    public static FrameDisposition classify(AmqpFrame frame) {
        if (frame.isMethod(AmqpConstants.CLASS_BASIC, AmqpConstants.METHOD_BASIC_DELIVER)) {
            return FrameDisposition.DELIVER;
        }
        return FrameDisposition.SKIP;
    }

    /**
     * Subscribe to {@code queue} and process deliveries until the limit is reached.
     * Returns normally only when the limit is reached; an unbounded loop ends with
     * an exception when the connection fails.
     *
     * @return number of deliveries processed
     * @throws IOException if a broker operation fails
     */
    public int run(ResolvedQueue queue) throws IOException {
        if (state != State.IDLE) {
            throw new IllegalStateException("Delivery loop already started (state " + state + ")");
        }

        if (appliesPrefetch(limit)) {
            session.basicQos(limit);
            logger.debug("Prefetch limited to {}", limit);
        }

        consumerTag = session.basicConsume(queue.getBytes(), noAck);
        transition(State.SUBSCRIBED);
        logger.info("Consuming from queue {} as {} (noAck={}, limit={})",
            queue, consumerTag, noAck, limit < 0 ? "none" : limit);

        while (!limitReached()) {
            transition(State.WAITING_FRAME);
            BasicDeliver deliver = awaitDelivery();
            transition(State.PROCESSING_DELIVERY);
            processDelivery(deliver);
        }

        transition(State.DONE);
        logger.info("Consumed {} messages ({} acknowledged, {} failed)", consumedCount, acknowledgedCount, failedCount);
        return consumedCount;
    }

    private boolean limitReached() {
        return limit >= 0 && consumedCount >= limit;
    }

    private BasicDeliver awaitDelivery() throws IOException {
        while (true) {
            AmqpFrame frame = session.waitFrame();
            if (classify(frame) == FrameDisposition.DELIVER) {
                return BasicDeliver.decode(frame);
            }
            skippedFrames++;
            logger.trace("Skipping {}", frame);
            session.releaseBuffers();
            transition(State.WAITING_FRAME);
        }
    }

    private void processDelivery(BasicDeliver deliver) throws IOException {
        long deliveryTag = deliver.getDeliveryTag();
        logger.debug("Delivery {} from exchange '{}' with routing key '{}'{}",
            Long.toUnsignedString(deliveryTag), deliver.getExchange(), deliver.getRoutingKey(),
            deliver.isRedelivered() ? " (redelivered)" : "");

        boolean succeeded;
        long bodySize;
        try (Pipeline pipeline = runner.start(command)) {
            bodySize = session.copyBody(pipeline.getInput());
            succeeded = pipeline.finish();
        }

        if (succeeded) {
            if (!noAck) {
                session.basicAck(deliveryTag);
                acknowledgedCount++;
            }
            logger.debug("Delivery {} ({} bytes) processed", Long.toUnsignedString(deliveryTag), bodySize);
        } else {
            failedCount++;
            logger.warn("Consumer command failed for delivery {} ({} bytes); {}",
                Long.toUnsignedString(deliveryTag), bodySize,
                noAck ? "message was auto-acknowledged" : "leaving it unacknowledged");
        }

        session.releaseBuffers();
        consumedCount++;
    }

    private void transition(State next) {
        if (!TRANSITIONS.get(state).contains(next)) {
            throw new IllegalStateException("Illegal transition " + state + " -> " + next);
        }
        logger.trace("{} -> {}", state, next);
        state = next;
    }

    public static Set<State> allowedTransitions(State from) {
        return Collections.unmodifiableSet(TRANSITIONS.get(from));
    }

    public State getState() {
        return state;
    }

    public String getConsumerTag() {
        return consumerTag;
    }

    public int getConsumedCount() {
        return consumedCount;
    }

    public int getAcknowledgedCount() {
        return acknowledgedCount;
    }

    public int getFailedCount() {
        return failedCount;
    }

    public long getSkippedFrames() {
        return skippedFrames;
    }
}
