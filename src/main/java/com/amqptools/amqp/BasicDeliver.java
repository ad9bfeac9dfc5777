package com.amqptools.amqp;

import io.netty.buffer.ByteBuf;

/**
 * Decoded arguments of a Basic.Deliver method: one message pushed to the consumer.
 * The message's content header and body frames follow it on the same channel.
 */
public final class BasicDeliver {
    private final String consumerTag;
    private final long deliveryTag;
    private final boolean redelivered;
    private final String exchange;
    private final String routingKey;

    public BasicDeliver(String consumerTag, long deliveryTag, boolean redelivered,
                        String exchange, String routingKey) {
        this.consumerTag = consumerTag;
        this.deliveryTag = deliveryTag;
        this.redelivered = redelivered;
        this.exchange = exchange;
        this.routingKey = routingKey;
    }

    public static BasicDeliver decode(AmqpFrame frame) {
        if (!frame.isMethod(AmqpConstants.CLASS_BASIC, AmqpConstants.METHOD_BASIC_DELIVER)) {
            throw new IllegalArgumentException("Not a Basic.Deliver frame: " + frame);
        }
        ByteBuf args = frame.methodArguments();
        String consumerTag = AmqpCodec.decodeShortString(args);
        long deliveryTag = args.readLong();
        boolean redelivered = AmqpCodec.decodeBoolean(args);
        String exchange = AmqpCodec.decodeShortString(args);
        String routingKey = AmqpCodec.decodeShortString(args);
        return new BasicDeliver(consumerTag, deliveryTag, redelivered, exchange, routingKey);
    }

    public String getConsumerTag() {
        return consumerTag;
    }

    /**
     * The delivery tag, an unsigned 64-bit value carried in a signed long.
     */
    public long getDeliveryTag() {
        return deliveryTag;
    }

    public boolean isRedelivered() {
        return redelivered;
    }

    public String getExchange() {
        return exchange;
    }

    public String getRoutingKey() {
        return routingKey;
    }

    @Override
    public String toString() {
        return "BasicDeliver{deliveryTag=" + Long.toUnsignedString(deliveryTag) +
               ", consumerTag='" + consumerTag + '\'' +
               ", redelivered=" + redelivered +
               ", exchange='" + exchange + '\'' +
               ", routingKey='" + routingKey + '\'' + '}';
    }
}
