package com.amqptools.connection;

import com.amqptools.amqp.AmqpFrame;

import java.io.IOException;
import java.io.OutputStream;

/**
 * An opened, authenticated connection with one channel, passed explicitly to the
 * queue resolver and the delivery loop. Every call is synchronous and made from
 * a single thread.
 */
public interface BrokerSession extends AutoCloseable {

    /**
     * Queue.Declare. An empty name asks the server to assign one.
     *
     * @return the queue name from Declare-Ok
     */
    byte[] declareQueue(byte[] queue, boolean durable, boolean exclusive, boolean autoDelete)
        throws AmqpRpcException;

    void bindQueue(byte[] queue, String exchange, String routingKey) throws AmqpRpcException;

    void basicQos(int prefetchCount) throws AmqpRpcException;

    /**
     * Basic.Consume with a server-generated consumer tag.
     *
     * @return the consumer tag from Consume-Ok
     */
    String basicConsume(byte[] queue, boolean noAck) throws AmqpRpcException;

    /**
     * Block until the next frame arrives. The frame stays valid until
     * {@link #releaseBuffers()} is called.
     */
    AmqpFrame waitFrame() throws AmqpRpcException;

    /**
     * Read the content header and body frames that follow a delivery and write the
     * body to {@code sink}. Exactly the number of bytes announced in the header is
     * consumed from the connection.
     *
     * @return the body length
     * @throws AmqpRpcException if the connection fails or sends unexpected frames
     * @throws IOException if the sink cannot be written
     */
    long copyBody(OutputStream sink) throws IOException;

    void basicAck(long deliveryTag) throws AmqpRpcException;

    /**
     * Release every frame handed out since the last call.
     */
    void releaseBuffers();

    @Override
    void close() throws AmqpRpcException;
}
