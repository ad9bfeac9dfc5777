package com.amqptools.connection;

import com.amqptools.amqp.AmqpCodec;
import com.amqptools.amqp.AmqpConstants;
import com.amqptools.amqp.AmqpFrame;
import com.amqptools.amqp.ContentHeader;
import com.amqptools.config.ConsumeConfig;
import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.timeout.IdleStateEvent;
import io.netty.handler.timeout.IdleStateHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Client side of an AMQP 0-9-1 connection with a single channel.
 *
 * <p>The Netty event loop only decodes frames and hands them to a blocking queue;
 * every protocol decision is made on the thread that calls into this class, so
 * the consume loop reads the connection as one ordered stream of frames. Socket
 * reads pause while too many decoded frames wait to be taken, so a broker
 * without a prefetch limit cannot fill this process's memory.
 */
public class AmqpClientConnection implements BrokerSession {
    private static final Logger logger = LoggerFactory.getLogger(AmqpClientConnection.class);

    public static final String PRODUCT = "amqp-consume";
    public static final String VERSION = "1.0.0";
    public static final String LOCALE = "en_US";
    public static final String MECHANISM_PLAIN = "PLAIN";

    // Queued when the socket goes inactive; never handed to callers
    private static final AmqpFrame END_OF_STREAM = new AmqpFrame((byte) 0, (short) 0, Unpooled.EMPTY_BUFFER);

    private static final int SHUTDOWN_TIMEOUT_SECONDS = 2;

    // Socket reads pause once this many frames wait for the consume thread, and resume below the low mark
    static final int HIGH_WATER_FRAMES = 128;
    static final int LOW_WATER_FRAMES = 32;

    private final ConsumeConfig config;
    private final short channelNumber = AmqpConstants.CONSUME_CHANNEL;
    private final BlockingQueue<AmqpFrame> incoming = new LinkedBlockingQueue<>();
    private final List<AmqpFrame> heldFrames = new ArrayList<>();
    private final AmqpCodec.AmqpFrameDecoder frameDecoder = new AmqpCodec.AmqpFrameDecoder();

    private EventLoopGroup group;
    private Channel nettyChannel;
    private volatile Throwable failureCause;
    private ScheduledFuture<?> heartbeatSender;

    private boolean connectionOpen;
    private boolean channelOpen;

    // Negotiated in Connection.Tune
    private int channelMax;
    private int frameMax;
    private int heartbeatSeconds;

    AmqpClientConnection(ConsumeConfig config) {
        this.config = config;
    }

    /**
     * Connect, authenticate, open the virtual host and open the consume channel.
     */
    public static AmqpClientConnection open(ConsumeConfig config) throws AmqpRpcException {
        AmqpClientConnection connection = new AmqpClientConnection(config);
        try {
            connection.connect();
            connection.handshake();
            connection.openChannel();
        } catch (AmqpRpcException | RuntimeException e) {
            connection.shutdown();
            throw e;
        }
        return connection;
    }

    private void connect() throws AmqpRpcException {
        group = new NioEventLoopGroup(1);

        Bootstrap b = new Bootstrap();
        b.group(group)
         .channel(NioSocketChannel.class)
         .option(ChannelOption.TCP_NODELAY, true)
         .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, config.getConnectTimeoutMillis())
         .handler(new ChannelInitializer<SocketChannel>() {
             @Override
             public void initChannel(SocketChannel ch) {
                 ch.pipeline().addLast("frameDecoder", frameDecoder);
                 ch.pipeline().addLast("frameEncoder", new AmqpCodec.AmqpFrameEncoder());
                 ch.pipeline().addLast("frameHandoff", new FrameHandoffHandler());
             }
         });

        String address = config.getHost() + ":" + config.getPort();
        ChannelFuture f = b.connect(config.getHost(), config.getPort()).awaitUninterruptibly();
        if (!f.isSuccess()) {
            throw new AmqpRpcException("opening socket", "failed to connect to " + address, f.cause());
        }
        nettyChannel = f.channel();
        logger.debug("Connected to {}", address);
    }

    private void handshake() throws AmqpRpcException {
        ChannelFuture headerWrite = nettyChannel
            .writeAndFlush(Unpooled.wrappedBuffer(AmqpConstants.PROTOCOL_HEADER))
            .awaitUninterruptibly();
        if (!headerWrite.isSuccess()) {
            throw new AmqpRpcException("sending protocol header", "write failed", headerWrite.cause());
        }

        AmqpFrame start = awaitMethod("connection.start", (short) 0,
            AmqpConstants.CLASS_CONNECTION, AmqpConstants.METHOD_CONNECTION_START);
        try {
            ByteBuf args = start.methodArguments();
            int versionMajor = args.readUnsignedByte();
            int versionMinor = args.readUnsignedByte();
            AmqpCodec.skipTable(args);
            String mechanisms = AmqpCodec.decodeLongString(args);
            logger.debug("Connection.Start: version={}-{}, mechanisms={}", versionMajor, versionMinor, mechanisms);
            if (!Arrays.asList(mechanisms.split(" ")).contains(MECHANISM_PLAIN)) {
                throw new AmqpRpcException("connection.start",
                    "server does not offer " + MECHANISM_PLAIN + " authentication: " + mechanisms);
            }
        } finally {
            start.release();
        }

        ByteBuf startOk = Unpooled.buffer();
        AmqpCodec.encodeTable(startOk, clientProperties());
        AmqpCodec.encodeShortString(startOk, MECHANISM_PLAIN);
        AmqpCodec.encodeLongString(startOk, plainResponse(config.getUsername(), config.getPassword()));
        AmqpCodec.encodeShortString(startOk, LOCALE);
        sendMethod("connection.start-ok", (short) 0,
            AmqpConstants.CLASS_CONNECTION, AmqpConstants.METHOD_CONNECTION_START_OK, startOk);

        AmqpFrame tune = awaitMethod("connection.tune", (short) 0,
            AmqpConstants.CLASS_CONNECTION, AmqpConstants.METHOD_CONNECTION_TUNE);
        try {
            ByteBuf args = tune.methodArguments();
            int serverChannelMax = args.readUnsignedShort();
            int serverFrameMax = args.readInt();
            int serverHeartbeat = args.readUnsignedShort();
            channelMax = negotiate(AmqpConstants.DEFAULT_CHANNEL_MAX, serverChannelMax);
            frameMax = negotiate(Math.max(config.getFrameMax(), AmqpConstants.MIN_FRAME_MAX), serverFrameMax);
            heartbeatSeconds = config.getHeartbeatSeconds();
            logger.debug("Connection.Tune: server channelMax={}, frameMax={}, heartbeat={}; using {}, {}, {}",
                serverChannelMax, serverFrameMax, serverHeartbeat, channelMax, frameMax, heartbeatSeconds);
        } finally {
            tune.release();
        }
        frameDecoder.setMaxFrameSize(frameMax);

        ByteBuf tuneOk = Unpooled.buffer();
        tuneOk.writeShort(channelMax);
        tuneOk.writeInt(frameMax);
        tuneOk.writeShort(heartbeatSeconds);
        sendMethod("connection.tune-ok", (short) 0,
            AmqpConstants.CLASS_CONNECTION, AmqpConstants.METHOD_CONNECTION_TUNE_OK, tuneOk);
        startHeartbeat();

        ByteBuf open = Unpooled.buffer();
        AmqpCodec.encodeShortString(open, config.getVirtualHost());
        AmqpCodec.encodeShortString(open, ""); // capabilities (reserved)
        AmqpCodec.encodeBoolean(open, false); // insist (reserved)
        rpc("connection.open", (short) 0, AmqpConstants.CLASS_CONNECTION,
            AmqpConstants.METHOD_CONNECTION_OPEN, open, AmqpConstants.METHOD_CONNECTION_OPEN_OK).release();
        connectionOpen = true;

        logger.info("Connected to {}:{}, vhost {}", config.getHost(), config.getPort(), config.getVirtualHost());
    }

    private void openChannel() throws AmqpRpcException {
        ByteBuf open = Unpooled.buffer();
        AmqpCodec.encodeShortString(open, ""); // out-of-band (reserved)
        rpc("channel.open", channelNumber, AmqpConstants.CLASS_CHANNEL,
            AmqpConstants.METHOD_CHANNEL_OPEN, open, AmqpConstants.METHOD_CHANNEL_OPEN_OK).release();
        channelOpen = true;
        logger.debug("Opened channel {}", channelNumber);
    }

    @Override
    public byte[] declareQueue(byte[] queue, boolean durable, boolean exclusive, boolean autoDelete)
            throws AmqpRpcException {
        int flags = 0;
        if (durable) flags |= AmqpConstants.QUEUE_FLAG_DURABLE;
        if (exclusive) flags |= AmqpConstants.QUEUE_FLAG_EXCLUSIVE;
        if (autoDelete) flags |= AmqpConstants.QUEUE_FLAG_AUTO_DELETE;

        ByteBuf args = Unpooled.buffer();
        args.writeShort(0); // ticket (reserved)
        AmqpCodec.encodeShortString(args, queue);
        args.writeByte(flags);
        AmqpCodec.encodeTable(args, null);

        AmqpFrame declareOk = rpc("queue.declare", channelNumber, AmqpConstants.CLASS_QUEUE,
            AmqpConstants.METHOD_QUEUE_DECLARE, args, AmqpConstants.METHOD_QUEUE_DECLARE_OK);
        try {
            ByteBuf reply = declareOk.methodArguments();
            byte[] name = AmqpCodec.decodeShortStringBytes(reply);
            long messageCount = reply.readUnsignedInt();
            long consumerCount = reply.readUnsignedInt();
            logger.debug("Queue.Declare-Ok: messages={}, consumers={}", messageCount, consumerCount);
            return name;
        } finally {
            declareOk.release();
        }
    }

    @Override
    public void bindQueue(byte[] queue, String exchange, String routingKey) throws AmqpRpcException {
        ByteBuf args = Unpooled.buffer();
        args.writeShort(0); // ticket (reserved)
        AmqpCodec.encodeShortString(args, queue);
        AmqpCodec.encodeShortString(args, exchange);
        AmqpCodec.encodeShortString(args, routingKey);
        AmqpCodec.encodeBoolean(args, false); // no-wait
        AmqpCodec.encodeTable(args, null);

        rpc("queue.bind", channelNumber, AmqpConstants.CLASS_QUEUE,
            AmqpConstants.METHOD_QUEUE_BIND, args, AmqpConstants.METHOD_QUEUE_BIND_OK).release();
    }

    @Override
    public void basicQos(int prefetchCount) throws AmqpRpcException {
        ByteBuf args = Unpooled.buffer();
        args.writeInt(0); // prefetch-size, no byte limit
        args.writeShort(prefetchCount);
        AmqpCodec.encodeBoolean(args, false); // global

        rpc("basic.qos", channelNumber, AmqpConstants.CLASS_BASIC,
            AmqpConstants.METHOD_BASIC_QOS, args, AmqpConstants.METHOD_BASIC_QOS_OK).release();
    }

    @Override
    public String basicConsume(byte[] queue, boolean noAck) throws AmqpRpcException {
        int flags = noAck ? AmqpConstants.CONSUME_FLAG_NO_ACK : 0;

        ByteBuf args = Unpooled.buffer();
        args.writeShort(0); // ticket (reserved)
        AmqpCodec.encodeShortString(args, queue);
        AmqpCodec.encodeShortString(args, ""); // server generates the consumer tag
        args.writeByte(flags);
        AmqpCodec.encodeTable(args, null);

        AmqpFrame consumeOk = rpc("basic.consume", channelNumber, AmqpConstants.CLASS_BASIC,
            AmqpConstants.METHOD_BASIC_CONSUME, args, AmqpConstants.METHOD_BASIC_CONSUME_OK);
        try {
            return AmqpCodec.decodeShortString(consumeOk.methodArguments());
        } finally {
            consumeOk.release();
        }
    }

    @Override
    public AmqpFrame waitFrame() throws AmqpRpcException {
        AmqpFrame frame = nextFrame("waiting for frame");
        heldFrames.add(frame);
        return frame;
    }

    @Override
    public long copyBody(OutputStream sink) throws IOException {
        ContentHeader header;
        AmqpFrame headerFrame = nextContentFrame("reading content header");
        try {
            if (!headerFrame.isHeader()) {
                throw new AmqpRpcException("reading content header", "unexpected frame " + headerFrame);
            }
            header = ContentHeader.decode(headerFrame);
        } finally {
            headerFrame.release();
        }

        long remaining = header.getBodySize();
        while (remaining > 0) {
            AmqpFrame bodyFrame = nextContentFrame("reading content body");
            try {
                if (!bodyFrame.isBody()) {
                    throw new AmqpRpcException("reading content body", "unexpected frame " + bodyFrame
                        + " with " + remaining + " body bytes outstanding");
                }
                ByteBuf content = bodyFrame.getPayload();
                int length = content.readableBytes();
                if (length > remaining) {
                    throw new AmqpRpcException("reading content body",
                        "body frame of " + length + " bytes overruns the " + remaining + " bytes outstanding");
                }
                content.getBytes(content.readerIndex(), sink, length);
                remaining -= length;
            } finally {
                bodyFrame.release();
            }
        }
        sink.flush();
        return header.getBodySize();
    }

    @Override
    public void basicAck(long deliveryTag) throws AmqpRpcException {
        ByteBuf args = Unpooled.buffer();
        args.writeLong(deliveryTag);
        AmqpCodec.encodeBoolean(args, false); // multiple
        sendMethod("basic.ack", channelNumber, AmqpConstants.CLASS_BASIC, AmqpConstants.METHOD_BASIC_ACK, args);
    }

    @Override
    public void releaseBuffers() {
        for (AmqpFrame frame : heldFrames) {
            frame.release();
        }
        heldFrames.clear();
    }

    @Override
    public void close() throws AmqpRpcException {
        try {
            if (channelOpen) {
                rpc("channel.close", channelNumber, AmqpConstants.CLASS_CHANNEL,
                    AmqpConstants.METHOD_CHANNEL_CLOSE, closeArguments(), AmqpConstants.METHOD_CHANNEL_CLOSE_OK).release();
                channelOpen = false;
            }
            if (connectionOpen) {
                rpc("connection.close", (short) 0, AmqpConstants.CLASS_CONNECTION,
                    AmqpConstants.METHOD_CONNECTION_CLOSE, closeArguments(), AmqpConstants.METHOD_CONNECTION_CLOSE_OK).release();
                connectionOpen = false;
            }
        } finally {
            shutdown();
        }
        logger.debug("Connection closed");
    }

    public int getChannelMax() {
        return channelMax;
    }

    public int getFrameMax() {
        return frameMax;
    }

    public int getHeartbeatSeconds() {
        return heartbeatSeconds;
    }

    static byte[] plainResponse(String username, String password) {
        byte[] user = username.getBytes(StandardCharsets.UTF_8);
        byte[] pass = password.getBytes(StandardCharsets.UTF_8);
        byte[] response = new byte[user.length + pass.length + 2];
        System.arraycopy(user, 0, response, 1, user.length);
        System.arraycopy(pass, 0, response, user.length + 2, pass.length);
        return response;
    }

    /**
     * Pick the smaller of two limits, where 0 means "no limit" on either side.
     */
    static int negotiate(int clientValue, int serverValue) {
        if (clientValue == 0) {
            return serverValue;
        }
        if (serverValue == 0) {
            return clientValue;
        }
        return Math.min(clientValue, serverValue);
    }

    private static Map<String, Object> clientProperties() {
        Map<String, Object> capabilities = new LinkedHashMap<>();
        capabilities.put("authentication_failure_close", true);

        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("product", PRODUCT);
        properties.put("version", VERSION);
        properties.put("platform", "Java " + System.getProperty("java.version"));
        properties.put("information", "Pipes each consumed message to a command");
        properties.put("capabilities", capabilities);
        return properties;
    }

    private static ByteBuf closeArguments() {
        ByteBuf args = Unpooled.buffer();
        args.writeShort(AmqpConstants.REPLY_SUCCESS);
        AmqpCodec.encodeShortString(args, "OK");
        args.writeShort(0); // class-id
        args.writeShort(0); // method-id
        return args;
    }

    private AmqpFrame rpc(String operation, short channel, short classId, short methodId,
                          ByteBuf args, short replyMethodId) throws AmqpRpcException {
        sendMethod(operation, channel, classId, methodId, args);
        return awaitMethod(operation, channel, classId, replyMethodId);
    }

    /**
     * Wait for a specific method on a channel. Frames that arrive first are skipped.
     * The returned frame is owned by the caller.
     */
    private AmqpFrame awaitMethod(String operation, short channel, short classId, short methodId)
            throws AmqpRpcException {
        while (true) {
            AmqpFrame frame = nextFrame(operation);
            if (frame.getChannel() == channel && frame.isMethod(classId, methodId)) {
                return frame;
            }
            logger.debug("Skipping {} while waiting for {}", frame, operation);
            frame.release();
        }
    }

    /**
     * Next content frame of the delivery being read; heartbeats in between are dropped.
     */
    private AmqpFrame nextContentFrame(String operation) throws AmqpRpcException {
        while (true) {
            AmqpFrame frame = nextFrame(operation);
            if (!frame.isHeartbeat()) {
                if (frame.getChannel() != channelNumber) {
                    frame.release();
                    throw new AmqpRpcException(operation, "content frame on unexpected channel " + frame.getChannel());
                }
                return frame;
            }
            frame.release();
        }
    }

    /**
     * Take the next frame off the connection. A close from the server, for the
     * connection or for our channel, is confirmed and turned into an exception.
     */
    private AmqpFrame nextFrame(String operation) throws AmqpRpcException {
        resumeReadingIfDrained();
        AmqpFrame frame;
        try {
            frame = incoming.take();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AmqpRpcException(operation, "interrupted while waiting for a frame", e);
        }

        if (frame == END_OF_STREAM) {
            // Leave the marker so later waits fail immediately too
            incoming.offer(END_OF_STREAM);
            connectionOpen = false;
            channelOpen = false;
            throw new AmqpRpcException(operation, "connection closed", failureCause);
        }

        if (frame.isMethod(AmqpConstants.CLASS_CONNECTION, AmqpConstants.METHOD_CONNECTION_CLOSE)) {
            AmqpRpcException error = closeError(operation, frame, true);
            connectionOpen = false;
            channelOpen = false;
            try {
                sendMethod("connection.close-ok", (short) 0,
                    AmqpConstants.CLASS_CONNECTION, AmqpConstants.METHOD_CONNECTION_CLOSE_OK, null);
            } catch (AmqpRpcException e) {
                error.addSuppressed(e);
            }
            throw error;
        }

        if (frame.getChannel() == channelNumber
                && frame.isMethod(AmqpConstants.CLASS_CHANNEL, AmqpConstants.METHOD_CHANNEL_CLOSE)) {
            AmqpRpcException error = closeError(operation, frame, false);
            channelOpen = false;
            try {
                sendMethod("channel.close-ok", channelNumber,
                    AmqpConstants.CLASS_CHANNEL, AmqpConstants.METHOD_CHANNEL_CLOSE_OK, null);
            } catch (AmqpRpcException e) {
                error.addSuppressed(e);
            }
            throw error;
        }

        return frame;
    }

    private void resumeReadingIfDrained() {
        if (nettyChannel != null && !nettyChannel.config().isAutoRead()
                && incoming.size() <= LOW_WATER_FRAMES) {
            logger.trace("Resuming socket reads with {} frames buffered", incoming.size());
            nettyChannel.config().setAutoRead(true);
        }
    }

    /**
     * Frames decoded but not yet taken by the consume thread.
     */
    int bufferedFrameCount() {
        return incoming.size();
    }

    private static AmqpRpcException closeError(String operation, AmqpFrame frame, boolean connectionClosed) {
        try {
            ByteBuf args = frame.methodArguments();
            int replyCode = args.readUnsignedShort();
            String replyText = AmqpCodec.decodeShortString(args);
            logger.debug("Server closed {}: {} {}", connectionClosed ? "connection" : "channel", replyCode, replyText);
            return new AmqpRpcException(operation, connectionClosed, replyCode, replyText);
        } finally {
            frame.release();
        }
    }

    private void sendMethod(String operation, short channel, short classId, short methodId, ByteBuf args)
            throws AmqpRpcException {
        ByteBuf payload = Unpooled.buffer();
        payload.writeShort(classId);
        payload.writeShort(methodId);
        if (args != null) {
            payload.writeBytes(args);
            args.release();
        }
        sendFrame(operation, new AmqpFrame(AmqpFrame.FrameType.METHOD.getValue(), channel, payload));
    }

    private void sendFrame(String operation, AmqpFrame frame) throws AmqpRpcException {
        if (nettyChannel == null || !nettyChannel.isActive()) {
            frame.release();
            throw new AmqpRpcException(operation, "connection is not open", failureCause);
        }
        ChannelFuture write = nettyChannel.writeAndFlush(frame).awaitUninterruptibly();
        if (!write.isSuccess()) {
            throw new AmqpRpcException(operation, "failed to send frame", write.cause());
        }
        logger.debug("Sent {} ({})", frame, operation);
    }

    private void startHeartbeat() {
        if (heartbeatSeconds <= 0) {
            logger.debug("Heartbeat disabled (interval=0)");
            return;
        }

        // The server is considered gone after two silent intervals
        nettyChannel.pipeline().addFirst("idleState",
            new IdleStateHandler(heartbeatSeconds * 2L, 0, 0, TimeUnit.SECONDS));

        heartbeatSender = nettyChannel.eventLoop().scheduleAtFixedRate(() -> {
            if (nettyChannel.isActive()) {
                nettyChannel.writeAndFlush(AmqpFrame.heartbeat());
                logger.trace("Sent heartbeat frame");
            }
        }, heartbeatSeconds, heartbeatSeconds, TimeUnit.SECONDS);
    }

    private void shutdown() {
        if (heartbeatSender != null) {
            heartbeatSender.cancel(false);
            heartbeatSender = null;
        }
        releaseBuffers();
        if (nettyChannel != null) {
            nettyChannel.close().awaitUninterruptibly();
        }
        if (group != null) {
            group.shutdownGracefully(0, SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS).awaitUninterruptibly();
            group = null;
        }
        AmqpFrame frame;
        while ((frame = incoming.poll()) != null) {
            frame.release();
        }
    }

    /**
     * Moves decoded frames from the event loop to the consuming thread.
     */
    private class FrameHandoffHandler extends SimpleChannelInboundHandler<AmqpFrame> {

        FrameHandoffHandler() {
            super(false);
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, AmqpFrame frame) {
            logger.trace("Received {}", frame);
            incoming.offer(frame);
            if (incoming.size() >= HIGH_WATER_FRAMES && ctx.channel().config().isAutoRead()) {
                // The broker is held back by TCP flow control until the consume thread catches up
                logger.trace("Pausing socket reads with {} frames buffered", incoming.size());
                ctx.channel().config().setAutoRead(false);
            }
        }

        @Override
        public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
            if (evt instanceof IdleStateEvent) {
                if (!ctx.channel().config().isAutoRead()) {
                    // Reads are paused, so silence says nothing about the server
                    return;
                }
                logger.warn("No frames from server for {} seconds, closing connection", heartbeatSeconds * 2);
                failureCause = new IOException("missed heartbeats from server");
                ctx.close();
                return;
            }
            super.userEventTriggered(ctx, evt);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            logger.debug("Connection error", cause);
            failureCause = cause;
            ctx.close();
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) throws Exception {
            incoming.offer(END_OF_STREAM);
            super.channelInactive(ctx);
        }
    }
}
