package com.amqptools.amqp;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;
import io.netty.handler.codec.MessageToByteEncoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

public class AmqpCodec {

    public static final int MAX_FRAME_SIZE = 1024 * 1024; // 1MB until tune negotiates a smaller limit
    public static final int MAX_SHORT_STRING_LENGTH = 255;
    public static final int MAX_LONG_STRING_LENGTH = 256 * 1024; // 256KB max string

    public static class AmqpFrameDecoder extends ByteToMessageDecoder {
        private static final int MIN_FRAME_SIZE = 8;

        // Written by the consuming thread after tune, read on the event loop
        private volatile int maxFrameSize;

        public AmqpFrameDecoder() {
            this(MAX_FRAME_SIZE);
        }

        public AmqpFrameDecoder(int maxFrameSize) {
            this.maxFrameSize = maxFrameSize;
        }

        public void setMaxFrameSize(int maxFrameSize) {
            this.maxFrameSize = maxFrameSize;
        }

        public int getMaxFrameSize() {
            return maxFrameSize;
        }

        @Override
        protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) throws Exception {
            if (in.readableBytes() < MIN_FRAME_SIZE) {
                return;
            }

            int readerIndex = in.readerIndex();

            byte type = in.readByte();
            short channel = in.readShort();
            int size = in.readInt();

            if (size < 0 || size > maxFrameSize) {
                throw new IllegalArgumentException(
                    "Invalid frame size: " + size + " (max: " + maxFrameSize + ")");
            }

            if (in.readableBytes() < size + 1) {
                in.readerIndex(readerIndex);
                return;
            }

            ByteBuf payload = in.readRetainedSlice(size);
            byte frameEnd = in.readByte();

            if (frameEnd != AmqpFrame.FRAME_END) {
                payload.release();
                throw new IllegalArgumentException("Invalid frame end marker");
            }

            out.add(new AmqpFrame(type, channel, payload));
        }
    }

    public static class AmqpFrameEncoder extends MessageToByteEncoder<AmqpFrame> {
        private static final Logger logger = LoggerFactory.getLogger(AmqpFrameEncoder.class);

        @Override
        protected void encode(ChannelHandlerContext ctx, AmqpFrame frame, ByteBuf out) throws Exception {
            logger.trace("Encoding frame: type={}, channel={}, size={}", frame.getType(), frame.getChannel(), frame.getSize());
            out.writeByte(frame.getType());
            out.writeShort(frame.getChannel());
            out.writeInt(frame.getSize());
            out.writeBytes(frame.getPayload(), frame.getPayload().readerIndex(), frame.getSize());
            out.writeByte(AmqpFrame.FRAME_END);
        }
    }

    public static ByteBuf encodeShortString(ByteBuf buf, String value) {
        if (value == null) value = "";
        return encodeShortString(buf, value.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Queue names are opaque octets on the wire, so they are carried as raw bytes.
     */
    public static ByteBuf encodeShortString(ByteBuf buf, byte[] bytes) {
        if (bytes == null) bytes = new byte[0];
        if (bytes.length > MAX_SHORT_STRING_LENGTH) {
            throw new IllegalArgumentException(
                "Short string too long: " + bytes.length + " bytes (max: " + MAX_SHORT_STRING_LENGTH + ")");
        }
        buf.writeByte(bytes.length);
        buf.writeBytes(bytes);
        return buf;
    }

    public static String decodeShortString(ByteBuf buf) {
        return new String(decodeShortStringBytes(buf), StandardCharsets.UTF_8);
    }

    public static byte[] decodeShortStringBytes(ByteBuf buf) {
        int length = buf.readUnsignedByte();
        if (buf.readableBytes() < length) {
            throw new IllegalArgumentException(
                "Buffer underflow: need " + length + " bytes but only " + buf.readableBytes() + " available");
        }
        byte[] bytes = new byte[length];
        buf.readBytes(bytes);
        return bytes;
    }

    public static ByteBuf encodeLongString(ByteBuf buf, String value) {
        if (value == null) value = "";
        return encodeLongString(buf, value.getBytes(StandardCharsets.UTF_8));
    }

    public static ByteBuf encodeLongString(ByteBuf buf, byte[] bytes) {
        buf.writeInt(bytes.length);
        buf.writeBytes(bytes);
        return buf;
    }

    public static String decodeLongString(ByteBuf buf) {
        int length = buf.readInt();
        if (length < 0 || length > MAX_LONG_STRING_LENGTH) {
            throw new IllegalArgumentException(
                "Invalid long string length: " + length + " (max: " + MAX_LONG_STRING_LENGTH + ")");
        }
        if (buf.readableBytes() < length) {
            throw new IllegalArgumentException(
                "Buffer underflow: need " + length + " bytes but only " + buf.readableBytes() + " available");
        }
        byte[] bytes = new byte[length];
        buf.readBytes(bytes);
        return new String(bytes, StandardCharsets.UTF_8);
    }

    public static ByteBuf encodeBoolean(ByteBuf buf, boolean value) {
        buf.writeByte(value ? 1 : 0);
        return buf;
    }

    public static boolean decodeBoolean(ByteBuf buf) {
        return buf.readByte() != 0;
    }

    /**
     * Skip over a field table without decoding it. Server properties are informational
     * only, so the client never needs their values.
     */
    public static void skipTable(ByteBuf buf) {
        long tableLength = buf.readUnsignedInt();
        if (tableLength > buf.readableBytes()) {
            throw new IllegalArgumentException(
                "Table length exceeds available bytes: " + tableLength + " > " + buf.readableBytes());
        }
        buf.skipBytes((int) tableLength);
    }

    /**
     * Encode a field table. Only the value types a client sends are supported:
     * booleans, integers, longs, strings and nested tables.
     */
    public static void encodeTable(ByteBuf buf, Map<String, Object> table) {
        if (table == null || table.isEmpty()) {
            buf.writeInt(0);
            return;
        }

        int lengthIndex = buf.writerIndex();
        buf.writeInt(0);
        for (Map.Entry<String, Object> entry : table.entrySet()) {
            encodeShortString(buf, entry.getKey());
            encodeFieldValue(buf, entry.getValue());
        }
        buf.setInt(lengthIndex, buf.writerIndex() - lengthIndex - 4);
    }

    public static void encodeFieldValue(ByteBuf buf, Object value) {
        if (value instanceof Boolean) {
            buf.writeByte('t');
            buf.writeByte((Boolean) value ? 1 : 0);
        } else if (value instanceof Integer) {
            buf.writeByte('I');
            buf.writeInt((Integer) value);
        } else if (value instanceof Long) {
            buf.writeByte('l');
            buf.writeLong((Long) value);
        } else if (value instanceof String) {
            buf.writeByte('S');
            encodeLongString(buf, (String) value);
        } else if (value instanceof Map) {
            buf.writeByte('F');
            @SuppressWarnings("unchecked")
            Map<String, Object> nestedTable = (Map<String, Object>) value;
            encodeTable(buf, nestedTable);
        } else {
            throw new IllegalArgumentException("Unsupported field value type: "
                + (value == null ? "null" : value.getClass().getName()));
        }
    }
}
