package com.amqptools.amqp;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufHolder;
import io.netty.buffer.Unpooled;

/**
 * A single AMQP 0-9-1 frame as read from or written to the broker connection.
 * The payload is reference counted; whoever takes a frame off the wire owns it
 * until it is released.
 */
public class AmqpFrame implements ByteBufHolder {
    public static final int FRAME_HEADER_SIZE = 7;
    public static final int FRAME_END_SIZE = 1;
    public static final byte FRAME_END = (byte) 0xCE;

    private final byte type;
    private final short channel;
    private final int size;
    private final ByteBuf payload;

    public AmqpFrame(byte type, short channel, ByteBuf payload) {
        this.type = type;
        this.channel = channel;
        this.payload = payload;
        this.size = payload.readableBytes();
    }

    public static AmqpFrame heartbeat() {
        return new AmqpFrame(FrameType.HEARTBEAT.getValue(), (short) 0, Unpooled.EMPTY_BUFFER);
    }

    public byte getType() {
        return type;
    }

    public short getChannel() {
        return channel;
    }

    public int getSize() {
        return size;
    }

    public ByteBuf getPayload() {
        return payload;
    }

    public boolean isMethod() {
        return type == FrameType.METHOD.getValue();
    }

    public boolean isHeader() {
        return type == FrameType.HEADER.getValue();
    }

    public boolean isBody() {
        return type == FrameType.BODY.getValue();
    }

    public boolean isHeartbeat() {
        return type == FrameType.HEARTBEAT.getValue();
    }

    /**
     * Class id of a method frame, read without moving the payload's reader index.
     * Returns -1 for non-method frames or truncated payloads.
     */
    public short getClassId() {
        if (!isMethod() || payload.readableBytes() < 4) {
            return -1;
        }
        return payload.getShort(payload.readerIndex());
    }

    /**
     * Method id of a method frame, read without moving the payload's reader index.
     * Returns -1 for non-method frames or truncated payloads.
     */
    public short getMethodId() {
        if (!isMethod() || payload.readableBytes() < 4) {
            return -1;
        }
        return payload.getShort(payload.readerIndex() + 2);
    }

    public boolean isMethod(short classId, short methodId) {
        return isMethod() && getClassId() == classId && getMethodId() == methodId;
    }

    /**
     * Method arguments with the class and method ids skipped. The returned buffer
     * shares content with this frame and must not outlive it.
     */
    public ByteBuf methodArguments() {
        return payload.slice(payload.readerIndex() + 4, payload.readableBytes() - 4);
    }

    @Override
    public ByteBuf content() {
        return payload;
    }

    @Override
    public AmqpFrame copy() {
        return new AmqpFrame(type, channel, payload.copy());
    }

    @Override
    public AmqpFrame duplicate() {
        return new AmqpFrame(type, channel, payload.duplicate());
    }

    @Override
    public AmqpFrame retainedDuplicate() {
        return new AmqpFrame(type, channel, payload.retainedDuplicate());
    }

    @Override
    public AmqpFrame replace(ByteBuf content) {
        return new AmqpFrame(type, channel, content);
    }

    @Override
    public AmqpFrame retain() {
        payload.retain();
        return this;
    }

    @Override
    public AmqpFrame retain(int increment) {
        payload.retain(increment);
        return this;
    }

    @Override
    public AmqpFrame touch() {
        payload.touch();
        return this;
    }

    @Override
    public AmqpFrame touch(Object hint) {
        payload.touch(hint);
        return this;
    }

    @Override
    public int refCnt() {
        return payload.refCnt();
    }

    @Override
    public boolean release() {
        return payload.release();
    }

    @Override
    public boolean release(int decrement) {
        return payload.release(decrement);
    }

    @Override
    public String toString() {
        if (isMethod()) {
            return "AmqpFrame{method " + getClassId() + "." + getMethodId() + ", channel=" + channel + ", size=" + size + "}";
        }
        return "AmqpFrame{type=" + type + ", channel=" + channel + ", size=" + size + "}";
    }

    public enum FrameType {
        METHOD(1),
        HEADER(2),
        BODY(3),
        HEARTBEAT(8);

        private final byte value;

        FrameType(int value) {
            this.value = (byte) value;
        }

        public byte getValue() {
            return value;
        }

        public static FrameType fromValue(byte value) {
            for (FrameType type : values()) {
                if (type.value == value) {
                    return type;
                }
            }
            throw new IllegalArgumentException("Unknown frame type: " + value);
        }
    }
}
