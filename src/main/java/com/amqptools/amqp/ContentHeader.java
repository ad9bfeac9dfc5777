package com.amqptools.amqp;

import io.netty.buffer.ByteBuf;

/**
 * The fixed part of a content header frame. Message properties that follow the
 * property flags are not needed to pipe a body and are left undecoded.
 */
public final class ContentHeader {
    private final short classId;
    private final long bodySize;
    private final int propertyFlags;

    public ContentHeader(short classId, long bodySize, int propertyFlags) {
        this.classId = classId;
        this.bodySize = bodySize;
        this.propertyFlags = propertyFlags;
    }

    public static ContentHeader decode(AmqpFrame frame) {
        if (!frame.isHeader()) {
            throw new IllegalArgumentException("Not a content header frame: " + frame);
        }
        ByteBuf payload = frame.getPayload();
        if (payload.readableBytes() < 14) {
            throw new IllegalArgumentException("Truncated content header: " + payload.readableBytes() + " bytes");
        }
        int index = payload.readerIndex();
        short classId = payload.getShort(index);
        // index + 2 is the weight field, always zero
        long bodySize = payload.getLong(index + 4);
        int propertyFlags = payload.getUnsignedShort(index + 12);
        if (bodySize < 0) {
            throw new IllegalArgumentException("Invalid body size: " + Long.toUnsignedString(bodySize));
        }
        return new ContentHeader(classId, bodySize, propertyFlags);
    }

    public short getClassId() {
        return classId;
    }

    public long getBodySize() {
        return bodySize;
    }

    public int getPropertyFlags() {
        return propertyFlags;
    }

    @Override
    public String toString() {
        return "ContentHeader{classId=" + classId + ", bodySize=" + bodySize +
               ", propertyFlags=0x" + Integer.toHexString(propertyFlags) + '}';
    }
}
