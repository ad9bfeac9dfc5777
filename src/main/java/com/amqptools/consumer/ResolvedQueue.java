package com.amqptools.consumer;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * The queue the session consumes from. Queue names are opaque octets; the bytes
 * are copied in and out so the name cannot change for the life of the session.
 */
public final class ResolvedQueue {
    private final byte[] name;

    public ResolvedQueue(byte[] name) {
        this.name = name.clone();
    }

    public static ResolvedQueue of(String name) {
        return new ResolvedQueue(name == null ? new byte[0] : name.getBytes(StandardCharsets.UTF_8));
    }

    public byte[] getBytes() {
        return name.clone();
    }

    public boolean isEmpty() {
        return name.length == 0;
    }

    /**
     * The name in printable form, escaped the way rabbitmqctl does: bytes below 32
     * and DEL become a backslash and three octal digits.
     */
    public String toDisplayString() {
        return escape(name);
    }

    static String escape(byte[] bytes) {
        StringBuilder sb = new StringBuilder(bytes.length);
        int i = 0;
        while (i < bytes.length) {
            int b = bytes[i] & 0xFF;
            if (b < 32 || b == 127) {
                sb.append('\\')
                  .append((char) ('0' + (b >> 6)))
                  .append((char) ('0' + ((b >> 3) & 0x7)))
                  .append((char) ('0' + (b & 0x7)));
                i++;
                continue;
            }
            // Copy the printable run and let UTF-8 sequences decode as text
            int start = i;
            while (i < bytes.length && (bytes[i] & 0xFF) >= 32 && (bytes[i] & 0xFF) != 127) {
                i++;
            }
            sb.append(new String(bytes, start, i - start, StandardCharsets.UTF_8));
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ResolvedQueue)) return false;
        return Arrays.equals(name, ((ResolvedQueue) o).name);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(name);
    }

    @Override
    public String toString() {
        return toDisplayString();
    }
}
