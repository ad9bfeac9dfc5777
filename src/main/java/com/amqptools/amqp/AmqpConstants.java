package com.amqptools.amqp;

/**
 * AMQP 0-9-1 protocol constants used by the consuming client.
 */
public final class AmqpConstants {

    private AmqpConstants() {
        // Utility class
    }

    public static final byte[] PROTOCOL_HEADER = {'A', 'M', 'Q', 'P', 0, 0, 9, 1};

    // ===== Class IDs =====
    public static final short CLASS_CONNECTION = 10;
    public static final short CLASS_CHANNEL = 20;
    public static final short CLASS_QUEUE = 50;
    public static final short CLASS_BASIC = 60;

    // ===== Connection Method IDs =====
    public static final short METHOD_CONNECTION_START = 10;
    public static final short METHOD_CONNECTION_START_OK = 11;
    public static final short METHOD_CONNECTION_TUNE = 30;
    public static final short METHOD_CONNECTION_TUNE_OK = 31;
    public static final short METHOD_CONNECTION_OPEN = 40;
    public static final short METHOD_CONNECTION_OPEN_OK = 41;
    public static final short METHOD_CONNECTION_CLOSE = 50;
    public static final short METHOD_CONNECTION_CLOSE_OK = 51;

    // ===== Channel Method IDs =====
    public static final short METHOD_CHANNEL_OPEN = 10;
    public static final short METHOD_CHANNEL_OPEN_OK = 11;
    public static final short METHOD_CHANNEL_CLOSE = 40;
    public static final short METHOD_CHANNEL_CLOSE_OK = 41;

    // ===== Queue Method IDs =====
    public static final short METHOD_QUEUE_DECLARE = 10;
    public static final short METHOD_QUEUE_DECLARE_OK = 11;
    public static final short METHOD_QUEUE_BIND = 20;
    public static final short METHOD_QUEUE_BIND_OK = 21;

    // ===== Basic Method IDs =====
    public static final short METHOD_BASIC_QOS = 10;
    public static final short METHOD_BASIC_QOS_OK = 11;
    public static final short METHOD_BASIC_CONSUME = 20;
    public static final short METHOD_BASIC_CONSUME_OK = 21;
    public static final short METHOD_BASIC_DELIVER = 60;
    public static final short METHOD_BASIC_ACK = 80;

    // ===== Queue.Declare flag bits =====
    public static final int QUEUE_FLAG_DURABLE = 0x02;
    public static final int QUEUE_FLAG_EXCLUSIVE = 0x04;
    public static final int QUEUE_FLAG_AUTO_DELETE = 0x08;

    // ===== Basic.Consume flag bits =====
    public static final int CONSUME_FLAG_NO_ACK = 0x02;

    // ===== AMQP Reply Codes =====
    public static final int REPLY_SUCCESS = 200;
    public static final int REPLY_NOT_FOUND = 404;
    public static final int REPLY_PRECONDITION_FAILED = 406;

    // ===== Connection/Channel Limits =====
    public static final short DEFAULT_CHANNEL_MAX = 2047;
    public static final int DEFAULT_FRAME_MAX = 131072; // 128KB
    public static final int MIN_FRAME_MAX = 4096;
    public static final short CONSUME_CHANNEL = 1;

    // ===== Basic.Qos prefetch-count range (an unsigned short) =====
    public static final int MIN_PREFETCH_COUNT = 1;
    public static final int MAX_PREFETCH_COUNT = 65535;
}
