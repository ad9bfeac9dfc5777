package com.amqptools.amqp;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.DecoderException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("AMQP Codec Tests")
class AmqpCodecTest {

    private static ByteBuf rawFrame(int type, int channel, byte[] payload, int frameEnd) {
        ByteBuf buf = Unpooled.buffer();
        buf.writeByte(type);
        buf.writeShort(channel);
        buf.writeInt(payload.length);
        buf.writeBytes(payload);
        buf.writeByte(frameEnd);
        return buf;
    }

    @Nested
    @DisplayName("AmqpFrameEncoder Tests")
    class AmqpFrameEncoderTests {

        private EmbeddedChannel channel;

        @BeforeEach
        void setUp() {
            channel = new EmbeddedChannel(new AmqpCodec.AmqpFrameEncoder());
        }

        @Test
        @DisplayName("Should encode frame with correct format")
        void testEncodeFrame() {
            AmqpFrame frame = new AmqpFrame((byte) 1, (short) 2, Unpooled.wrappedBuffer("test".getBytes()));

            channel.writeOutbound(frame);
            ByteBuf encoded = channel.readOutbound();

            assertThat(encoded.readByte()).isEqualTo((byte) 1);
            assertThat(encoded.readShort()).isEqualTo((short) 2);
            assertThat(encoded.readInt()).isEqualTo(4);
            byte[] payloadBytes = new byte[4];
            encoded.readBytes(payloadBytes);
            assertThat(payloadBytes).isEqualTo("test".getBytes());
            assertThat(encoded.readByte()).isEqualTo(AmqpFrame.FRAME_END);

            encoded.release();
        }

        @Test
        @DisplayName("Should encode heartbeat as an empty frame")
        void testEncodeHeartbeat() {
            channel.writeOutbound(AmqpFrame.heartbeat());
            ByteBuf encoded = channel.readOutbound();

            assertThat(encoded.readableBytes()).isEqualTo(AmqpFrame.FRAME_HEADER_SIZE + AmqpFrame.FRAME_END_SIZE);
            assertThat(encoded.readByte()).isEqualTo((byte) 8);

            encoded.release();
        }

        @Test
        @DisplayName("Should pass raw buffers such as the protocol header through")
        void testPassThroughRawBuffer() {
            channel.writeOutbound(Unpooled.wrappedBuffer(AmqpConstants.PROTOCOL_HEADER));
            ByteBuf encoded = channel.readOutbound();

            byte[] bytes = new byte[encoded.readableBytes()];
            encoded.readBytes(bytes);
            assertThat(bytes).isEqualTo(AmqpConstants.PROTOCOL_HEADER);

            encoded.release();
        }
    }

    @Nested
    @DisplayName("AmqpFrameDecoder Tests")
    class AmqpFrameDecoderTests {

        @Test
        @DisplayName("Should decode a complete frame")
        void testDecodeFrame() {
            EmbeddedChannel channel = new EmbeddedChannel(new AmqpCodec.AmqpFrameDecoder());

            channel.writeInbound(rawFrame(3, 1, "body".getBytes(), 0xCE));
            AmqpFrame frame = channel.readInbound();

            assertThat(frame.isBody()).isTrue();
            assertThat(frame.getChannel()).isEqualTo((short) 1);
            assertThat(frame.getPayload().toString(StandardCharsets.UTF_8)).isEqualTo("body");
            frame.release();
        }

        @Test
        @DisplayName("Should wait for the rest of a split frame")
        void testDecodeSplitFrame() {
            EmbeddedChannel channel = new EmbeddedChannel(new AmqpCodec.AmqpFrameDecoder());
            ByteBuf raw = rawFrame(1, 1, new byte[]{0, 60, 0, 80}, 0xCE);

            channel.writeInbound(raw.readRetainedSlice(6));
            assertThat((Object) channel.readInbound()).isNull();

            channel.writeInbound(raw);
            AmqpFrame frame = channel.readInbound();
            assertThat(frame.isMethod(AmqpConstants.CLASS_BASIC, AmqpConstants.METHOD_BASIC_ACK)).isTrue();
            frame.release();
        }

        @Test
        @DisplayName("Should decode consecutive frames from one read")
        void testDecodeConsecutiveFrames() {
            EmbeddedChannel channel = new EmbeddedChannel(new AmqpCodec.AmqpFrameDecoder());
            ByteBuf both = Unpooled.buffer();
            both.writeBytes(rawFrame(8, 0, new byte[0], 0xCE));
            both.writeBytes(rawFrame(3, 1, "xy".getBytes(), 0xCE));

            channel.writeInbound(both);
            AmqpFrame first = channel.readInbound();
            AmqpFrame second = channel.readInbound();

            assertThat(first.isHeartbeat()).isTrue();
            assertThat(second.getSize()).isEqualTo(2);
            first.release();
            second.release();
        }

        @Test
        @DisplayName("Should reject frame without end marker")
        void testInvalidFrameEnd() {
            EmbeddedChannel channel = new EmbeddedChannel(new AmqpCodec.AmqpFrameDecoder());

            assertThatThrownBy(() -> channel.writeInbound(rawFrame(3, 1, "body".getBytes(), 0x00)))
                .isInstanceOf(DecoderException.class)
                .hasMessageContaining("Invalid frame end marker");
        }

        @Test
        @DisplayName("Should reject frame larger than the negotiated maximum")
        void testFrameTooLarge() {
            AmqpCodec.AmqpFrameDecoder decoder = new AmqpCodec.AmqpFrameDecoder();
            decoder.setMaxFrameSize(16);
            EmbeddedChannel channel = new EmbeddedChannel(decoder);

            assertThatThrownBy(() -> channel.writeInbound(rawFrame(3, 1, new byte[17], 0xCE)))
                .isInstanceOf(DecoderException.class)
                .hasMessageContaining("Invalid frame size: 17");
        }
    }

    @Nested
    @DisplayName("Field Encoding Tests")
    class FieldEncodingTests {

        @Test
        @DisplayName("Should round-trip raw short string bytes")
        void testShortStringBytes() {
            byte[] name = {'q', 0, (byte) 0xFF};
            ByteBuf buf = Unpooled.buffer();

            AmqpCodec.encodeShortString(buf, name);

            assertThat(buf.getUnsignedByte(0)).isEqualTo((short) 3);
            assertThat(AmqpCodec.decodeShortStringBytes(buf)).isEqualTo(name);
        }

        @Test
        @DisplayName("Should reject short string over 255 bytes")
        void testShortStringTooLong() {
            assertThatThrownBy(() -> AmqpCodec.encodeShortString(Unpooled.buffer(), "x".repeat(256)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Short string too long");
        }

        @Test
        @DisplayName("Should detect short string underflow")
        void testShortStringUnderflow() {
            ByteBuf buf = Unpooled.buffer();
            buf.writeByte(10);
            buf.writeBytes("abc".getBytes());

            assertThatThrownBy(() -> AmqpCodec.decodeShortString(buf))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Buffer underflow");
        }

        @Test
        @DisplayName("Should write table length prefix and skip it again")
        void testEncodeAndSkipTable() {
            Map<String, Object> capabilities = new LinkedHashMap<>();
            capabilities.put("authentication_failure_close", true);
            Map<String, Object> table = new LinkedHashMap<>();
            table.put("product", "amqp-consume");
            table.put("capabilities", capabilities);

            ByteBuf buf = Unpooled.buffer();
            AmqpCodec.encodeTable(buf, table);
            buf.writeByte(42);

            assertThat(buf.getInt(0)).isEqualTo(buf.readableBytes() - 5);
            AmqpCodec.skipTable(buf);
            assertThat(buf.readByte()).isEqualTo((byte) 42);
        }

        @Test
        @DisplayName("Should encode empty table as zero length")
        void testEncodeEmptyTable() {
            ByteBuf buf = Unpooled.buffer();

            AmqpCodec.encodeTable(buf, null);

            assertThat(buf.readableBytes()).isEqualTo(4);
            assertThat(buf.readInt()).isZero();
        }

        @Test
        @DisplayName("Should reject unsupported field value types")
        void testUnsupportedFieldValue() {
            assertThatThrownBy(() -> AmqpCodec.encodeFieldValue(Unpooled.buffer(), new Object()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unsupported field value type");
        }

        @Test
        @DisplayName("Should reject table longer than the buffer")
        void testSkipTruncatedTable() {
            ByteBuf buf = Unpooled.buffer();
            buf.writeInt(100);
            buf.writeBytes(new byte[10]);

            assertThatThrownBy(() -> AmqpCodec.skipTable(buf))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Table length exceeds available bytes");
        }
    }
}
