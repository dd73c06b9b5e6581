package respite.protocol.netty;

import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.CorruptedFrameException;
import net.jqwik.api.*;
import net.jqwik.api.constraints.IntRange;
import respite.protocol.Resp;
import respite.protocol.RespValue;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

public class RespParserPropertyTest {

    @Property
    void parsingShouldNotCrash(@ForAll byte[] bytes) {
        EmbeddedChannel channel = new EmbeddedChannel(new NettyRespDecoder());
        try {
            channel.writeInbound(Unpooled.wrappedBuffer(bytes));
        } catch (CorruptedFrameException e) {
            // Malformed input is reported this way and nothing else
        }
        channel.finishAndReleaseAll();
    }

    @Property
    void encodedValuesDecodeToThemselves(@ForAll("values") RespValue value) {
        byte[] wire = Resp.encode(value);
        Resp.Decoded decoded = Resp.decode(wire);
        assertTrue(decoded.isComplete());
        assertEquals(value, decoded.getValue());
        assertEquals(wire.length, decoded.getConsumed());
    }

    @Property
    void splitFramesDecodeOnceComplete(@ForAll("values") RespValue value, @ForAll @IntRange(min = 0, max = 10_000) int cut) {
        byte[] wire = Resp.encode(value);
        int at = cut % wire.length;

        assertEquals(Resp.Decoded.Status.NEED_MORE_DATA, Resp.decode(Arrays.copyOf(wire, at)).getStatus());

        EmbeddedChannel channel = new EmbeddedChannel(new NettyRespDecoder());
        channel.writeInbound(Unpooled.wrappedBuffer(Arrays.copyOfRange(wire, 0, at)));
        assertNull(channel.readInbound());
        channel.writeInbound(Unpooled.wrappedBuffer(Arrays.copyOfRange(wire, at, wire.length)));
        assertEquals(value, channel.readInbound());
        channel.finish();
    }

    @Provide
    Arbitrary<RespValue> values() {
        return value(3);
    }

    private Arbitrary<RespValue> value(int depth) {
        Arbitrary<String> line = Arbitraries.strings().alpha().numeric().withChars(" :$*+-éü€").ofMaxLength(20);
        Arbitrary<String> body = Arbitraries.strings().alpha().numeric().withChars(" \r\n:$*é€").ofMaxLength(40);

        Arbitrary<RespValue> scalars = Arbitraries.oneOf(
                line.map(RespValue::simpleString),
                line.map(s -> RespValue.error("ERR " + s)),
                Arbitraries.longs().map(RespValue::integer),
                body.map(RespValue::bulkString),
                Arbitraries.just(RespValue.nullBulkString()));
        if (depth == 0) return scalars;

        Arbitrary<RespValue> arrays = value(depth - 1).list().ofMaxSize(4).map(RespValue::array);
        return Arbitraries.oneOf(scalars, arrays);
    }
}
