package respite.protocol.netty;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;
import io.netty.handler.codec.CorruptedFrameException;
import respite.protocol.Resp;
import respite.protocol.RespReader;
import java.util.List;

/**
 * Netty decoder for RESP frames. Bytes of a partial frame are consumed into a per-channel
 * {@link RespReader} as they arrive, so a frame split over many reads is parsed once.
 * <p>
 * RESP has no resynchronization point, so on a format error every buffered byte is dropped
 * before a {@link CorruptedFrameException} is raised down the pipeline.
 */
public class NettyRespDecoder extends ByteToMessageDecoder {

    private final RespReader reader = new RespReader();

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) throws Exception {
        Resp.Decoded result = reader.read(in);
        switch (result.getStatus()) {
            case NEED_MORE_DATA:
                return;
            case COMPLETE:
                out.add(result.getValue());
                return;
            default:
                in.skipBytes(in.readableBytes());
                throw new CorruptedFrameException(result.getError());
        }
    }
}
