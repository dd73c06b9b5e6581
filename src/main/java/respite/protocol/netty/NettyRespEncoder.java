package respite.protocol.netty;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToByteEncoder;
import respite.protocol.Resp;
import respite.protocol.RespValue;

/**
 * Encodes {@link RespValue} replies onto the wire.
 */
@ChannelHandler.Sharable
public class NettyRespEncoder extends MessageToByteEncoder<RespValue> {

    @Override
    protected void encode(ChannelHandlerContext ctx, RespValue msg, ByteBuf out) throws Exception {
        Resp.encode(msg, out);
    }
}
