package respite.network;

import respite.commands.CommandDispatcher;
import respite.commands.Errors;
import respite.protocol.RespValue;
import respite.server.ServerStats;
import respite.utils.Log;

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.handler.codec.DecoderException;
import io.netty.handler.timeout.ReadTimeoutException;
import io.netty.util.ReferenceCountUtil;

import java.io.IOException;

/**
 * Last handler of a client pipeline. Each decoded request is dispatched against the shared
 * store and its reply written back before the next request is read.
 */
public class ClientHandler extends ChannelInboundHandlerAdapter {
    private final CommandDispatcher dispatcher;
    private final ServerStats stats;
    private ChannelHandlerContext ctx;

    public ClientHandler(CommandDispatcher dispatcher, ServerStats stats) {
        this.dispatcher = dispatcher;
        this.stats = stats;
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        this.ctx = ctx;
        stats.activeConnections.incrementAndGet();
        stats.totalConnections.incrementAndGet();
        if (Log.isDebugEnabled()) Log.debug("Client connected: " + getRemoteAddress());
        super.channelActive(ctx);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        stats.activeConnections.decrementAndGet();
        if (Log.isDebugEnabled()) Log.debug("Client disconnected: " + getRemoteAddress());
        super.channelInactive(ctx);
    }

    @Override
    public void channelRead(ChannelHandlerContext ctx, Object msg) throws Exception {
        if (!(msg instanceof RespValue)) {
            ReferenceCountUtil.release(msg);
            return;
        }
        RespValue reply = dispatcher.dispatch((RespValue) msg);
        ctx.writeAndFlush(reply);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        if (cause instanceof ReadTimeoutException) {
            Log.info("Closing idle client " + getRemoteAddress());
            ctx.close();
        } else if (cause instanceof DecoderException) {
            // The decoder has already dropped the bad bytes; the connection stays usable.
            stats.protocolErrors.incrementAndGet();
            String detail = cause.getMessage() != null ? cause.getMessage() : "malformed request";
            Log.debug("Protocol error from " + getRemoteAddress() + ": " + detail);
            ctx.writeAndFlush(Errors.protocol(detail));
        } else if (cause instanceof IOException) {
            Log.debug("Connection error from " + getRemoteAddress() + ": " + cause.getMessage());
            ctx.close();
        } else {
            Log.error("Unexpected error on connection " + getRemoteAddress(), cause);
            ctx.close();
        }
    }

    public String getRemoteAddress() {
        if (ctx != null && ctx.channel().remoteAddress() != null) {
            return ctx.channel().remoteAddress().toString();
        }
        return "0.0.0.0:0";
    }
}
