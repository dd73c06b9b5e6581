package respite.network;

import respite.utils.Log;

import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.Semaphore;

/**
 * Sits on the listening channel, in front of the bootstrap acceptor, and caps the number of
 * live client connections.
 * <p>
 * Every accepted child takes one permit before it is registered and gives it back when it
 * closes. With no permit left the child waits here and the listener stops accepting until a
 * connection goes away. {@link #waiting} is only touched from the listener's event loop.
 */
public class AdmissionControlHandler extends ChannelInboundHandlerAdapter {
    private final Semaphore permits;
    private final int maxConnections;
    private final Deque<Channel> waiting = new ArrayDeque<>();
    private ChannelHandlerContext ctx;

    public AdmissionControlHandler(int maxConnections) {
        this.maxConnections = maxConnections;
        this.permits = new Semaphore(maxConnections);
    }

    @Override
    public void handlerAdded(ChannelHandlerContext ctx) {
        this.ctx = ctx;
    }

    @Override
    public void channelRead(ChannelHandlerContext ctx, Object msg) {
        if (!(msg instanceof Channel)) {
            ctx.fireChannelRead(msg);
            return;
        }
        Channel child = (Channel) msg;
        if (waiting.isEmpty() && permits.tryAcquire()) {
            admit(child);
        } else {
            if (waiting.isEmpty()) {
                Log.warn("Connection limit of " + maxConnections + " reached, holding new clients until one disconnects.");
            }
            waiting.add(child);
        }
        if (!waiting.isEmpty() || permits.availablePermits() == 0) {
            ctx.channel().config().setAutoRead(false);
        }
    }

    private void admit(Channel child) {
        child.closeFuture().addListener(f -> release());
        ctx.fireChannelRead(child);
    }

    private void release() {
        permits.release();
        if (!ctx.executor().isShuttingDown()) {
            ctx.executor().execute(this::drain);
        }
    }

    private void drain() {
        while (!waiting.isEmpty() && permits.tryAcquire()) {
            Channel next = waiting.poll();
            if (!next.isOpen()) {
                permits.release();
                continue;
            }
            admit(next);
        }
        if (waiting.isEmpty() && permits.availablePermits() > 0 && ctx.channel().isOpen()) {
            ctx.channel().config().setAutoRead(true);
        }
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        Channel c;
        while ((c = waiting.poll()) != null) {
            c.unsafe().closeForcibly();
        }
        super.channelInactive(ctx);
    }

    public int availablePermits() {
        return permits.availablePermits();
    }

    /** Accepted clients held back because every permit is in use. */
    public int waitingCount() {
        return waiting.size();
    }
}
