package respite;

import respite.commands.CommandDispatcher;
import respite.commands.CommandRegistry;
import respite.db.RespiteDatabase;
import respite.network.AdmissionControlHandler;
import respite.network.ClientHandler;
import respite.protocol.netty.NettyRespDecoder;
import respite.protocol.netty.NettyRespEncoder;
import respite.server.ServerStats;
import respite.utils.Log;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.FixedRecvByteBufAllocator;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.timeout.ReadTimeoutHandler;

import java.io.Closeable;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.concurrent.TimeUnit;

/**
 * Project: Respite
 * A single-node, in-memory key/value server speaking RESP.
 */
public class Respite implements Closeable {

    private final Config config;
    private final ServerStats stats;
    private final RespiteDatabase db;
    private final CommandDispatcher dispatcher;

    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private Channel serverChannel;

    public Respite(Config config) {
        this(config, new RespiteDatabase(config));
    }

    public Respite(Config config, RespiteDatabase db) {
        this.config = config;
        this.db = db;
        this.stats = new ServerStats();
        ServerContext context = new RespiteServerContext(config, db, stats);
        this.dispatcher = new CommandDispatcher(CommandRegistry.standard(db, context, stats), db, stats);
    }

    public static void printBanner(Config config) {
        Log.info("\n" +
                "    ____                        _ __     \n" +
                "   / __ \\___  _________  ____  (_) /____ \n" +
                "  / /_/ / _ \\/ ___/ __ \\/ __ \\/ / __/ _ \\\n" +
                " / _, _/  __(__  ) /_/ / /_/ / / /_/  __/\n" +
                "/_/ |_|\\___/____/ .___/ .___/_/\\__/\\___/ \n" +
                "               /_/   /_/                 \n" +
                " :: Respite ::      (v" + config.version + ") \n" +
                " :: Engine ::       Java " + System.getProperty("java.version") + " / Netty \n");
    }

    /**
     * Binds the listener and starts accepting clients.
     *
     * @return the bound address (useful when the configured port is 0)
     * @throws IOException if the address cannot be bound
     */
    public InetSocketAddress start() throws IOException {
        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup(config.workerThreads);
        AdmissionControlHandler admission = new AdmissionControlHandler(config.maxConnections);
        NettyRespEncoder encoder = new NettyRespEncoder();

        ServerBootstrap b = new ServerBootstrap();
        b.group(bossGroup, workerGroup)
         .channel(NioServerSocketChannel.class)
         .handler(admission)
         .childOption(ChannelOption.RCVBUF_ALLOCATOR, new FixedRecvByteBufAllocator(config.bufferSize))
         .childOption(ChannelOption.TCP_NODELAY, true)
         .childHandler(new ChannelInitializer<SocketChannel>() {
             @Override
             public void initChannel(SocketChannel ch) throws Exception {
                 if (config.idleTimeoutSeconds > 0) {
                     ch.pipeline().addLast(new ReadTimeoutHandler(config.idleTimeoutSeconds));
                 }
                 ch.pipeline().addLast(new NettyRespDecoder());
                 ch.pipeline().addLast(encoder);
                 ch.pipeline().addLast(new ClientHandler(dispatcher, stats));
             }
         });

        ChannelFuture f = b.bind(config.bind, config.port).awaitUninterruptibly();
        if (!f.isSuccess()) {
            shutdownGroups();
            throw new IOException("Cannot bind " + config.bind + ":" + config.port, f.cause());
        }
        serverChannel = f.channel();

        final long[] lastCount = {0};
        bossGroup.scheduleAtFixedRate(() -> {
            long currentCount = stats.totalCommands.get();
            long ops = (currentCount - lastCount[0]) / 5;
            lastCount[0] = currentCount;
            if (ops > 0 || stats.activeConnections.get() > 0) {
                Log.info(String.format("[STATS] Clients: %d | Keys: %d | Memory: %d bytes | OPS: %d cmd/s",
                        stats.activeConnections.get(), db.size(), db.memoryUsage(), ops));
            }
        }, 5, 5, TimeUnit.SECONDS);

        InetSocketAddress address = (InetSocketAddress) serverChannel.localAddress();
        Log.info("Ready on " + address.getHostString() + ":" + address.getPort());
        Log.info("Max Memory: " + (config.maxMemory <= 0 ? "Unlimited" : config.maxMemory + " bytes")
                + " | Max Clients: " + config.maxConnections
                + " | Persistence: " + (db.isPersistenceEnabled() ? config.snapshotFile : "disabled"));
        return address;
    }

    /** Blocks until the listener is closed. */
    public void awaitTermination() throws InterruptedException {
        if (serverChannel != null) serverChannel.closeFuture().sync();
    }

    /** Stops accepting, closes every connection and releases the event loops. Idempotent. */
    @Override
    public void close() {
        if (serverChannel != null) {
            serverChannel.close().awaitUninterruptibly();
        }
        shutdownGroups();
    }

    private void shutdownGroups() {
        if (bossGroup != null) bossGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS).awaitUninterruptibly();
        if (workerGroup != null) workerGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS).awaitUninterruptibly();
    }

    public RespiteDatabase getDatabase() {
        return db;
    }

    public ServerStats getStats() {
        return stats;
    }

    public static void main(String[] args) throws Exception {
        String configFile = args.length > 0 ? args[0] : Config.DEFAULT_FILE;

        Config config;
        try {
            config = Config.load(configFile);
        } catch (IllegalArgumentException e) {
            Log.error("Invalid configuration: " + e.getMessage());
            System.exit(1);
            return;
        }
        if (!Log.setLevel(config.logLevel)) {
            Log.warn("Unknown log level '" + config.logLevel + "', keeping INFO.");
        }

        printBanner(config);

        Respite server = new Respite(config);
        try {
            server.getDatabase().load();
        } catch (IOException e) {
            // Refuse to start rather than overwrite a snapshot we could not read.
            Log.error("Load failed: " + e.getMessage());
            System.exit(1);
            return;
        }

        try {
            server.start();
        } catch (IOException e) {
            Log.error(e.getMessage() + ": " + e.getCause());
            server.close();
            System.exit(1);
            return;
        }

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            Log.info("Shutting down...");
            server.close();
            try {
                server.getDatabase().save();
            } catch (IOException e) {
                Log.error("Save failed: " + e.getMessage());
            }
        }, "shutdown"));

        server.awaitTermination();
    }
}
