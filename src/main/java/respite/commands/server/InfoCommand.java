package respite.commands.server;

import respite.ServerContext;
import respite.commands.Command;
import respite.protocol.RespValue;
import java.util.List;
import java.util.Locale;

public class InfoCommand implements Command {
    private final ServerContext context;

    public InfoCommand(ServerContext context) {
        this.context = context;
    }

    @Override
    public RespValue execute(List<String> args) {
        String section = "all";
        if (args.size() > 1) {
            section = args.get(1).toLowerCase(Locale.ROOT);
        }

        StringBuilder info = new StringBuilder();
        boolean all = section.equals("all") || section.equals("default") || section.equals("everything");

        if (all || section.equals("server")) appendServer(info);
        if (all || section.equals("clients")) appendClients(info);
        if (all || section.equals("memory")) appendMemory(info);
        if (all || section.equals("persistence")) appendPersistence(info);
        if (all || section.equals("stats")) appendStats(info);
        if (all || section.equals("cpu")) appendCpu(info);
        if (all || section.equals("keyspace")) appendKeyspace(info);

        return RespValue.bulkString(info.toString());
    }

    private void appendServer(StringBuilder info) {
        info.append("# Server\r\n");
        info.append("redis_version:").append(context.getVersion()).append("\r\n");
        info.append("respite_version:").append(context.getVersion()).append("\r\n");
        info.append("redis_mode:standalone\r\n");
        info.append("os:").append(context.getOsName()).append(" ").append(context.getOsArch()).append("\r\n");
        info.append("java_version:").append(context.getJavaVersion()).append("\r\n");
        info.append("tcp_port:").append(context.getPort()).append("\r\n");
        info.append("uptime_in_seconds:").append(context.getUptime() / 1000).append("\r\n");
        info.append("\r\n");
    }

    private void appendClients(StringBuilder info) {
        info.append("# Clients\r\n");
        info.append("connected_clients:").append(context.getActiveConnections()).append("\r\n");
        info.append("maxclients:").append(context.getMaxConnections()).append("\r\n");
        info.append("\r\n");
    }

    private void appendMemory(StringBuilder info) {
        info.append("# Memory\r\n");
        info.append("used_memory:").append(context.getUsedMemory()).append("\r\n");
        info.append("maxmemory:").append(context.getMaxMemory()).append("\r\n");
        info.append("\r\n");
    }

    private void appendPersistence(StringBuilder info) {
        info.append("# Persistence\r\n");
        info.append("persistence_enabled:").append(context.isPersistenceEnabled() ? 1 : 0).append("\r\n");
        info.append("rdb_last_save_time:").append(context.getLastSaveTime()).append("\r\n");
        info.append("\r\n");
    }

    private void appendStats(StringBuilder info) {
        info.append("# Stats\r\n");
        info.append("total_connections_received:").append(context.getTotalConnectionsReceived()).append("\r\n");
        info.append("total_commands_processed:").append(context.getTotalCommandsProcessed()).append("\r\n");
        info.append("keyspace_hits:").append(context.getKeyspaceHits()).append("\r\n");
        info.append("keyspace_misses:").append(context.getKeyspaceMisses()).append("\r\n");
        info.append("rejected_writes:").append(context.getRejectedWrites()).append("\r\n");
        info.append("protocol_errors:").append(context.getProtocolErrors()).append("\r\n");
        info.append("\r\n");
    }

    private void appendCpu(StringBuilder info) {
        info.append("# CPU\r\n");
        info.append("available_processors:").append(context.getAvailableProcessors()).append("\r\n");
        info.append("\r\n");
    }

    private void appendKeyspace(StringBuilder info) {
        info.append("# Keyspace\r\n");
        if (context.getDbSize() > 0) {
            info.append("db0:keys=").append(context.getDbSize()).append(",expires=0,avg_ttl=0\r\n");
        }
        info.append("\r\n");
    }
}
