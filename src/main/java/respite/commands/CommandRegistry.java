package respite.commands;

import respite.ServerContext;
import respite.commands.connection.PingCommand;
import respite.commands.server.CommandInfoCommand;
import respite.commands.server.DbSizeCommand;
import respite.commands.server.InfoCommand;
import respite.commands.server.MemoryCommand;
import respite.commands.server.SaveCommand;
import respite.commands.string.GetCommand;
import respite.commands.string.SetCommand;
import respite.db.RespiteDatabase;
import respite.server.ServerStats;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

public class CommandRegistry {
    private final Map<String, CommandContainer> commands = new LinkedHashMap<>();

    /** The full command table of a running server. */
    public static CommandRegistry standard(RespiteDatabase db, ServerContext context, ServerStats stats) {
        CommandRegistry registry = new CommandRegistry();

        // String
        registry.register("SET", new SetCommand(db, stats), new CommandMetadata(3));
        registry.register("GET", new GetCommand(db, stats), new CommandMetadata(2));

        // Server
        registry.register("INFO", new InfoCommand(context), new CommandMetadata(-1));
        registry.register("COMMAND", new CommandInfoCommand(), new CommandMetadata(-1));
        registry.register("MEMORY", new MemoryCommand(db), new CommandMetadata(-1));
        registry.register("SAVE", new SaveCommand(db), new CommandMetadata(-1));
        registry.register("DBSIZE", new DbSizeCommand(db), new CommandMetadata(1));

        // Connection
        registry.register("PING", new PingCommand(), new CommandMetadata(-1));

        return registry;
    }

    public void register(String name, Command command, CommandMetadata metadata) {
        String key = name.toUpperCase(Locale.ROOT);
        commands.put(key, new CommandContainer(key, command, metadata));
    }

    /** Case-insensitive lookup; null when no such command exists. */
    public CommandContainer get(String name) {
        return commands.get(name.toUpperCase(Locale.ROOT));
    }

    public Map<String, CommandContainer> getAll() {
        return Collections.unmodifiableMap(commands);
    }
}
