package respite.commands.server;

import respite.commands.Command;
import respite.protocol.RespValue;
import java.util.List;

/**
 * COMMAND. Clients such as redis-cli send it on connect to discover command metadata;
 * an empty reply tells them to fall back to their built-in tables.
 */
public class CommandInfoCommand implements Command {
    @Override
    public RespValue execute(List<String> args) {
        return RespValue.emptyArray();
    }
}
