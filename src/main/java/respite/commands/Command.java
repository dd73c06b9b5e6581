package respite.commands;

import respite.protocol.RespValue;
import java.util.List;

public interface Command {
    // Executes the command logic and returns the reply.
    // args.get(0) is the command name. The dispatcher has already checked arity
    // and holds the store lock for the whole call.
    RespValue execute(List<String> args);
}
