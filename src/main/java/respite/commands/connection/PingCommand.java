package respite.commands.connection;

import respite.commands.Command;
import respite.commands.Errors;
import respite.protocol.RespValue;
import java.util.List;

public class PingCommand implements Command {
    @Override
    public RespValue execute(List<String> args) {
        if (args.size() > 2) {
            return Errors.wrongArity("ping");
        }
        if (args.size() == 2) {
            return RespValue.bulkString(args.get(1));
        }
        return RespValue.simpleString("PONG");
    }
}
