package respite.commands.server;

import respite.commands.Command;
import respite.commands.Errors;
import respite.db.RespiteDatabase;
import respite.protocol.RespValue;
import java.util.List;
import java.util.Locale;

public class MemoryCommand implements Command {
    private final RespiteDatabase db;

    public MemoryCommand(RespiteDatabase db) {
        this.db = db;
    }

    @Override
    public RespValue execute(List<String> args) {
        if (args.size() < 2) {
            return RespValue.integer(db.memoryUsage());
        }

        String sub = args.get(1).toUpperCase(Locale.ROOT);
        if (sub.equals("USAGE")) {
            if (args.size() != 3) {
                return Errors.wrongArity("memory|usage");
            }
            String key = args.get(2);
            String value = db.get(key);
            return value == null ? RespValue.nullBulkString() : RespValue.integer(RespiteDatabase.entrySize(key, value));
        }
        return Errors.unknownSubcommand(args.get(1), "USAGE");
    }
}
