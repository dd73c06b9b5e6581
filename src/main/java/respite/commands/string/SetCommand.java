package respite.commands.string;

import respite.commands.Command;
import respite.commands.Errors;
import respite.db.RespiteDatabase;
import respite.protocol.RespValue;
import respite.server.ServerStats;
import java.util.List;

public class SetCommand implements Command {
    private final RespiteDatabase db;
    private final ServerStats stats;

    public SetCommand(RespiteDatabase db, ServerStats stats) {
        this.db = db;
        this.stats = stats;
    }

    @Override
    public RespValue execute(List<String> args) {
        String key = args.get(1);
        String val = args.get(2);

        if (!db.insert(key, val)) {
            stats.rejectedWrites.incrementAndGet();
            return Errors.maxMemory();
        }
        return RespValue.ok();
    }
}
