package respite.commands.string;

import respite.commands.Command;
import respite.db.RespiteDatabase;
import respite.protocol.RespValue;
import respite.server.ServerStats;
import java.util.List;

public class GetCommand implements Command {
    private final RespiteDatabase db;
    private final ServerStats stats;

    public GetCommand(RespiteDatabase db, ServerStats stats) {
        this.db = db;
        this.stats = stats;
    }

    @Override
    public RespValue execute(List<String> args) {
        String value = db.get(args.get(1));
        if (value == null) {
            stats.keyspaceMisses.incrementAndGet();
            return RespValue.nullBulkString();
        }
        stats.keyspaceHits.incrementAndGet();
        return RespValue.bulkString(value);
    }
}
