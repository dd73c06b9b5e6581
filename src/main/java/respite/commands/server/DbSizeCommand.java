package respite.commands.server;

import respite.commands.Command;
import respite.db.RespiteDatabase;
import respite.protocol.RespValue;
import java.util.List;

public class DbSizeCommand implements Command {
    private final RespiteDatabase db;

    public DbSizeCommand(RespiteDatabase db) {
        this.db = db;
    }

    @Override
    public RespValue execute(List<String> args) {
        return RespValue.integer(db.size());
    }
}
