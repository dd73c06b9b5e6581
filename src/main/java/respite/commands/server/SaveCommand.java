package respite.commands.server;

import respite.commands.Command;
import respite.commands.Errors;
import respite.db.RespiteDatabase;
import respite.protocol.RespValue;
import respite.utils.Log;
import java.io.IOException;
import java.util.List;

public class SaveCommand implements Command {
    private final RespiteDatabase db;

    public SaveCommand(RespiteDatabase db) {
        this.db = db;
    }

    @Override
    public RespValue execute(List<String> args) {
        try {
            db.save();
            return RespValue.ok();
        } catch (IOException e) {
            Log.error("Save failed: " + e.getMessage());
            return Errors.saveFailed(e);
        }
    }
}
