package respite.commands;

import respite.db.RespiteDatabase;
import respite.protocol.RespValue;
import respite.server.ServerStats;
import respite.utils.Log;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a decoded request into a reply. A request must be a non-empty array of
 * non-null bulk strings; its first element names the command, case-insensitively.
 * Each command runs entirely under the store lock, so commands from different
 * connections apply one at a time.
 */
public class CommandDispatcher {
    private final CommandRegistry registry;
    private final RespiteDatabase db;
    private final ServerStats stats;

    public CommandDispatcher(CommandRegistry registry, RespiteDatabase db, ServerStats stats) {
        this.registry = registry;
        this.db = db;
        this.stats = stats;
    }

    public RespValue dispatch(RespValue request) {
        List<String> args = toArgs(request);
        if (args == null) return Errors.invalidFormat();

        String name = args.get(0);
        CommandContainer container = registry.get(name);
        if (container == null) return Errors.unknownCommand(name);
        if (!container.getMetadata().acceptsArgCount(args.size())) return Errors.wrongArity(container.getName());

        stats.totalCommands.incrementAndGet();
        try {
            return db.atomically(() -> container.getCommand().execute(args));
        } catch (RuntimeException e) {
            Log.error("Command " + container.getName() + " failed", e);
            return Errors.internal(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    /** Arguments of a well-formed request, or null if the value is not a valid request. */
    static List<String> toArgs(RespValue request) {
        if (request == null || request.getType() != RespValue.Type.ARRAY) return null;
        List<RespValue> elements = request.getElements();
        if (elements.isEmpty()) return null;

        List<String> args = new ArrayList<>(elements.size());
        for (RespValue e : elements) {
            if (e.getType() != RespValue.Type.BULK_STRING || e.isNull()) return null;
            args.add(e.getText());
        }
        return args;
    }

}
