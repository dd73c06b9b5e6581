package respite.commands;

import respite.protocol.RespValue;

import java.util.Locale;

/**
 * Error replies. The first word of each message is its category, so clients and logs can
 * tell them apart: ERR (request or protocol problem), OOM (memory ceiling), IOERR (disk).
 */
public final class Errors {
    public static final String INVALID_FORMAT = "ERR invalid command format";
    public static final String MAX_MEMORY = "OOM command not allowed when used memory would exceed 'maxmemory'";

    private Errors() {
    }

    public static RespValue invalidFormat() {
        return RespValue.error(INVALID_FORMAT);
    }

    public static RespValue unknownCommand(String name) {
        return RespValue.error("ERR unknown command '" + oneLine(name) + "'");
    }

    public static RespValue wrongArity(String name) {
        return RespValue.error("ERR wrong number of arguments for '" + oneLine(name).toLowerCase(Locale.ROOT) + "' command");
    }

    public static RespValue unknownSubcommand(String sub, String hint) {
        return RespValue.error("ERR unknown subcommand '" + oneLine(sub) + "'. Try " + hint + ".");
    }

    public static RespValue maxMemory() {
        return RespValue.error(MAX_MEMORY);
    }

    public static RespValue saveFailed(Exception cause) {
        return RespValue.error("IOERR saving to disk: " + oneLine(String.valueOf(cause.getMessage())));
    }

    public static RespValue protocol(String detail) {
        return RespValue.error("ERR Protocol error: " + oneLine(detail));
    }

    public static RespValue internal(String message) {
        return RespValue.error("ERR " + oneLine(message));
    }

    private static String oneLine(String s) {
        return s.replace('\r', ' ').replace('\n', ' ');
    }
}
