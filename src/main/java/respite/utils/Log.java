package respite.utils;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.logging.ConsoleHandler;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.logging.LogRecord;
import java.util.logging.SimpleFormatter;

public class Log {
    private static final Logger logger = Logger.getLogger("Respite");
    private static final ConsoleHandler handler = new ConsoleHandler();
    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("dd MMM yyyy HH:mm:ss.SSS");

    static {
        logger.setUseParentHandlers(false);
        handler.setFormatter(new SimpleFormatter() {
            @Override
            public synchronized String format(LogRecord record) {
                String levelStr = record.getLevel() == Level.SEVERE ? "ERROR" :
                                  record.getLevel() == Level.WARNING ? "WARN" :
                                  record.getLevel() == Level.INFO ? "INFO" : "DEBUG";
                String line = String.format("%s [%s] %s%n", LocalDateTime.now().format(TIME), levelStr, record.getMessage());
                if (record.getThrown() != null) {
                    line += record.getThrown() + System.lineSeparator();
                }
                return line;
            }
        });
        handler.setLevel(Level.ALL);
        logger.addHandler(handler);
        logger.setLevel(Level.INFO);
    }

    /**
     * Sets the threshold from a name such as {@code debug}, {@code info}, {@code warn} or
     * {@code error}. Unknown names leave the level unchanged and return false.
     */
    public static boolean setLevel(String name) {
        Level level;
        switch (name == null ? "" : name.trim().toUpperCase(Locale.ROOT)) {
            case "DEBUG": case "FINE": level = Level.FINE; break;
            case "INFO": level = Level.INFO; break;
            case "WARN": case "WARNING": level = Level.WARNING; break;
            case "ERROR": case "SEVERE": level = Level.SEVERE; break;
            case "OFF": level = Level.OFF; break;
            default: return false;
        }
        logger.setLevel(level);
        return true;
    }

    public static boolean isDebugEnabled() {
        return logger.isLoggable(Level.FINE);
    }

    public static void info(String msg) {
        logger.info(msg);
    }

    public static void warn(String msg) {
        logger.warning(msg);
    }

    public static void error(String msg) {
        logger.severe(msg);
    }

    public static void error(String msg, Throwable t) {
        logger.log(Level.SEVERE, msg, t);
    }

    public static void debug(String msg) {
        logger.fine(msg);
    }
}
