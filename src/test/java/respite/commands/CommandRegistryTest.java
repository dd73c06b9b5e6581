package respite.commands;

import org.junit.jupiter.api.Test;
import respite.Config;
import respite.RespiteServerContext;
import respite.db.RespiteDatabase;
import respite.server.ServerStats;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class CommandRegistryTest {

    private CommandRegistry standard() {
        Config config = new Config();
        RespiteDatabase db = new RespiteDatabase(config);
        ServerStats stats = new ServerStats();
        return CommandRegistry.standard(db, new RespiteServerContext(config, db, stats), stats);
    }

    @Test
    public void testStandardTable() {
        CommandRegistry registry = standard();
        assertEquals(Set.of("SET", "GET", "INFO", "COMMAND", "MEMORY", "SAVE", "DBSIZE", "PING"), registry.getAll().keySet());

        CommandContainer set = registry.get("set");
        assertEquals("SET", set.getName());
        assertEquals(3, set.getMetadata().getArity());
        assertEquals(2, registry.get("GET").getMetadata().getArity());
        assertEquals(-1, registry.get("PING").getMetadata().getArity());
        assertNull(registry.get("FLUSHALL"));
    }

    @Test
    public void testArity() {
        CommandMetadata exact = new CommandMetadata(2);
        assertTrue(exact.acceptsArgCount(2));
        assertFalse(exact.acceptsArgCount(1));
        assertFalse(exact.acceptsArgCount(3));

        CommandMetadata atLeast = new CommandMetadata(-2);
        assertFalse(atLeast.acceptsArgCount(1));
        assertTrue(atLeast.acceptsArgCount(2));
        assertTrue(atLeast.acceptsArgCount(9));
    }
}
