package respite.commands.server;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import respite.db.RespiteDatabase;
import respite.protocol.RespValue;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class MemoryCommandTest {

    private RespiteDatabase db;
    private MemoryCommand command;

    @BeforeEach
    void setUp() {
        db = new RespiteDatabase(0, null);
        command = new MemoryCommand(db);
    }

    @Test
    void testTotalUsage() {
        assertEquals(RespValue.integer(0), command.execute(List.of("MEMORY")));
        db.insert("key1", "value1");
        assertEquals(RespValue.integer(10), command.execute(List.of("MEMORY")));
    }

    @Test
    void testUsageOfKey() {
        db.insert("key1", "value1");
        db.insert("k", "v");
        assertEquals(RespValue.integer(10), command.execute(List.of("MEMORY", "usage", "key1")));
        assertTrue(command.execute(List.of("MEMORY", "USAGE", "missing")).isNull());
    }

    @Test
    void testBadSubcommand() {
        RespValue reply = command.execute(List.of("MEMORY", "DOCTOR"));
        assertEquals(RespValue.Type.ERROR, reply.getType());
        assertTrue(reply.getText().startsWith("ERR unknown subcommand 'DOCTOR'"));

        reply = command.execute(List.of("MEMORY", "USAGE"));
        assertEquals("ERR wrong number of arguments for 'memory|usage' command", reply.getText());
    }
}
