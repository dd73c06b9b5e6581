package respite.commands.server;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import respite.protocol.RespValue;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InfoCommandTest {

    private MockServerContext context;
    private InfoCommand command;

    @BeforeEach
    void setUp() {
        context = new MockServerContext();
        command = new InfoCommand(context);
    }

    private String info(String... args) {
        RespValue reply = command.execute(List.of(args));
        assertEquals(RespValue.Type.BULK_STRING, reply.getType());
        return reply.getText();
    }

    @Test
    void testInfoDefault() {
        String response = info("INFO");

        assertTrue(response.contains("# Server"), "Should contain Server section");
        assertTrue(response.contains("# Clients"), "Should contain Clients section");
        assertTrue(response.contains("# Memory"), "Should contain Memory section");
        assertTrue(response.contains("# Persistence"), "Should contain Persistence section");
        assertTrue(response.contains("# Stats"), "Should contain Stats section");
        assertTrue(response.contains("# Keyspace"), "Should contain Keyspace section");
        assertTrue(response.contains("\r\n"), "Should use CRLF");
    }

    @Test
    void testInfoSection() {
        String response = info("INFO", "memory");

        assertTrue(response.contains("# Memory"), "Should contain Memory section");
        assertFalse(response.contains("# Server"), "Should NOT contain Server section");
    }

    @Test
    void testInfoCaseInsensitive() {
        assertTrue(info("INFO", "MEMORY").contains("# Memory"));
        assertTrue(info("INFO", "Everything").contains("# CPU"));
    }

    @Test
    void testUnknownSectionIsEmpty() {
        assertEquals("", info("INFO", "nonsense"));
    }

    @Test
    void testDynamicValues() {
        String response = info("INFO");

        assertTrue(response.contains("respite_version:1.0.0-TEST\r\n"), "Should verify version from context");
        assertTrue(response.contains("tcp_port:6379\r\n"), "Should verify port from context");
        assertTrue(response.contains("uptime_in_seconds:10\r\n"));
        assertTrue(response.contains("connected_clients:5\r\n"));
        assertTrue(response.contains("used_memory:1024\r\n"));
        assertTrue(response.contains("maxmemory:2048\r\n"));
        assertTrue(response.contains("persistence_enabled:1\r\n"));
        assertTrue(response.contains("keyspace_hits:7\r\n"));
        assertTrue(response.contains("rejected_writes:4\r\n"));
        assertTrue(response.contains("protocol_errors:2\r\n"));
        assertTrue(response.contains("db0:keys=2,expires=0,avg_ttl=0\r\n"));
    }

    @Test
    void testEmptyKeyspace() {
        context.dbSize = 0;
        context.persistence = false;
        String response = info("INFO");
        assertFalse(response.contains("db0:"));
        assertTrue(response.contains("persistence_enabled:0\r\n"));
    }
}
