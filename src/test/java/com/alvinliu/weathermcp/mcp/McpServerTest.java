package com.alvinliu.weathermcp.mcp;

import com.alvinliu.weathermcp.log.ConsoleLog;
import com.alvinliu.weathermcp.weather.FetchResult;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for the stdio transport loop in {@link McpServer}.
 */
@Tag("unit")
public class McpServerTest {

    private static ConsoleLog quietLog() {
        return new ConsoleLog(new PrintStream(new ByteArrayOutputStream(), true, StandardCharsets.UTF_8),
            false, System::currentTimeMillis);
    }

    private static ProtocolEngine engine() {
        ToolRegistry registry = ToolRegistry.builder()
            .register(new ToolDescriptor("get_weather", "weather", ToolSchema.object().toJson()),
                args -> FetchResult.success("ok"))
            .build();
        return new ProtocolEngine(registry, quietLog());
    }

    private static String run(MessageHandler handler, String input) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        new McpServer(handler, quietLog(),
            new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8)), out).run();
        return out.toString(StandardCharsets.UTF_8);
    }

    private static List<String> lines(String output) {
        List<String> lines = new ArrayList<>();
        for (String l : output.split("\n", -1)) {
            if (!l.isEmpty()) lines.add(l);
        }
        return lines;
    }

    @Test void testResponsesKeepRequestOrder() throws IOException {
        String output = run(engine(),
            "{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"initialize\"}\n"
                + "{\"jsonrpc\":\"2.0\",\"id\":2,\"method\":\"tools/list\"}\n"
                + "{\"jsonrpc\":\"2.0\",\"id\":3,\"method\":\"tools/call\",\"params\":{\"name\":\"get_weather\"}}\n");
        List<String> lines = lines(output);
        assertEquals(3, lines.size());
        for (int i = 0; i < 3; i++) {
            JsonObject resp = JsonParser.parseString(lines.get(i)).getAsJsonObject();
            assertEquals(i + 1, resp.get("id").getAsInt());
        }
        assertTrue(output.endsWith("\n"));
        assertTrue(!output.contains("\r"), "lines end with a bare newline");
    }

    @Test void testNotificationsAndBlankLinesAreSilent() throws IOException {
        String output = run(engine(),
            "\n   \n{\"jsonrpc\":\"2.0\",\"method\":\"notifications/initialized\"}\n\t\n");
        assertEquals("", output);
    }

    @Test void testParseErrorDoesNotStopTheLoop() throws IOException {
        List<String> lines = lines(run(engine(),
            "not-json-at-all\n{\"jsonrpc\":\"2.0\",\"id\":2,\"method\":\"ping\"}\n"));
        assertEquals(2, lines.size());
        assertEquals("{\"jsonrpc\":\"2.0\",\"id\":null,\"error\":{\"code\":-32700,\"message\":\"Parse error\"}}", lines.get(0));
        assertEquals("{\"jsonrpc\":\"2.0\",\"id\":2,\"result\":{}}", lines.get(1));
    }

    @Test void testLastLineWithoutNewlineIsServed() throws IOException {
        List<String> lines = lines(run(engine(), "{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"ping\"}"));
        assertEquals(1, lines.size());
    }

    @Test void testEmptyInputEndsCleanly() throws IOException {
        assertEquals("", run(engine(), ""));
    }

    @Test void testHandlerFailureReportsInternalErrorAndStops() throws IOException {
        List<String> seen = new ArrayList<>();
        MessageHandler failing = line -> {
            seen.add(line);
            throw new IllegalStateException("handler bug");
        };
        List<String> lines = lines(run(failing, "first\nsecond\n"));
        assertEquals(List.of("first"), seen);
        assertEquals(1, lines.size());
        JsonObject resp = JsonParser.parseString(lines.get(0)).getAsJsonObject();
        assertTrue(resp.get("id").isJsonNull());
        assertEquals(-32603, resp.getAsJsonObject("error").get("code").getAsInt());
    }

    @Test void testEmptyOptionalWritesNothing() throws IOException {
        MessageHandler silent = line -> Optional.empty();
        assertEquals("", run(silent, "a\nb\n"));
    }

    @Test void testBrokenOutputPropagates() {
        OutputStream broken = new OutputStream() {
            @Override
            public void write(int b) throws IOException {
                throw new IOException("Broken pipe");
            }
        };
        McpServer server = new McpServer(engine(), quietLog(),
            new ByteArrayInputStream("{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"ping\"}\n".getBytes(StandardCharsets.UTF_8)),
            broken);
        assertThrows(IOException.class, server::run);
    }

    @Test void testInterruptedThreadStopsBeforeReading() throws IOException {
        List<String> seen = new ArrayList<>();
        MessageHandler recording = line -> {
            seen.add(line);
            return Optional.empty();
        };
        Thread.currentThread().interrupt();
        try {
            run(recording, "a\n");
        } finally {
            Thread.interrupted();
        }
        assertTrue(seen.isEmpty());
    }
}
