package com.alvinliu.weathermcp.mcp;

import com.alvinliu.weathermcp.log.ConsoleLog;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.InterruptedIOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * MCP server transport: newline-delimited JSON-RPC 2.0 over a byte stream pair (stdio in production).
 * Strictly sequential, one line in and at most one line out, so replies keep request order.
 */
public class McpServer {
    private final MessageHandler handler;
    private final ConsoleLog log;
    private final BufferedReader reader;
    private final BufferedWriter writer;

    public McpServer(MessageHandler handler, ConsoleLog log, InputStream in, OutputStream out) {
        this.handler = handler;
        this.log = log;
        this.reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        this.writer = new BufferedWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8));
    }

    /**
     * Serve until end of input or thread interrupt. Blank lines are skipped.
     *
     * @throws IOException if reading input or writing a reply fails (e.g. the client closed the pipe)
     */
    public void run() throws IOException {
        while (!Thread.currentThread().isInterrupted()) {
            String line;
            try {
                line = reader.readLine();
            } catch (InterruptedIOException e) {
                log.info("Interrupted, stopping");
                return;
            }
            if (line == null) {
                log.verbose("End of input, stopping");
                return;
            }
            if (line.trim().isEmpty()) continue;

            Optional<String> response;
            try {
                response = handler.handle(line);
            } catch (RuntimeException e) {
                log.error("Unhandled error while processing a message", e);
                writeBestEffort(JsonRpc.toLine(JsonRpc.error(null, JsonRpc.INTERNAL_ERROR, "Internal error: "
                    + (e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName()))));
                return;
            }
            if (response != null && response.isPresent() && !response.get().isEmpty()) {
                writeLine(response.get());
            }
        }
        log.info("Interrupted, stopping");
    }

    private void writeLine(String line) throws IOException {
        writer.write(line);
        writer.write('\n');
        writer.flush();
    }

    private void writeBestEffort(String line) {
        try {
            writeLine(line);
        } catch (IOException e) {
            log.error("Could not report internal error to client", e);
        }
    }
}
