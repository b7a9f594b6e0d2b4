package com.alvinliu.weathermcp.log;

import java.io.PrintStream;
import java.util.function.LongSupplier;

/**
 * Diagnostics on stderr. stdout carries protocol data only, so nothing here may ever write there.
 * Verbose lines are gated by WEATHER_MCP_CONSOLE_LOG and a repeated message within 2s is dropped.
 */
public class ConsoleLog {
    private static final String PREFIX = "[weather_mcp] ";
    private static final long REPEAT_WINDOW_MS = 2000;

    private final PrintStream err;
    private final boolean verbose;
    private final LongSupplier clock;
    private String lastVerboseMsg;
    private long lastVerboseAt;

    public ConsoleLog(boolean verbose) {
        this(System.err, verbose, System::currentTimeMillis);
    }

    public ConsoleLog(PrintStream err, boolean verbose, LongSupplier clock) {
        this.err = err;
        this.verbose = verbose;
        this.clock = clock;
    }

    public boolean isVerbose() { return verbose; }

    public void info(String msg) {
        err.println(PREFIX + msg);
    }

    public void error(String msg) {
        err.println(PREFIX + "error: " + msg);
    }

    public void error(String msg, Throwable t) {
        String detail = t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
        err.println(PREFIX + "error: " + msg + ": " + detail);
    }

    public synchronized void verbose(String msg) {
        if (!verbose) return;
        long now = clock.getAsLong();
        if (msg.equals(lastVerboseMsg) && (now - lastVerboseAt) < REPEAT_WINDOW_MS) return;
        lastVerboseMsg = msg;
        lastVerboseAt = now;
        err.println(PREFIX + "[debug] " + msg);
    }
}
