package com.alvinliu.weathermcp.mcp;

import java.util.Optional;

/**
 * Turns one input line into at most one output line.
 */
public interface MessageHandler {
    Optional<String> handle(String line);
}
