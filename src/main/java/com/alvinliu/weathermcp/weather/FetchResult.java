package com.alvinliu.weathermcp.weather;

import java.util.Objects;

/**
 * Either a display string or a {@link FetchError}, never both.
 */
public final class FetchResult {
    private final String text;
    private final FetchError error;

    private FetchResult(String text, FetchError error) {
        this.text = text;
        this.error = error;
    }

    public static FetchResult success(String text) {
        return new FetchResult(Objects.requireNonNull(text, "text"), null);
    }

    public static FetchResult failure(FetchError error) {
        return new FetchResult(null, Objects.requireNonNull(error, "error"));
    }

    public boolean isSuccess() { return error == null; }

    /** Report text; null on failure. */
    public String getText() { return text; }

    /** Failure reason; null on success. */
    public FetchError getError() { return error; }

    @Override
    public String toString() {
        return isSuccess() ? "FetchResult[success]" : "FetchResult[" + error + "]";
    }
}
