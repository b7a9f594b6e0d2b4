package com.alvinliu.weathermcp.weather;

/**
 * Why a weather fetch failed. status is only meaningful for HTTP_ERROR; detail is free text.
 */
public class FetchError {

    public enum Kind {
        MISSING_CREDENTIAL,
        EMPTY_LOCATION,
        INVALID_ARGUMENT,
        NOT_FOUND,
        HTTP_ERROR,
        NETWORK_FAILURE,
        MALFORMED_RESPONSE
    }

    private final Kind kind;
    private final String detail;
    private final int status;

    private FetchError(Kind kind, String detail, int status) {
        this.kind = kind;
        this.detail = detail != null ? detail : "";
        this.status = status;
    }

    public static FetchError missingCredential() {
        return new FetchError(Kind.MISSING_CREDENTIAL, "", 0);
    }

    public static FetchError emptyLocation() {
        return new FetchError(Kind.EMPTY_LOCATION, "", 0);
    }

    public static FetchError invalidArgument(String detail) {
        return new FetchError(Kind.INVALID_ARGUMENT, detail, 0);
    }

    public static FetchError notFound(String location) {
        return new FetchError(Kind.NOT_FOUND, location, 404);
    }

    public static FetchError httpError(int status, String detail) {
        return new FetchError(Kind.HTTP_ERROR, detail, status);
    }

    public static FetchError networkFailure(String detail) {
        return new FetchError(Kind.NETWORK_FAILURE, detail, 0);
    }

    public static FetchError malformedResponse(String detail) {
        return new FetchError(Kind.MALFORMED_RESPONSE, detail, 0);
    }

    public Kind getKind() { return kind; }
    public String getDetail() { return detail; }
    public int getStatus() { return status; }

    @Override
    public String toString() {
        return kind + (status != 0 ? "(" + status + ")" : "") + (detail.isEmpty() ? "" : ": " + detail);
    }
}
