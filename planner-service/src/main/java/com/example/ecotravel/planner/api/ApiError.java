package com.example.ecotravel.planner.api;

/**
 * Error body of the planner API. {@code retryable} tells clients whether the same request may
 * succeed later without changes.
 */
public class ApiError {
    private final int status;
    private final String code;
    private final String message;
    private final String path;
    private final boolean retryable;

    public ApiError(int status, String code, String message, String path, boolean retryable) {
        this.status = status;
        this.code = code;
        this.message = message;
        this.path = path;
        this.retryable = retryable;
    }

    public int getStatus() { return status; }
    public String getCode() { return code; }
    public String getMessage() { return message; }
    public String getPath() { return path; }
    public boolean isRetryable() { return retryable; }
}
