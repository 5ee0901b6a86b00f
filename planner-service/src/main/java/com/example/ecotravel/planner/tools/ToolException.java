package com.example.ecotravel.planner.tools;

import com.example.ecotravel.planner.domain.ErrorKind;

/**
 * Failure raised by a tool handler. The dispatcher turns it into a failed {@link ToolResult}.
 */
public class ToolException extends Exception {

    private final ErrorKind kind;

    public ToolException(String message) {
        this(ErrorKind.TOOL_UNAVAILABLE, message, null);
    }

    public ToolException(String message, Throwable cause) {
        this(ErrorKind.TOOL_UNAVAILABLE, message, cause);
    }

    public ToolException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
