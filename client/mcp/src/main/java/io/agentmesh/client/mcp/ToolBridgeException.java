package io.agentmesh.client.mcp;

public class ToolBridgeException extends Exception {

    private final ToolError error;

    public ToolBridgeException(ToolError error) {
        super(error.message());
        this.error = error;
    }

    public ToolBridgeException(ToolError error, Throwable cause) {
        super(error.message(), cause);
        this.error = error;
    }

    public ToolError getError() {
        return error;
    }
}
