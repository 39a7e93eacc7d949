package io.agentmesh.spec;

import static io.agentmesh.spec.AgentMeshErrorCodes.INVALID_PARAMS_ERROR_CODE;

import org.jspecify.annotations.Nullable;

/**
 * Method parameters are missing or do not match the method's schema.
 */
public class InvalidParamsError extends JSONRPCError {

    public InvalidParamsError() {
        this("Invalid parameters");
    }

    public InvalidParamsError(String message) {
        this(message, null);
    }

    public InvalidParamsError(String message, @Nullable Object data) {
        super(INVALID_PARAMS_ERROR_CODE, message, data);
    }
}
