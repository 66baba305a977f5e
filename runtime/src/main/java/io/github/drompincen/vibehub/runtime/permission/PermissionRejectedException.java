package io.github.drompincen.vibehub.runtime.permission;

/**
 * Completes a pending permission exceptionally when no human decision will arrive
 * (session aborted, server shutting down). Adapters treat it as a deny.
 */
public class PermissionRejectedException extends RuntimeException {

    public PermissionRejectedException(String message) {
        super(message);
    }
}
