package io.github.drompincen.vibehub.protocol.api;

/**
 * Outcome of handing a message to another session.
 */
public record DeliveryResult(
        boolean success,
        boolean delivered,
        boolean queued,
        String error
) {
    public static DeliveryResult deliveredNow() {
        return new DeliveryResult(true, true, false, null);
    }

    public static DeliveryResult queuedForLater() {
        return new DeliveryResult(true, false, true, null);
    }

    public static DeliveryResult failed(String error) {
        return new DeliveryResult(false, false, false, error);
    }
}
