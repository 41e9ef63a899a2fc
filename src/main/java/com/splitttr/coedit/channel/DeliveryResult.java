package com.splitttr.coedit.channel;

public record DeliveryResult(boolean delivered, Throwable cause) {

    private static final DeliveryResult DELIVERED = new DeliveryResult(true, null);

    public static DeliveryResult ok() {
        return DELIVERED;
    }

    public static DeliveryResult failed(Throwable cause) {
        return new DeliveryResult(false, cause);
    }

    public String describe() {
        if (delivered) return "delivered";
        return cause == null ? "unknown failure" : cause.getClass().getSimpleName() + ": " + cause.getMessage();
    }
}
