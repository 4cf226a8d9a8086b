package com.errorengine.notify;

import lombok.Value;

@Value
public class DeliveryResult {
    boolean success;
    String message;

    public static DeliveryResult success(String message) {
        return new DeliveryResult(true, message);
    }

    public static DeliveryResult failure(String message) {
        return new DeliveryResult(false, message);
    }
}
