package com.errorengine.notify;

import com.errorengine.model.NotificationKind;
import lombok.Value;

import java.util.List;

@Value
public class DeliveryPlanEntry {
    Destination destination;
    NotificationKind kind;
    List<ErrorContext> errors;
}
