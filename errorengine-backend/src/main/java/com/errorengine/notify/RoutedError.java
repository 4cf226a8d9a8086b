package com.errorengine.notify;

import com.errorengine.model.ActiveError;
import com.errorengine.routing.RoutingDecision;
import lombok.Value;

@Value
public class RoutedError {
    ActiveError error;
    RoutingDecision decision;
}
