package com.errorengine.notify;

import com.errorengine.model.NotificationKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The notifications one cycle will send, NEW entries first.
 */
public class DeliveryPlan {

    private final List<DeliveryPlanEntry> entries = new ArrayList<>();

    public void addAll(List<DeliveryPlanEntry> more) {
        entries.addAll(more);
    }

    public List<DeliveryPlanEntry> getEntries() {
        return Collections.unmodifiableList(entries);
    }

    public List<DeliveryPlanEntry> entriesOf(NotificationKind kind) {
        return entries.stream().filter(e -> e.getKind() == kind).toList();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int size() {
        return entries.size();
    }
}
