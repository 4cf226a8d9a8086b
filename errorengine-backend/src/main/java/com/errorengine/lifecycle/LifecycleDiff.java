package com.errorengine.lifecycle;

import com.errorengine.model.ActiveError;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Result of diffing one fetch against the unresolved errors of a query.
 */
@Value
@Builder
public class LifecycleDiff {
    /** Errors seen for the first time (kind NEW); ids are assigned when the diff is stored. */
    List<ActiveError> created;
    /** Errors still present, with refreshed last-seen, occurrence count and snapshot. */
    List<ActiveError> continuing;
    /** Errors absent from the fetch, now resolved. */
    List<ActiveError> resolved;
    int rowsFetched;

    public boolean isEmpty() {
        return created.isEmpty() && continuing.isEmpty() && resolved.isEmpty();
    }
}
