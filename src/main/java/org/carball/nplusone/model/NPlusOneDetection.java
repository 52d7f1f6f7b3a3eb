package org.carball.nplusone.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A group of same-shape queries fired from one call site often enough to be reported.
 *
 * @param queries     raw SQL in order of occurrence, duplicates kept
 * @param callStack   stack captured when the call site first repeated
 * @param callSiteKey digest identifying the call site
 * @param fingerprint normalized shape shared by every query in the group
 */
public record NPlusOneDetection(
        List<String> queries,
        List<String> callStack,
        String callSiteKey,
        String fingerprint
) {

    public NPlusOneDetection {
        queries = List.copyOf(queries);
        callStack = Collections.unmodifiableList(new ArrayList<>(callStack));
    }

    public int queryCount() {
        return queries.size();
    }
}
