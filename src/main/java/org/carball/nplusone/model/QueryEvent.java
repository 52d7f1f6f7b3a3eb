package org.carball.nplusone.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One data-access event observed by the capture layer.
 *
 * @param sql       raw SQL text as sent to the database
 * @param dialect   engine the statement ran against, {@code null} for the tracker default
 * @param cached    whether the result was served from a query cache
 * @param name      operation name reported by the data-access layer, {@code SCHEMA} for introspection
 * @param callStack frames of the executing thread, innermost first
 */
public record QueryEvent(
        String sql,
        Dialect dialect,
        boolean cached,
        String name,
        List<String> callStack
) {

    public static final String SCHEMA_OPERATION = "SCHEMA";

    public QueryEvent {
        // null frames are kept
        callStack = callStack == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(callStack));
    }

    public static QueryEvent of(String sql, List<String> callStack) {
        return new QueryEvent(sql, null, false, null, callStack);
    }

    public boolean isSchemaQuery() {
        return SCHEMA_OPERATION.equals(name);
    }
}
