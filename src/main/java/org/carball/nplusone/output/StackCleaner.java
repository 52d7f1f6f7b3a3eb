package org.carball.nplusone.output;

import java.util.List;

/**
 * Removes frames that do not help a reader find the offending code.
 */
@FunctionalInterface
public interface StackCleaner {

    List<String> clean(List<String> stack);

    static StackCleaner identity() {
        return stack -> stack;
    }
}
