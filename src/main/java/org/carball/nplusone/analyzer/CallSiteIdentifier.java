package org.carball.nplusone.analyzer;

import org.carball.nplusone.fingerprint.Digests;

import java.util.List;

/**
 * Derives the call-site key of a query from the stack it was issued from.
 * Equal stacks (same frames, same order) always give the same key.
 */
public final class CallSiteIdentifier {

    private static final String FRAME_SEPARATOR = "\n";

    private CallSiteIdentifier() {
        // Utility class - prevent instantiation
    }

    public static String identify(List<String> stack) {
        if (stack == null || stack.isEmpty()) {
            return Digests.sha256Hex("");
        }
        return Digests.sha256Hex(String.join(FRAME_SEPARATOR, stack));
    }
}
