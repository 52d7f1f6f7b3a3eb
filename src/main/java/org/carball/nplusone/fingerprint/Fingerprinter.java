package org.carball.nplusone.fingerprint;

/**
 * Reduces a query to a string that is equal for queries of the same shape.
 * Implementations are stateless and safe to share between threads.
 */
@FunctionalInterface
public interface Fingerprinter {

    /**
     * @throws NormalizationException if the query cannot be normalized
     */
    String fingerprint(String sql);
}
