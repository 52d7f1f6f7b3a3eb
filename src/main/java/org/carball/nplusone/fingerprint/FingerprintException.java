package org.carball.nplusone.fingerprint;

import lombok.Getter;

/**
 * Raised when a query cannot be reduced to a fingerprint.
 */
@Getter
public class FingerprintException extends RuntimeException {

    private final String sql;

    public FingerprintException(String message, String sql) {
        super(message);
        this.sql = sql;
    }

    public FingerprintException(String message, String sql, Throwable cause) {
        super(message, cause);
        this.sql = sql;
    }
}
