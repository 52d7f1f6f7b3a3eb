package org.carball.nplusone.fingerprint;

public class NormalizationException extends FingerprintException {

    public NormalizationException(String message, String sql) {
        super(message, sql);
    }

    public NormalizationException(String message, String sql, Throwable cause) {
        super(message, sql, cause);
    }
}
