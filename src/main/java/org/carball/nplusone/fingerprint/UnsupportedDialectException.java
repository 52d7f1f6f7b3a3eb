package org.carball.nplusone.fingerprint;

import lombok.Getter;
import org.carball.nplusone.model.Dialect;

@Getter
public class UnsupportedDialectException extends FingerprintException {

    private final Dialect dialect;

    public UnsupportedDialectException(Dialect dialect, String sql) {
        super("No fingerprint strategy registered for dialect " + dialect, sql);
        this.dialect = dialect;
    }
}
