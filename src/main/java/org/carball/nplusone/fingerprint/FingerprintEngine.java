package org.carball.nplusone.fingerprint;

import lombok.extern.slf4j.Slf4j;
import org.carball.nplusone.model.Dialect;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Chooses a fingerprint strategy by dialect. Immutable once built.
 */
@Slf4j
public class FingerprintEngine {

    private final Map<Dialect, Fingerprinter> strategies;
    private final Fingerprinter fallback;

    private FingerprintEngine(Map<Dialect, Fingerprinter> strategies, Fingerprinter fallback) {
        this.strategies = Collections.unmodifiableMap(new EnumMap<>(strategies));
        this.fallback = fallback;
    }

    /**
     * Regex pipeline for MySQL and MariaDB, token normalizer for SQLite,
     * structural parser for PostgreSQL and everything else.
     */
    public static FingerprintEngine defaults() {
        StructuralFingerprinter structural = new StructuralFingerprinter();
        MysqlFingerprinter mysql = new MysqlFingerprinter();
        return builder()
                .register(Dialect.POSTGRESQL, structural)
                .register(Dialect.MYSQL, mysql)
                .register(Dialect.MARIADB, mysql)
                .register(Dialect.SQLITE, new TokenFingerprinter())
                .fallback(structural)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @throws UnsupportedDialectException if neither a strategy nor a fallback is available
     * @throws NormalizationException      if the selected strategy cannot normalize the query
     */
    public String fingerprint(String sql, Dialect dialect) {
        Fingerprinter fingerprinter = strategyFor(dialect)
                .orElseThrow(() -> new UnsupportedDialectException(dialect, sql));
        return fingerprinter.fingerprint(sql);
    }

    public Optional<Fingerprinter> strategyFor(Dialect dialect) {
        Fingerprinter registered = dialect == null ? null : strategies.get(dialect);
        if (registered != null) {
            return Optional.of(registered);
        }
        if (fallback != null) {
            log.trace("No strategy registered for {}, using fallback", dialect);
        }
        return Optional.ofNullable(fallback);
    }

    public static final class Builder {

        private final Map<Dialect, Fingerprinter> strategies = new EnumMap<>(Dialect.class);
        private Fingerprinter fallback;

        private Builder() {
        }

        public Builder register(Dialect dialect, Fingerprinter fingerprinter) {
            strategies.put(dialect, fingerprinter);
            return this;
        }

        public Builder fallback(Fingerprinter fingerprinter) {
            this.fallback = fingerprinter;
            return this;
        }

        public FingerprintEngine build() {
            return new FingerprintEngine(strategies, fallback);
        }
    }
}
