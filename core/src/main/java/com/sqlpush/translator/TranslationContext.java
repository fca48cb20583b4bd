package com.sqlpush.translator;

import com.sqlpush.format.LoggingTranspileObserver;
import com.sqlpush.format.TranspileObserver;

import java.util.Objects;
import java.util.Properties;

/**
 * Settings of one translation: remote dialect version, column naming and the
 * observer of date pattern transpiles.
 *
 * <p>Immutable; build with {@link #builder()} or {@link #fromProperties(Properties)}.
 */
public final class TranslationContext {

    /** Property holding the remote version, e.g. {@code 7.5.0}. */
    public static final String DIALECT_VERSION_PROPERTY = "sqlpush.dialect.version";

    private final DialectVersion dialectVersion;
    private final ColumnResolver columnResolver;
    private final TranspileObserver transpileObserver;

    private TranslationContext(Builder builder) {
        this.dialectVersion = builder.dialectVersion;
        this.columnResolver = builder.columnResolver;
        this.transpileObserver = builder.transpileObserver;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Context with the default version and column naming.
     */
    public static TranslationContext defaults() {
        return builder().build();
    }

    /**
     * Reads {@value #DIALECT_VERSION_PROPERTY}; a missing property means the default version.
     *
     * @param properties the configuration
     * @return the context
     * @throws IllegalArgumentException if the version is malformed
     */
    public static TranslationContext fromProperties(Properties properties) {
        Builder builder = builder();
        String version = properties.getProperty(DIALECT_VERSION_PROPERTY);
        if (version != null) {
            builder.dialectVersion(DialectVersion.parse(version));
        }
        return builder.build();
    }

    public DialectVersion dialectVersion() {
        return dialectVersion;
    }

    public ColumnResolver columnResolver() {
        return columnResolver;
    }

    public TranspileObserver transpileObserver() {
        return transpileObserver;
    }

    /**
     * Returns whether the remote version is at least {@code minimum}.
     */
    public boolean supports(DialectVersion minimum) {
        return dialectVersion.atLeast(minimum);
    }

    @Override
    public String toString() {
        return "TranslationContext(dialectVersion=" + dialectVersion + ")";
    }

    public static final class Builder {

        private DialectVersion dialectVersion = DialectLimits.DEFAULT_VERSION;
        private ColumnResolver columnResolver = ColumnResolver.byName();
        private TranspileObserver transpileObserver = new LoggingTranspileObserver();

        private Builder() {
        }

        public Builder dialectVersion(DialectVersion dialectVersion) {
            this.dialectVersion = Objects.requireNonNull(dialectVersion, "dialectVersion must not be null");
            return this;
        }

        public Builder dialectVersion(String dialectVersion) {
            return dialectVersion(DialectVersion.parse(dialectVersion));
        }

        public Builder columnResolver(ColumnResolver columnResolver) {
            this.columnResolver = Objects.requireNonNull(columnResolver, "columnResolver must not be null");
            return this;
        }

        public Builder transpileObserver(TranspileObserver transpileObserver) {
            this.transpileObserver = Objects.requireNonNull(transpileObserver, "transpileObserver must not be null");
            return this;
        }

        public TranslationContext build() {
            return new TranslationContext(this);
        }
    }
}
