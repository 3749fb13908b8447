package com.ratint.config;

import java.util.Objects;
import java.util.Properties;

/**
 * Options of one integration call.
 *
 * <p>{@code symbolName} names the bound variable of any {@code RootSum} in the
 * result (default {@code "t"}); {@code mode} selects real or complex
 * presentation of logarithmic terms.
 *
 * <p>Options can be read from properties:
 * <pre>
 *   ratint.symbol = t
 *   ratint.real   = auto      (true, false or auto)
 * </pre>
 */
public final class IntegrationOptions {

    public static final String SYMBOL_PROPERTY = "ratint.symbol";
    public static final String REAL_PROPERTY = "ratint.real";

    public static final String DEFAULT_SYMBOL_NAME = "t";

    private static final IntegrationOptions DEFAULTS =
        new IntegrationOptions(DEFAULT_SYMBOL_NAME, DomainMode.AUTO);

    private final String symbolName;
    private final DomainMode mode;

    private IntegrationOptions(String symbolName, DomainMode mode) {
        this.symbolName = Objects.requireNonNull(symbolName, "symbolName must not be null");
        this.mode = Objects.requireNonNull(mode, "mode must not be null");
        if (symbolName.isBlank()) {
            throw new IllegalArgumentException("symbolName must not be blank");
        }
    }

    public static IntegrationOptions defaults() {
        return DEFAULTS;
    }

    public static IntegrationOptions of(String symbolName, DomainMode mode) {
        return new IntegrationOptions(symbolName, mode);
    }

    /**
     * Reads options from properties, falling back to the defaults for missing keys.
     *
     * @param properties the properties
     * @return the options
     * @throws IllegalArgumentException if {@code ratint.real} is not recognized
     */
    public static IntegrationOptions fromProperties(Properties properties) {
        Objects.requireNonNull(properties, "properties must not be null");
        String symbol = properties.getProperty(SYMBOL_PROPERTY, DEFAULT_SYMBOL_NAME).trim();
        DomainMode mode = DomainMode.parse(properties.getProperty(REAL_PROPERTY));
        return new IntegrationOptions(symbol, mode);
    }

    public IntegrationOptions withSymbolName(String name) {
        return new IntegrationOptions(name, mode);
    }

    public IntegrationOptions withMode(DomainMode newMode) {
        return new IntegrationOptions(symbolName, newMode);
    }

    public String symbolName() {
        return symbolName;
    }

    public DomainMode mode() {
        return mode;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof IntegrationOptions)) return false;
        IntegrationOptions that = (IntegrationOptions) obj;
        return symbolName.equals(that.symbolName) && mode == that.mode;
    }

    @Override
    public int hashCode() {
        return Objects.hash(symbolName, mode);
    }

    @Override
    public String toString() {
        return "IntegrationOptions(symbol=" + symbolName + ", mode=" + mode + ")";
    }
}
