package com.hcltech.causal.common;

/**
 * Abstraction for reading environment variables or configuration values.
 * <p>
 * Keeps {@link System#getenv(String)} out of engine code so tests can supply their own source.
 */
@FunctionalInterface
public interface IEnvGetter {
    /**
     * Default implementation backed by {@link System#getenv(String)}.
     */
    IEnvGetter env = System::getenv;

    /**
     * Returns the value of the given variable, or {@code null} if unset.
     */
    String get(String name);

    /**
     * Returns the integer value of the variable, or {@code defaultValue} when missing or blank.
     * Throws if the value is present but not an integer.
     */
    static int getIntOr(IEnvGetter env, String name, int defaultValue) {
        String value = env.get(name);
        if (value == null || value.isBlank()) return defaultValue;
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Invalid integer for environment variable: " + name + " = '" + value + "'", e);
        }
    }
}
