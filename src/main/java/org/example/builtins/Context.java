package org.example.builtins;

/**
 * What a builtin may touch besides its arguments: where its warnings go and
 * the random generators.
 */
public final class Context {
    final WarningSink warnings;
    final RandomSource random;

    public Context(WarningSink warnings, RandomSource random) {
        this.warnings = warnings;
        this.random = random;
    }
}
