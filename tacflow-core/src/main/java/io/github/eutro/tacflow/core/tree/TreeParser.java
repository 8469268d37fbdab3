package io.github.eutro.tacflow.core.tree;

/**
 * Parses source bytes into a {@link SyntaxTree}.
 */
@FunctionalInterface
public interface TreeParser {
    SyntaxTree parse(byte[] source);
}
