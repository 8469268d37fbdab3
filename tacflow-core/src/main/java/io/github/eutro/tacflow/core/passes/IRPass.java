package io.github.eutro.tacflow.core.passes;

import io.github.eutro.tacflow.core.passes.misc.ChainedPass;

/**
 * A transformation from one representation to another.
 *
 * @param <A> The input type.
 * @param <B> The output type.
 */
@FunctionalInterface
public interface IRPass<A, B> {
    /**
     * Run the pass.
     *
     * @param a The input.
     * @return The output.
     */
    B run(A a);

    /**
     * Compose this pass with another, which receives this pass's output.
     *
     * @param next The pass to run after this one.
     * @param <C>  The output type of the next pass.
     * @return The composed pass.
     */
    default <C> IRPass<A, C> then(IRPass<B, C> next) {
        return new ChainedPass<>(this, next);
    }
}
