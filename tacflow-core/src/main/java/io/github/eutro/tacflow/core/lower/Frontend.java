package io.github.eutro.tacflow.core.lower;

import io.github.eutro.tacflow.core.ir.IRInstruction;
import io.github.eutro.tacflow.core.tree.SyntaxTree;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * Something that turns source code into IR.
 * <p>
 * All frontends share this one signature, which makes them interchangeable.
 */
public interface Frontend {
    /**
     * Lower a program to IR.
     *
     * @param tree   The parse tree of the source, or null to let the frontend parse it itself.
     * @param source The source bytes the tree was parsed from.
     * @return The instructions, starting with the {@code entry} label.
     */
    List<IRInstruction> lower(@Nullable SyntaxTree tree, byte[] source);
}
