package io.github.eutro.tacflow.core.util;

import io.github.eutro.tacflow.core.cfg.BasicBlock;
import io.github.eutro.tacflow.core.cfg.CFG;

import java.util.*;

/**
 * Walks a graph from a set of roots, breadth-first or depth-first in pre-order.
 *
 * @param <T> The type of a node in the graph.
 */
public class GraphWalker<T> {
    final List<T> roots;
    final F<? super T, ? extends Iterable<? extends T>> getChildren;

    /**
     * Construct a graph walker from root nodes and a successor function.
     *
     * @param roots       The roots of the walk, visited in order.
     * @param getChildren The successor function of the graph.
     */
    public GraphWalker(Collection<? extends T> roots, F<? super T, ? extends Iterable<? extends T>> getChildren) {
        this.roots = new ArrayList<>(roots);
        this.getChildren = getChildren;
    }

    /**
     * Create a graph walker over the control flow edges of a {@link CFG}.
     * <p>
     * Call edges are not followed.
     *
     * @param cfg   The graph.
     * @param roots The labels of the root blocks. Labels without a block are ignored.
     * @return The graph walker.
     */
    public static GraphWalker<BasicBlock> blockWalker(CFG cfg, Collection<String> roots) {
        List<BasicBlock> rootBlocks = new ArrayList<>();
        for (String root : roots) {
            BasicBlock block = cfg.blocks.get(root);
            if (block != null) rootBlocks.add(block);
        }
        return new GraphWalker<>(rootBlocks, $ -> $.flowSuccessors(cfg));
    }

    /**
     * An order over a graph.
     *
     * @param <T> The type of each node.
     */
    public interface Order<T> extends Iterable<T> {
        /**
         * Collect this order to a list.
         *
         * @return The elements of the graph, in this order.
         */
        default List<T> toList() {
            List<T> ls = new ArrayList<>();
            for (T t : this) {
                ls.add(t);
            }
            return ls;
        }
    }

    /**
     * Get the breadth-first traversal of the graph.
     *
     * @return The breadth-first order.
     */
    public Order<T> breadthFirst() {
        return BfsIter::new;
    }

    /**
     * Get the depth-first pre-order traversal of the graph.
     * <p>
     * Elements yielded later by the successor function are visited first.
     *
     * @return The pre-order.
     */
    public Order<T> preOrder() {
        return PreIter::new;
    }

    private class BfsIter implements Iterator<T> {
        private final Deque<T> queue = new ArrayDeque<>();
        private final Set<T> seen = new HashSet<>();

        {
            for (T root : roots) {
                if (seen.add(root)) queue.addLast(root);
            }
        }

        @Override
        public boolean hasNext() {
            return !queue.isEmpty();
        }

        @Override
        public T next() {
            if (queue.isEmpty()) throw new NoSuchElementException();
            T top = queue.removeFirst();
            for (T next : getChildren.apply(top)) {
                if (seen.add(next)) {
                    queue.addLast(next);
                }
            }
            return top;
        }
    }

    private class PreIter implements Iterator<T> {
        private final List<T> stack = new ArrayList<>();
        private final Set<T> seen = new HashSet<>();

        {
            for (ListIterator<T> li = roots.listIterator(roots.size()); li.hasPrevious(); ) {
                T root = li.previous();
                if (seen.add(root)) stack.add(root);
            }
        }

        @Override
        public boolean hasNext() {
            return !stack.isEmpty();
        }

        @Override
        public T next() {
            if (stack.isEmpty()) throw new NoSuchElementException();
            T top = stack.remove(stack.size() - 1);
            for (T next : getChildren.apply(top)) {
                if (seen.add(next)) {
                    stack.add(next);
                }
            }
            return top;
        }
    }
}
