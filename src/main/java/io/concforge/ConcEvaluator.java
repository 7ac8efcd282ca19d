package io.concforge;

import io.concforge.internal.Failure;
import io.concforge.internal.FirstFailure;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.BiConsumer;

/**
 * One evaluation of a {@link Conc} tree.
 *
 * <p>The calling thread coordinates: it builds a runtime node per tree node, spawns the leaves
 * that can still matter and then consumes leaf completions one at a time from a queue. The order
 * in which completions are taken from the queue is the order in which failures count as having
 * happened. Before {@link #evaluate(Conc)} returns or throws, every spawned task has stopped.
 *
 * <p>Building, starting, cancelling and settling walk the tree with explicit stacks, so the depth
 * of a tree (a long AND chain, say) is bounded by memory, not by the thread's stack.
 *
 * <p>Not thread-safe; an instance is used for a single call.
 */
final class ConcEvaluator {

    private enum Status {
        LIVE,
        SUCCEEDED,
        FAILED,
        CANCELLED
    }

    private final ConcRuntime runtime;
    private final long runId;
    private final Duration deadline;
    private final ExecutionContextCarrier carrier;
    private final BlockingQueue<Completion> completions;
    private final List<Task<?>> spawned;
    private long sequence;

    ConcEvaluator(ConcRuntime runtime, long runId, Duration deadline) {
        this.runtime = runtime;
        this.runId = runId;
        this.deadline = deadline;
        this.carrier = ExecutionContextCarrier.capture();
        this.completions = new LinkedBlockingQueue<Completion>();
        this.spawned = new ArrayList<Task<?>>();
    }

    @SuppressWarnings("unchecked")
    <T> T evaluate(Conc<T> tree) {
        long deadlineAt = deadline == null ? 0L : System.nanoTime() + deadline.toNanos();
        Node root = build(tree);
        try {
            if (root.status == Status.LIVE) {
                start(root);
                awaitSettled(root, deadlineAt);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancelledException("runConc interrupted", e);
        } finally {
            drain();
        }

        if (root.status == Status.SUCCEEDED) {
            return (T) root.value;
        }
        throw propagate(root.failure.error());
    }

    private void awaitSettled(Node root, long deadlineAt) throws InterruptedException {
        while (root.status == Status.LIVE) {
            Completion completion;
            if (deadline == null) {
                completion = completions.take();
            } else {
                long remaining = deadlineAt - System.nanoTime();
                completion = remaining > 0L ? completions.poll(remaining, TimeUnit.NANOSECONDS) : null;
                if (completion == null) {
                    throw new ConcTimeoutException("runConc deadline of " + deadline.toMillis() + " ms exceeded");
                }
            }
            onCompletion(completion);
        }
    }

    private void onCompletion(Completion completion) {
        LeafNode leaf = completion.leaf;
        // Losers were cancelled already; whatever they report is discarded.
        if (leaf.status != Status.LIVE) {
            return;
        }
        if (completion.error == null) {
            leaf.complete(completion.value, null);
        } else {
            leaf.complete(null, new Failure(completion.error, nextSequence()));
        }
        settleUpwards(leaf);
    }

    /**
     * Reports a settled node to its ancestors until one of them stays live.
     */
    private void settleUpwards(Node settled) {
        Node current = settled;
        while (current != null && current.parent != null) {
            CompositeNode parent = current.parent;
            current = current.status == Status.SUCCEEDED ? parent.childSucceeded(current) : parent.childFailed(current);
        }
    }

    /**
     * Spawns every live leaf, left to right.
     */
    private void start(Node root) {
        Deque<Node> pending = new ArrayDeque<Node>();
        pending.push(root);
        while (!pending.isEmpty()) {
            Node node = pending.pop();
            if (node.status != Status.LIVE) {
                continue;
            }
            if (node instanceof LeafNode) {
                ((LeafNode) node).spawn();
            } else if (node instanceof CompositeNode) {
                List<Node> children = ((CompositeNode) node).children;
                for (int i = children.size() - 1; i >= 0; i--) {
                    pending.push(children.get(i));
                }
            }
        }
    }

    /**
     * Cancels every task still running and waits for all spawned tasks to stop.
     */
    private void drain() {
        for (Task<?> task : spawned) {
            task.requestCancel();
        }
        for (Task<?> task : spawned) {
            task.awaitStopped();
        }
    }

    /**
     * Marks the live part of the given subtrees cancelled, interrupts their tasks, then waits for
     * them to stop.
     */
    private void cancelSubtrees(List<Node> nodes) {
        List<Task<?>> tasks = new ArrayList<Task<?>>();
        Deque<Node> pending = new ArrayDeque<Node>(nodes);
        while (!pending.isEmpty()) {
            Node node = pending.pop();
            if (node.status != Status.LIVE) {
                continue;
            }
            node.status = Status.CANCELLED;
            if (node instanceof LeafNode) {
                Task<?> task = ((LeafNode) node).task;
                if (task != null) {
                    tasks.add(task);
                }
            } else if (node instanceof CompositeNode) {
                for (Node child : ((CompositeNode) node).children) {
                    pending.push(child);
                }
            }
        }
        for (Task<?> task : tasks) {
            task.requestCancel();
        }
        for (Task<?> task : tasks) {
            task.awaitStopped();
        }
    }

    private long nextSequence() {
        return ++sequence;
    }

    /**
     * Builds the runtime nodes depth-first, left to right. A composite node is settled statically
     * once all of its children are built, so static failures are numbered in the same order a
     * left-to-right evaluation would meet them.
     */
    private Node build(Conc<?> tree) {
        Node root = create(tree, null);
        Deque<CompositeNode> open = new ArrayDeque<CompositeNode>();
        if (root instanceof CompositeNode) {
            open.push((CompositeNode) root);
        }
        while (!open.isEmpty()) {
            CompositeNode node = open.peek();
            if (node.next < node.operands.size()) {
                Node child = create(node.operands.get(node.next++), node);
                node.children.add(child);
                if (child instanceof CompositeNode) {
                    open.push((CompositeNode) child);
                }
            } else {
                open.pop();
                node.settleStatically();
            }
        }
        return root;
    }

    private Node create(Conc<?> conc, CompositeNode parent) {
        Conc<?> target = conc;
        if (target instanceof Conc.Or) {
            List<Conc<?>> alternatives = flattenAlternatives(target);
            if (alternatives.isEmpty()) {
                return new ResolvedNode(parent, null, new Failure(new EmptyAlternativeException(), nextSequence()));
            }
            if (alternatives.size() > 1) {
                return new AnyNode(parent, alternatives);
            }
            target = alternatives.get(0);
        }
        if (target instanceof Conc.Pure) {
            return new ResolvedNode(parent, ((Conc.Pure<?>) target).value, null);
        }
        if (target instanceof Conc.Empty) {
            return new ResolvedNode(parent, null, new Failure(new EmptyAlternativeException(), nextSequence()));
        }
        if (target instanceof Conc.Leaf) {
            return new LeafNode(parent, (Conc.Leaf<?>) target);
        }
        if (target instanceof Conc.Join) {
            return new AllNode(parent, (Conc.Join<?>) target);
        }
        throw new IllegalArgumentException("Unsupported Conc node: " + target.getClass().getName());
    }

    /**
     * Nested ORs form one race; empty alternatives take no part in it.
     */
    private static List<Conc<?>> flattenAlternatives(Conc<?> or) {
        List<Conc<?>> out = new ArrayList<Conc<?>>();
        Deque<Conc<?>> pending = new ArrayDeque<Conc<?>>();
        pending.push(or);
        while (!pending.isEmpty()) {
            Conc<?> conc = pending.pop();
            if (conc instanceof Conc.Or) {
                Conc.Or<?> node = (Conc.Or<?>) conc;
                pending.push(node.right);
                pending.push(node.left);
            } else if (!(conc instanceof Conc.Empty)) {
                out.add(conc);
            }
        }
        return out;
    }

    private static RuntimeException propagate(Throwable error) {
        if (error instanceof RuntimeException) {
            throw (RuntimeException) error;
        }
        if (error instanceof Error) {
            throw (Error) error;
        }
        throw new TaskExecutionException("Task execution failed", error);
    }

    private static final class Completion {

        final LeafNode leaf;
        final Object value;
        final Throwable error;

        Completion(LeafNode leaf, Object value, Throwable error) {
            this.leaf = leaf;
            this.value = value;
            this.error = error;
        }
    }

    private abstract static class Node {

        final CompositeNode parent;
        Status status;
        Object value;
        Failure failure;

        Node(CompositeNode parent) {
            this.parent = parent;
            this.status = Status.LIVE;
        }

        final void complete(Object result, Failure cause) {
            if (cause != null) {
                status = Status.FAILED;
                failure = cause;
            } else {
                status = Status.SUCCEEDED;
                value = result;
            }
        }
    }

    private static final class ResolvedNode extends Node {

        ResolvedNode(CompositeNode parent, Object result, Failure cause) {
            super(parent);
            complete(result, cause);
        }
    }

    private final class LeafNode extends Node {

        private final Conc.Leaf<?> leaf;
        private Task<?> task;

        LeafNode(CompositeNode parent, Conc.Leaf<?> leaf) {
            super(parent);
            this.leaf = leaf;
        }

        void spawn() {
            Task<?> started = runtime.spawn(runId, leaf.name, leaf.action, carrier);
            task = started;
            spawned.add(started);
            final LeafNode self = this;
            started.toCompletableFuture().whenComplete(new BiConsumer<Object, Throwable>() {
                @Override
                public void accept(Object result, Throwable error) {
                    completions.add(new Completion(self, result, error));
                }
            });
        }
    }

    private abstract static class CompositeNode extends Node {

        final List<Conc<?>> operands;
        final List<Node> children;
        int next;

        CompositeNode(CompositeNode parent, List<Conc<?>> operands) {
            super(parent);
            this.operands = operands;
            this.children = new ArrayList<Node>(operands.size());
        }

        abstract void settleStatically();

        /**
         * @return this node if the child's success settled it, otherwise {@code null}.
         */
        abstract Node childSucceeded(Node child);

        /**
         * @return this node if the child's failure settled it, otherwise {@code null}.
         */
        abstract Node childFailed(Node child);

        final List<Node> liveChildrenExcept(Node child) {
            List<Node> live = new ArrayList<Node>();
            for (Node sibling : children) {
                if (sibling != child && sibling.status == Status.LIVE) {
                    live.add(sibling);
                }
            }
            return live;
        }
    }

    private final class AllNode extends CompositeNode {

        private final Conc.Join<?> join;
        private final FirstFailure firstFailure;
        private int succeeded;

        AllNode(CompositeNode parent, Conc.Join<?> join) {
            super(parent, join.operands());
            this.join = join;
            this.firstFailure = new FirstFailure();
        }

        @Override
        void settleStatically() {
            Failure earliest = null;
            for (Node child : children) {
                if (child.status == Status.FAILED && child.failure.isEarlierThan(earliest)) {
                    earliest = child.failure;
                } else if (child.status == Status.SUCCEEDED) {
                    succeeded++;
                }
            }
            if (earliest != null) {
                firstFailure.offer(earliest);
                complete(null, earliest);
                return;
            }
            if (succeeded == children.size()) {
                merge();
            }
        }

        @Override
        Node childSucceeded(Node child) {
            if (status != Status.LIVE || ++succeeded < children.size()) {
                return null;
            }
            merge();
            return this;
        }

        @Override
        Node childFailed(Node child) {
            if (status != Status.LIVE || !firstFailure.offer(child.failure)) {
                return null;
            }
            cancelSubtrees(liveChildrenExcept(child));
            complete(null, firstFailure.get());
            return this;
        }

        private void merge() {
            Object[] values = new Object[children.size()];
            for (int i = 0; i < values.length; i++) {
                values[i] = children.get(i).value;
            }
            try {
                complete(join.merge(values), null);
            } catch (RuntimeException e) {
                Failure mergeFailure = new Failure(e, nextSequence());
                firstFailure.offer(mergeFailure);
                complete(null, mergeFailure);
            }
        }
    }

    private final class AnyNode extends CompositeNode {

        private int eliminated;
        private Failure earliest;

        AnyNode(CompositeNode parent, List<Conc<?>> alternatives) {
            super(parent, alternatives);
        }

        @Override
        void settleStatically() {
            for (Node alternative : children) {
                if (alternative.status == Status.SUCCEEDED) {
                    complete(alternative.value, null);
                    return;
                }
            }
            for (Node alternative : children) {
                if (alternative.status == Status.FAILED) {
                    eliminate(alternative.failure);
                }
            }
            if (eliminated == children.size()) {
                complete(null, earliest);
            }
        }

        @Override
        Node childSucceeded(Node child) {
            if (status != Status.LIVE) {
                return null;
            }
            cancelSubtrees(liveChildrenExcept(child));
            complete(child.value, null);
            return this;
        }

        @Override
        Node childFailed(Node child) {
            if (status != Status.LIVE) {
                return null;
            }
            eliminate(child.failure);
            if (eliminated < children.size()) {
                return null;
            }
            complete(null, earliest);
            return this;
        }

        private void eliminate(Failure failure) {
            eliminated++;
            if (failure.isEarlierThan(earliest)) {
                earliest = failure;
            }
        }
    }
}
