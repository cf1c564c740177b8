package io.flowlint.syntax;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Base class of every node in the syntax tree.
 * <p>
 * Nodes are immutable once built. A node owns its children; the parent link is a
 * back-reference assigned exactly once, when the parent adopts the child. Nodes use
 * identity equality, so two textually identical statements are still distinct nodes.
 */
public abstract class SyntaxNode {

    private final TextSpan span;
    private SyntaxNode parent;

    protected SyntaxNode(TextSpan span) {
        if (span == null) {
            throw new IllegalArgumentException("span cannot be null");
        }
        this.span = span;
    }

    public TextSpan span() {
        return span;
    }

    public int start() {
        return span.start();
    }

    public int end() {
        return span.end();
    }

    /**
     * Returns the parent node, or null for the root.
     */
    public SyntaxNode parent() {
        return parent;
    }

    /**
     * Returns the direct children in source order.
     */
    public abstract List<SyntaxNode> children();

    /**
     * Returns all nodes below this one in pre-order, excluding this node.
     */
    public Stream<SyntaxNode> descendants() {
        return children().stream().flatMap(child -> Stream.concat(Stream.of(child), child.descendants()));
    }

    /**
     * Returns all descendants of the given type in pre-order.
     */
    public <T extends SyntaxNode> List<T> descendantsOfType(Class<T> type) {
        return descendants()
                .filter(type::isInstance)
                .map(type::cast)
                .toList();
    }

    /**
     * Returns the nearest proper ancestor of the given type.
     */
    public <T extends SyntaxNode> Optional<T> ancestor(Class<T> type) {
        for (SyntaxNode current = parent; current != null; current = current.parent) {
            if (type.isInstance(current)) {
                return Optional.of(type.cast(current));
            }
        }
        return Optional.empty();
    }

    public SyntaxNode root() {
        SyntaxNode current = this;
        while (current.parent != null) {
            current = current.parent;
        }
        return current;
    }

    protected <T extends SyntaxNode> T adopt(T child) {
        if (child == null) {
            return null;
        }
        SyntaxNode node = child;
        if (node.parent != null) {
            throw new IllegalStateException("Node already has a parent: " + node);
        }
        if (!span.contains(node.span)) {
            throw new IllegalArgumentException("Child span " + node.span + " outside parent span " + span);
        }
        node.parent = this;
        return child;
    }

    protected <T extends SyntaxNode> List<T> adoptAll(List<T> children) {
        if (children == null || children.isEmpty()) {
            return List.of();
        }
        for (T child : children) {
            adopt(child);
        }
        return List.copyOf(children);
    }

    /**
     * Flattens nodes and node lists into a child list, skipping absent parts.
     */
    protected static List<SyntaxNode> nodes(Object... parts) {
        List<SyntaxNode> result = new ArrayList<>();
        for (Object part : parts) {
            if (part instanceof SyntaxNode node) {
                result.add(node);
            } else if (part instanceof List<?> list) {
                for (Object item : list) {
                    if (item instanceof SyntaxNode node) {
                        result.add(node);
                    }
                }
            }
        }
        return Collections.unmodifiableList(result);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + span;
    }
}
