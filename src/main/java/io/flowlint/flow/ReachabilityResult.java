package io.flowlint.flow;

import io.flowlint.syntax.BlockStatement;
import io.flowlint.syntax.Statement;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable outcome of a reachability analysis over one body.
 * <p>
 * Statements are compared by identity. Statements outside the analyzed body are
 * reported as unreachable with an unreachable endpoint.
 */
public final class ReachabilityResult {

    private final BlockStatement body;
    private final List<Statement> reachable;
    private final Set<Statement> reachableSet;
    private final Map<Statement, Boolean> endpoints;
    private final Set<Statement> recursive;

    ReachabilityResult(BlockStatement body,
                       List<Statement> reachable,
                       Map<Statement, Boolean> endpoints,
                       Set<Statement> recursive) {
        this.body = body;
        this.reachable = List.copyOf(reachable);
        Set<Statement> set = Collections.newSetFromMap(new IdentityHashMap<>());
        set.addAll(reachable);
        this.reachableSet = Collections.unmodifiableSet(set);
        this.endpoints = Collections.unmodifiableMap(new IdentityHashMap<>(endpoints));
        Set<Statement> recursiveSet = Collections.newSetFromMap(new IdentityHashMap<>());
        recursiveSet.addAll(recursive);
        this.recursive = Collections.unmodifiableSet(recursiveSet);
    }

    public BlockStatement body() {
        return body;
    }

    public boolean isReachable(Statement statement) {
        return reachableSet.contains(statement);
    }

    /**
     * Whether control can flow past the end of the statement into whatever follows it.
     */
    public boolean isEndpointReachable(Statement statement) {
        return endpoints.getOrDefault(statement, Boolean.FALSE);
    }

    /**
     * Reachable statements in document order.
     */
    public List<Statement> reachableStatements() {
        return reachable;
    }

    /**
     * Whether the statement is reachable but unconditionally re-enters the analyzed member.
     */
    public boolean isRecursive(Statement statement) {
        return recursive.contains(statement);
    }

    public Set<Statement> recursiveStatements() {
        return recursive;
    }

    @Override
    public String toString() {
        return "ReachabilityResult[reachable=" + reachable.size() + ", recursive=" + recursive.size()
                + ", endpointReachable=" + isEndpointReachable(body) + "]";
    }
}
