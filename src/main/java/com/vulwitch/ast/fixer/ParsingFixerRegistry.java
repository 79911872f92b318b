package com.vulwitch.ast.fixer;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.vulwitch.ast.cst.CstCursor;
import com.vulwitch.ast.cst.CstNode;
import com.vulwitch.ast.cst.SyntaxTree;

/**
 * Fixers keyed by the CST node type they repair.
 *
 * Populate with {@link #register}, then {@link #freeze()} before lowering starts; lookups
 * are safe from any number of threads afterwards.
 */
public class ParsingFixerRegistry {
    private static final Logger log = LoggerFactory.getLogger(ParsingFixerRegistry.class);

    private final Map<String, List<ParsingFixer>> registry = new ConcurrentHashMap<>();
    private volatile boolean frozen;

    public static ParsingFixerRegistry empty() {
        ParsingFixerRegistry registry = new ParsingFixerRegistry();
        registry.freeze();
        return registry;
    }

    /**
     * Adds {@code fixer} under its node type.
     *
     * @return {@code false} when an equal fixer is already registered
     */
    public synchronized boolean register(ParsingFixer fixer) {
        if (frozen) {
            throw new IllegalStateException("Fixer registry is frozen; register fixers before lowering starts");
        }
        List<ParsingFixer> fixers = registry.computeIfAbsent(fixer.nodeType(), key -> new CopyOnWriteArrayList<>());
        if (fixers.contains(fixer)) {
            return false;
        }
        fixers.add(fixer);
        log.debug("Registered fixer {} for node type {}", fixer.getClass().getSimpleName(), fixer.nodeType());
        return true;
    }

    public void freeze() {
        frozen = true;
    }

    public boolean isFrozen() {
        return frozen;
    }

    /**
     * Returns the first fixer registered for the cursor's current node type that can fix it.
     */
    public Optional<ParsingFixer> lookupFixer(SyntaxTree tree, CstCursor cursor) {
        CstNode node = cursor.getNode();
        if (node == null) {
            return Optional.empty();
        }
        List<ParsingFixer> fixers = registry.getOrDefault(node.getType(), List.of());
        for (ParsingFixer fixer : fixers) {
            if (fixer.canFix(tree, cursor)) {
                return Optional.of(fixer);
            }
        }
        return Optional.empty();
    }

    public int size() {
        return registry.values().stream().mapToInt(List::size).sum();
    }
}
