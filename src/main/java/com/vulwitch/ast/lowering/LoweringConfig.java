package com.vulwitch.ast.lowering;

import java.util.Set;

import com.vulwitch.ast.fixer.ParsingFixerRegistry;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Settings for one lowering session.
 */
@Value
@Builder(toBuilder = true)
public class LoweringConfig {

    /**
     * CST node types dropped wherever they appear as siblings. Comments are extras in the
     * grammar and may show up between any two tokens.
     */
    @NonNull
    @Builder.Default
    Set<String> skippedNodeTypes = Set.of("comment");

    /**
     * Consulted when an item's subtree contains a syntax error. Must be frozen before use.
     */
    @NonNull
    @Builder.Default
    ParsingFixerRegistry fixerRegistry = ParsingFixerRegistry.empty();

    /**
     * Whether file paths are resolved to absolute paths before they appear in code ranges.
     */
    @Builder.Default
    boolean resolveAbsolutePaths = true;

    public static LoweringConfig defaults() {
        return LoweringConfig.builder().build();
    }
}
