package com.vulwitch.ast.cst.treesitter;

import java.nio.charset.StandardCharsets;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.treesitter.TSParser;
import org.treesitter.TSTree;
import org.treesitter.TreeSitterC;

import com.vulwitch.ast.cst.SyntaxTree;

/**
 * Parses C source text into a {@link SyntaxTree} with the tree-sitter C grammar.
 *
 * A tree-sitter parser is not thread-safe, so every call builds its own.
 */
public class TreeSitterCFrontend {
    private static final Logger log = LoggerFactory.getLogger(TreeSitterCFrontend.class);

    public SyntaxTree parse(String file, byte[] source) {
        String text = new String(source, StandardCharsets.UTF_8);
        // Byte offsets reported by tree-sitter refer to the UTF-8 encoding of the text it parsed.
        byte[] normalized = text.getBytes(StandardCharsets.UTF_8);

        TSParser parser = new TSParser();
        parser.setLanguage(new TreeSitterC());
        TSTree tree = parser.parseString(null, text);

        log.debug("Parsed {} ({} bytes) with tree-sitter-c", file, normalized.length);
        return new TreeSitterSyntaxTree(file, normalized, tree);
    }

    public SyntaxTree parse(String file, String source) {
        return parse(file, source.getBytes(StandardCharsets.UTF_8));
    }
}
