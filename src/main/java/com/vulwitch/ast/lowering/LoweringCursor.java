package com.vulwitch.ast.lowering;

import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.vulwitch.ast.cst.CstCursor;
import com.vulwitch.ast.cst.CstNode;
import com.vulwitch.ast.cst.SyntaxTree;
import com.vulwitch.ast.error.CodeError;
import com.vulwitch.ast.error.NotYetSupportedError;
import com.vulwitch.ast.fixer.ParsingFixer;
import com.vulwitch.ast.location.CodeLocation;
import com.vulwitch.ast.location.CodeRange;
import com.vulwitch.ast.model.Identifier;

/**
 * The lowering engine's view of the CST: a {@link CstCursor} plus the tree it walks and the
 * session settings.
 *
 * Every {@code lower...} method in this package starts with the cursor on the node it lowers and
 * leaves it on that node's next sibling, or in the end state when there is none. The moves here
 * keep that contract cheap to follow: {@link #enter()} descends, {@link #leave()} returns to the
 * parent and steps past it. Node types configured as skipped are stepped over by every move.
 */
final class LoweringCursor {
    private static final Logger log = LoggerFactory.getLogger(LoweringCursor.class);

    private final CstCursor cursor;
    private final LoweringConfig config;
    private SyntaxTree tree;

    LoweringCursor(SyntaxTree tree, LoweringConfig config) {
        this.tree = tree;
        this.config = config;
        this.cursor = new CstCursor(tree.getRootNode());
    }

    void reset(SyntaxTree newTree) {
        this.tree = newTree;
        cursor.reset(newTree.getRootNode());
    }

    SyntaxTree tree() {
        return tree;
    }

    String file() {
        return tree.getFile();
    }

    CstNode node() {
        return cursor.getNode();
    }

    boolean isAtEnd() {
        return cursor.isAtEnd();
    }

    /** Type of the current node, or {@code null} in the end state. */
    String type() {
        CstNode node = cursor.getNode();
        return node == null ? null : node.getType();
    }

    boolean is(String type) {
        return type.equals(type());
    }

    boolean isAny(String... types) {
        String current = type();
        if (current == null) {
            return false;
        }
        for (String type : types) {
            if (type.equals(current)) {
                return true;
            }
        }
        return false;
    }

    boolean isIn(Set<String> types) {
        String current = type();
        return current != null && types.contains(current);
    }

    /** Type of the first child of the current node, or {@code null} when it has none. */
    String firstChildType() {
        CstNode node = requireNode();
        return node.getChildCount() == 0 ? null : node.getChild(0).getType();
    }

    String text() {
        return requireNode().getText();
    }

    CodeRange range() {
        return rangeOf(requireNode());
    }

    CodeLocation start() {
        return requireNode().getStartPoint();
    }

    CodeLocation end() {
        return requireNode().getEndPoint();
    }

    CodeRange rangeOf(CstNode node) {
        return new CodeRange(file(), node.getStartPoint(), node.getEndPoint());
    }

    CodeRange rangeBetween(CodeLocation start, CodeLocation end) {
        return new CodeRange(file(), start, end);
    }

    /** Siblings from the current one (inclusive) to the last. */
    int remainingSiblings() {
        return cursor.getRemainingSiblingCount();
    }

    void advance() {
        cursor.gotoNextSibling();
        skipIgnored();
    }

    /**
     * Descends to the first child of the current node.
     */
    void enter() {
        CstNode node = requireNode();
        if (!cursor.gotoFirstChild()) {
            throw error("expected `" + node.getType() + "` to have children");
        }
        skipIgnored();
    }

    /**
     * Returns to the parent and moves to its next sibling.
     */
    void leave() {
        cursor.gotoParent();
        advance();
    }

    /**
     * Steps over a token of the given type, failing when the current node is something else.
     */
    void consume(String type) {
        if (!is(type)) {
            throw error("expected `" + type + "` but found " + describe());
        }
        advance();
    }

    boolean consumeIf(String type) {
        if (is(type)) {
            advance();
            return true;
        }
        return false;
    }

    String consumeText() {
        String text = text();
        advance();
        return text;
    }

    /**
     * Consumes a leaf naming something: {@code identifier}, {@code field_identifier} or
     * {@code type_identifier}.
     */
    Identifier consumeIdentifier() {
        if (!isAny("identifier", "field_identifier", "type_identifier")) {
            throw error("expected an identifier but found " + describe());
        }
        CodeRange range = range();
        String name = text();
        if (name.isEmpty()) {
            throw error("an empty identifier");
        }
        advance();
        return new Identifier(range, name);
    }

    /** Fails unless every child of the current parent has been consumed. */
    void expectEnd(String production) {
        if (!isAtEnd()) {
            throw error("unexpected " + describe() + " in " + production);
        }
    }

    /**
     * Rejects the current item when its subtree contains a syntax error. A registered fixer that
     * accepts the node is reported by name; applying it is left to the caller of the engine.
     */
    void checkSyntax() {
        CstNode node = requireNode();
        if (!node.hasError()) {
            return;
        }
        Optional<ParsingFixer> fixer = config.getFixerRegistry().lookupFixer(tree, cursor);
        if (fixer.isEmpty()) {
            log.warn("Syntax error in {} at {}, no fixer available", node.getType(), range());
            throw error("syntax error in " + node.getType());
        }
        String fixerName = fixer.get().getClass().getSimpleName();
        log.warn("Syntax error in {} at {}, fixer {} applies but repair is not wired in",
                node.getType(), range(), fixerName);
        throw error("syntax error in " + node.getType() + ": fixer " + fixerName
                + " applies but repair is not wired in");
    }

    CodeError error(String message) {
        return new CodeError(message, errorRange());
    }

    NotYetSupportedError notYetSupported(String production) {
        return new NotYetSupportedError(production, errorRange());
    }

    String describe() {
        if (isAtEnd()) {
            CstNode parent = cursor.getParentNode();
            return parent == null ? "end of input" : "end of `" + parent.getType() + "`";
        }
        return "`" + type() + "`";
    }

    private CodeRange errorRange() {
        CstNode node = cursor.getNode();
        if (node == null) {
            node = cursor.getParentNode();
        }
        return node == null ? rangeOf(tree.getRootNode()) : rangeOf(node);
    }

    private CstNode requireNode() {
        CstNode node = cursor.getNode();
        if (node == null) {
            throw error("unexpected " + describe());
        }
        return node;
    }

    private void skipIgnored() {
        while (isIn(config.getSkippedNodeTypes())) {
            cursor.gotoNextSibling();
        }
    }
}
