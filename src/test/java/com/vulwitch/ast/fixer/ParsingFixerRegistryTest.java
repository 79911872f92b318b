package com.vulwitch.ast.fixer;

import static com.vulwitch.ast.cst.FakeCstNode.leaf;
import static com.vulwitch.ast.cst.FakeCstNode.node;
import static org.assertj.core.api.Assertions.*;

import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.Test;

import com.vulwitch.ast.cst.CstCursor;
import com.vulwitch.ast.cst.FakeCstNode;
import com.vulwitch.ast.cst.FakeSyntaxTree;
import com.vulwitch.ast.cst.SyntaxTree;

class ParsingFixerRegistryTest {

    private final FakeCstNode declaration =
            node("declaration", leaf("primitive_type", "int", 0), leaf("identifier", "x", 4)).withError();
    private final SyntaxTree tree = new FakeSyntaxTree("a.c", node("translation_unit", declaration));

    @Test
    void testDuplicateRegistrationIsRejected() {
        ParsingFixerRegistry registry = new ParsingFixerRegistry();
        StubFixer fixer = new StubFixer("declaration", true);

        assertThat(registry.register(fixer)).isTrue();
        assertThat(registry.register(fixer)).isFalse();
        assertThat(registry.register(new StubFixer("declaration", false))).isTrue();
        assertThat(registry.size()).isEqualTo(2);
    }

    @Test
    void testLookupHonoursNodeTypeAndCanFix() {
        ParsingFixerRegistry registry = new ParsingFixerRegistry();
        StubFixer refusing = new StubFixer("declaration", false);
        StubFixer accepting = new StubFixer("declaration", true);
        registry.register(new StubFixer("field_declaration", true));
        registry.register(refusing);
        registry.register(accepting);
        registry.freeze();

        CstCursor cursor = new CstCursor(tree.getRootNode());
        assertThat(registry.lookupFixer(tree, cursor)).isEmpty();

        cursor.gotoFirstChild();
        assertThat(registry.lookupFixer(tree, cursor)).containsSame(accepting);
    }

    @Test
    void testLookupInEndStateFindsNothing() {
        ParsingFixerRegistry registry = new ParsingFixerRegistry();
        registry.register(new StubFixer("declaration", true));
        CstCursor cursor = new CstCursor(tree.getRootNode());
        cursor.gotoFirstChild();
        cursor.gotoNextSibling();

        assertThat(registry.lookupFixer(tree, cursor)).isEmpty();
    }

    @Test
    void testRegistrationAfterFreezeFails() {
        ParsingFixerRegistry registry = new ParsingFixerRegistry();
        registry.freeze();

        assertThat(registry.isFrozen()).isTrue();
        assertThatThrownBy(() -> registry.register(new StubFixer("declaration", true)))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void testEmptyRegistryIsFrozen() {
        assertThat(ParsingFixerRegistry.empty().isFrozen()).isTrue();
        assertThat(ParsingFixerRegistry.empty().size()).isZero();
    }

    @Test
    void testFixerProducesApplicableFix() {
        StubFixer fixer = new StubFixer("declaration", true);
        CodeFix fix = fixer.fix(tree, new CstCursor(tree.getRootNode()));

        byte[] repaired = fix.applyTo("int x".getBytes(StandardCharsets.UTF_8));

        assertThat(new String(repaired, StandardCharsets.UTF_8)).isEqualTo("int x;");
    }

    private static final class StubFixer implements ParsingFixer {
        private final String nodeType;
        private final boolean accepts;

        private StubFixer(String nodeType, boolean accepts) {
            this.nodeType = nodeType;
            this.accepts = accepts;
        }

        @Override
        public String nodeType() {
            return nodeType;
        }

        @Override
        public boolean canFix(SyntaxTree tree, CstCursor cursor) {
            return accepts;
        }

        @Override
        public CodeFix fix(SyntaxTree tree, CstCursor cursor) {
            return new CodeFix(5, 5, ";".getBytes(StandardCharsets.UTF_8));
        }
    }
}
