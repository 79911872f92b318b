package com.vulwitch.ast.cst;

import static com.vulwitch.ast.cst.FakeCstNode.leaf;
import static com.vulwitch.ast.cst.FakeCstNode.node;
import static org.assertj.core.api.Assertions.*;

import org.junit.jupiter.api.Test;

class CstCursorTest {

    // int x ;
    private final FakeCstNode root = node("translation_unit",
            node("declaration", leaf("primitive_type", "int", 0), leaf("identifier", "x", 4), leaf(";", 5)));

    @Test
    void testStartsOnRoot() {
        CstCursor cursor = new CstCursor(root);

        assertThat(cursor.getNode().getType()).isEqualTo("translation_unit");
        assertThat(cursor.getParentNode()).isNull();
        assertThat(cursor.getDepth()).isZero();
        assertThat(cursor.getSiblingCount()).isEqualTo(1);
        assertThat(cursor.gotoNextSibling()).isFalse();
        assertThat(cursor.gotoParent()).isFalse();
    }

    @Test
    void testWalksChildrenAndEntersEndState() {
        CstCursor cursor = new CstCursor(root);
        assertThat(cursor.gotoFirstChild()).isTrue();
        assertThat(cursor.gotoFirstChild()).isTrue();

        assertThat(cursor.getNode().getType()).isEqualTo("primitive_type");
        assertThat(cursor.getSiblingCount()).isEqualTo(3);
        assertThat(cursor.getRemainingSiblingCount()).isEqualTo(3);

        assertThat(cursor.gotoNextSibling()).isTrue();
        assertThat(cursor.gotoNextSibling()).isTrue();
        assertThat(cursor.getNode().getType()).isEqualTo(";");
        assertThat(cursor.getRemainingSiblingCount()).isEqualTo(1);

        assertThat(cursor.gotoNextSibling()).isFalse();
        assertThat(cursor.isAtEnd()).isTrue();
        assertThat(cursor.getNode()).isNull();
        assertThat(cursor.getRemainingSiblingCount()).isZero();
        assertThat(cursor.getParentNode().getType()).isEqualTo("declaration");
        assertThat(cursor.gotoNextSibling()).isFalse();
        assertThat(cursor.gotoFirstChild()).isFalse();
    }

    @Test
    void testGotoParentLeavesEndState() {
        CstCursor cursor = new CstCursor(root);
        cursor.gotoFirstChild();
        cursor.gotoFirstChild();
        while (cursor.gotoNextSibling()) {
            // run off the end
        }

        assertThat(cursor.gotoParent()).isTrue();
        assertThat(cursor.getNode().getType()).isEqualTo("declaration");
        assertThat(cursor.getDepth()).isEqualTo(1);
    }

    @Test
    void testLeafHasNoFirstChild() {
        CstCursor cursor = new CstCursor(leaf("identifier", "x", 0));

        assertThat(cursor.gotoFirstChild()).isFalse();
        assertThat(cursor.getNode().getType()).isEqualTo("identifier");
    }

    @Test
    void testResetDropsNavigationState() {
        CstCursor cursor = new CstCursor(root);
        cursor.gotoFirstChild();
        cursor.gotoFirstChild();

        FakeCstNode other = node("translation_unit");
        cursor.reset(other);

        assertThat(cursor.getNode()).isSameAs(other);
        assertThat(cursor.getDepth()).isZero();
        assertThat(cursor.gotoFirstChild()).isFalse();
    }
}
