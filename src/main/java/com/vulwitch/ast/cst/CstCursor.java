package com.vulwitch.ast.cst;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Walks a CST with four moves: first child, next sibling, parent, and reading the current node.
 *
 * Advancing past the last sibling leaves the cursor in an explicit end state where
 * {@link #getNode()} returns {@code null}; {@link #gotoParent()} leaves that state again.
 * This lets sibling loops simply re-test the current node after each step.
 *
 * Not thread-safe: a cursor belongs to one lowering at a time.
 */
public final class CstCursor {

    private final Deque<Frame> frames = new ArrayDeque<>();
    private CstNode root;

    public CstCursor(CstNode root) {
        this.root = root;
    }

    /**
     * Current node, or {@code null} when the cursor has moved past the last sibling.
     */
    public CstNode getNode() {
        Frame frame = frames.peek();
        if (frame == null) {
            return root;
        }
        return frame.index < frame.parent.getChildCount() ? frame.parent.getChild(frame.index) : null;
    }

    /**
     * Parent of the current position, or {@code null} at the root. Defined in the end state too.
     */
    public CstNode getParentNode() {
        Frame frame = frames.peek();
        return frame == null ? null : frame.parent;
    }

    public boolean isAtEnd() {
        return getNode() == null;
    }

    public boolean gotoFirstChild() {
        CstNode node = getNode();
        if (node == null || node.getChildCount() == 0) {
            return false;
        }
        frames.push(new Frame(node));
        return true;
    }

    /**
     * Moves to the next sibling. Returns {@code false} when there is none; the cursor is then
     * in the end state.
     */
    public boolean gotoNextSibling() {
        Frame frame = frames.peek();
        if (frame == null) {
            return false;
        }
        int count = frame.parent.getChildCount();
        if (frame.index >= count) {
            return false;
        }
        frame.index++;
        return frame.index < count;
    }

    public boolean gotoParent() {
        if (frames.isEmpty()) {
            return false;
        }
        frames.pop();
        return true;
    }

    /**
     * Number of children of the current node's parent, counting the current node.
     */
    public int getSiblingCount() {
        Frame frame = frames.peek();
        return frame == null ? 1 : frame.parent.getChildCount();
    }

    /**
     * Number of siblings from the current position (inclusive) to the last one.
     */
    public int getRemainingSiblingCount() {
        Frame frame = frames.peek();
        if (frame == null) {
            return root == null ? 0 : 1;
        }
        return Math.max(0, frame.parent.getChildCount() - frame.index);
    }

    public int getDepth() {
        return frames.size();
    }

    /**
     * Re-targets the cursor at a new tree, dropping all navigation state.
     */
    public void reset(CstNode newRoot) {
        frames.clear();
        this.root = newRoot;
    }

    private static final class Frame {
        private final CstNode parent;
        private int index;

        private Frame(CstNode parent) {
            this.parent = parent;
        }
    }
}
