package com.tokgen.engine.util;

import com.tokgen.engine.token.InternalListToken;
import com.tokgen.engine.token.ListToken;
import com.tokgen.engine.token.Token;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Tree utilities used by rewriting passes. Traversals come in two flavours matching the two
 * child views of a token: the visible children that rendering walks and the structural children
 * a rewriting pass may replace.
 */
public final class TokenOps {

    private TokenOps() {}

    /** Visible children of {@code token}, empty for leaves. */
    public static List<Token> children(Token token) {
        if (!(token instanceof ListToken list)) {
            return List.of();
        }
        List<Token> children = new ArrayList<>(list.len());
        for (int i = 0; i < list.len(); i++) {
            children.add(list.get(i));
        }
        return children;
    }

    /** Structural children of {@code token}, empty for leaves. */
    public static List<Token> internalChildren(Token token) {
        if (!(token instanceof InternalListToken list)) {
            return List.of();
        }
        List<Token> children = new ArrayList<>(list.internalLen());
        for (int i = 0; i < list.internalLen(); i++) {
            children.add(list.internalGet(i));
        }
        return children;
    }

    /** Root first, then the visible children left to right. */
    public static List<Token> preOrder(Token root) {
        return walk(root, false);
    }

    /** Root first, then the structural children left to right. */
    public static List<Token> internalPreOrder(Token root) {
        return walk(root, true);
    }

    /**
     * Finds the structural parent of {@code target} below {@code root}.
     *
     * @return the parent, or {@code null} if {@code target} is the root or not part of the tree
     */
    public static InternalListToken parentOf(Token root, Token target) {
        for (Token token : internalPreOrder(root)) {
            if (token instanceof InternalListToken list) {
                for (int i = 0; i < list.internalLen(); i++) {
                    if (list.internalGet(i) == target) {
                        return list;
                    }
                }
            }
        }
        return null;
    }

    /**
     * Replaces {@code oldSubtree} with {@code newSubtree} in place.
     *
     * @return the root of the rewritten tree, which is {@code newSubtree} when the root itself was
     *     replaced
     * @throws IllegalArgumentException if {@code oldSubtree} is not part of the tree
     */
    public static Token replace(Token root, Token oldSubtree, Token newSubtree) {
        if (root == oldSubtree) {
            return newSubtree;
        }
        InternalListToken parent = parentOf(root, oldSubtree);
        if (parent == null) {
            throw new IllegalArgumentException("token is not part of the tree: " + oldSubtree);
        }
        parent.internalReplace(oldSubtree, newSubtree);
        return root;
    }

    /**
     * Logically removes {@code target}. A parent that cannot live without the token is removed
     * from its own parent in turn.
     *
     * @return the root of the rewritten tree, or {@code null} if the whole tree was removed
     * @throws IllegalArgumentException if {@code target} is not part of the tree
     */
    public static Token logicalRemove(Token root, Token target) {
        if (root == target) {
            return null;
        }
        InternalListToken parent = parentOf(root, target);
        if (parent == null) {
            throw new IllegalArgumentException("token is not part of the tree: " + target);
        }
        Token replacement = parent.internalLogicalRemove(target);
        if (replacement == parent) {
            return root;
        }
        if (replacement == null) {
            return logicalRemove(root, parent);
        }
        return replace(root, parent, replacement);
    }

    private static List<Token> walk(Token root, boolean internal) {
        List<Token> result = new ArrayList<>();
        Deque<Token> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            Token current = stack.pop();
            result.add(current);
            List<Token> children = internal ? internalChildren(current) : children(current);
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return result;
    }
}
