// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//

package io.github.simbo1905.simple_tree;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/// Equality, hashing and printing shared by the tree implementations
final class TreeObjects {

  static final int PRINTABLE_SIZE_LIMIT = 50;

  private TreeObjects() {
  }

  /// Two trees are the same when a preorder walk of both sees the same values with the same child counts
  static boolean sameTrees(Tree<?> first, Tree<?> second) {
    if (first == second) {
      return true;
    }
    if (first.size() != second.size() || first.width() != second.width() || first.height() != second.height()) {
      return false;
    }
    final Deque<Tree<?>> left = new ArrayDeque<>();
    final Deque<Tree<?>> right = new ArrayDeque<>();
    if (!first.isEmpty()) {
      left.push(first);
      right.push(second);
    }
    while (!left.isEmpty()) {
      final Tree<?> a = left.pop();
      final Tree<?> b = right.pop();
      if (a.childrenCount() != b.childrenCount() || !a.value().equals(b.value())) {
        return false;
      }
      pushChildren(left, a.children());
      pushChildren(right, b.children());
    }
    return true;
  }

  private static void pushChildren(Deque<Tree<?>> stack, List<? extends Tree<?>> children) {
    for (int i = children.size() - 1; i >= 0; i--) {
      stack.push(children.get(i));
    }
  }

  static int hash(Tree<?> tree) {
    int hash = 17;
    hash = hash * 31 + (tree.isEmpty() ? 0 : tree.value().hashCode());
    hash = hash * 29 + tree.size();
    hash = hash * 13 + tree.width();
    hash = hash * 19 + tree.height();
    return hash;
  }

  static String describe(Tree<?> tree) {
    if (tree.isEmpty()) {
      return "Tree.empty";
    }
    if (tree.size() >= PRINTABLE_SIZE_LIMIT) {
      return "Tree(size=" + tree.size() + ", width=" + tree.width() + ", height=" + tree.height() + ")";
    }
    final StringBuilder sb = new StringBuilder();
    appendTree(sb, tree);
    return sb.toString();
  }

  private static void appendTree(StringBuilder sb, Tree<?> tree) {
    sb.append("Tree(");
    final Object value = tree.value();
    if (value instanceof String) {
      sb.append('"').append(value).append('"');
    } else {
      sb.append(value);
    }
    for (Tree<?> child : tree.children()) {
      sb.append(", ");
      appendTree(sb, child);
    }
    sb.append(')');
  }
}
