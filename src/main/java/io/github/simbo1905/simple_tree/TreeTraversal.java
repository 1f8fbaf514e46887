// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//

package io.github.simbo1905.simple_tree;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.Predicate;

/// Lazy walks over any [Tree]. They only use `value()` and `children()` and keep their own stack,
/// so deep trees do not exhaust the call stack.
final class TreeTraversal {

  private TreeTraversal() {
  }

  static <E> List<E> toList(Iterator<E> iterator) {
    final List<E> result = new ArrayList<>();
    iterator.forEachRemaining(result::add);
    return List.copyOf(result);
  }

  /// Visits every node down to `maxDepth`, the root at level 1. Nothing is visited when `maxDepth < 1`.
  static <T> Iterator<TreeLevel<T>> nodesAndLevels(Tree<T> root, TraversingMode mode, int maxDepth) {
    Objects.requireNonNull(mode, "mode must not be null");
    final Deque<TreeLevel<T>> pending = new ArrayDeque<>();
    if (!root.isEmpty() && maxDepth > 0) {
      pending.add(new TreeLevel<>(1, root));
    }
    final boolean depthFirst = mode.isDepthFirst();
    return new Iterator<>() {
      @Override
      public boolean hasNext() {
        return !pending.isEmpty();
      }

      @Override
      public TreeLevel<T> next() {
        if (pending.isEmpty()) {
          throw new NoSuchElementException();
        }
        final TreeLevel<T> current = pending.pollFirst();
        final int level = current.level();
        if (level < maxDepth) {
          final List<Tree<T>> children = current.tree().children();
          if (depthFirst) {
            for (int i = children.size() - 1; i >= 0; i--) {
              pending.addFirst(new TreeLevel<>(level + 1, children.get(i)));
            }
          } else {
            for (Tree<T> child : children) {
              pending.addLast(new TreeLevel<>(level + 1, child));
            }
          }
        }
        return current;
      }
    };
  }

  /// Walks depth-first keeping the current path. With `allPaths` every node ends a candidate path,
  /// otherwise only leaves and nodes at `maxDepth` do. The filter only decides what is emitted.
  static <T> Iterator<List<T>> branches(Tree<T> root, Predicate<List<T>> filter, int maxDepth, boolean allPaths) {
    Objects.requireNonNull(filter, "filter must not be null");
    final Deque<TreeLevel<T>> stack = new ArrayDeque<>();
    if (!root.isEmpty() && maxDepth > 0) {
      stack.push(new TreeLevel<>(1, root));
    }
    final List<T> path = new ArrayList<>();
    return new LookaheadIterator<>() {
      @Override
      protected List<T> seekNext() {
        while (!stack.isEmpty()) {
          final TreeLevel<T> current = stack.pop();
          final int level = current.level();
          final Tree<T> node = current.tree();
          path.subList(level - 1, path.size()).clear();
          path.add(node.value());
          final boolean terminal = node.isLeaf() || level >= maxDepth;
          if (!terminal) {
            final List<Tree<T>> children = node.children();
            for (int i = children.size() - 1; i >= 0; i--) {
              stack.push(new TreeLevel<>(level + 1, children.get(i)));
            }
          }
          if (allPaths || terminal) {
            final List<T> candidate = List.copyOf(path);
            if (filter.test(candidate)) {
              return candidate;
            }
          }
        }
        return null;
      }
    };
  }

  /// Follows the path from the root taking the last child with the next value at each step.
  /// @return the nodes matched, empty when the root does not match
  static <T> List<Tree<T>> followPath(Tree<T> root, List<T> path) {
    Objects.requireNonNull(path, "path must not be null");
    final List<Tree<T>> matched = new ArrayList<>();
    if (root.isEmpty() || path.isEmpty() || !root.value().equals(path.get(0))) {
      return matched;
    }
    matched.add(root);
    Tree<T> current = root;
    for (int i = 1; i < path.size(); i++) {
      final Tree<T> next = lastChildWithValue(current.children(), path.get(i));
      if (next == null) {
        break;
      }
      matched.add(next);
      current = next;
    }
    return matched;
  }

  static <T> int lastIndexOfValue(List<Tree<T>> trees, T value) {
    for (int i = trees.size() - 1; i >= 0; i--) {
      if (trees.get(i).value().equals(value)) {
        return i;
      }
    }
    return -1;
  }

  static <T> int indexOfValue(List<Tree<T>> trees, T value) {
    for (int i = 0; i < trees.size(); i++) {
      if (trees.get(i).value().equals(value)) {
        return i;
      }
    }
    return -1;
  }

  private static <T> Tree<T> lastChildWithValue(List<Tree<T>> children, T value) {
    final int index = lastIndexOfValue(children, value);
    return index < 0 ? null : children.get(index);
  }
}
