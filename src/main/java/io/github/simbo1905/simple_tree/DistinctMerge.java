// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//

package io.github.simbo1905.simple_tree;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import static io.github.simbo1905.simple_tree.Tree.LOGGER;

/// Modifications that keep siblings distinct by value. When two siblings share a value the first one
/// stays where it is and takes over the children of the other.
final class DistinctMerge {

  private DistinctMerge() {
  }

  /// Left and right sibling lists around an insertion point
  record Siblings<T>(List<Tree<T>> left, List<Tree<T>> right) {
  }

  private record Pending<T>(Tree<T> tree, boolean inspect, int level) {
  }

  /// A modified deflated tree is deflated again once it reaches the configured threshold
  static <T> Tree<T> keepRepresentation(Tree<T> original, Tree<T> result) {
    if (original instanceof ArrayTree && result.size() >= TreeOptions.current().deflateThreshold()) {
      return result.deflated();
    }
    return result;
  }

  /// Groups the children of each examined node by value, in order of first occurrence, and collapses
  /// each group into one node holding the concatenated children. The root's children are always
  /// examined, a merged node with more than one child is always examined, any other node only while its
  /// level is within `maxLookupLevel`.
  static <T> Tree<T> makeTreeDistinct(Tree<T> tree, int maxLookupLevel) {
    if (tree.isEmpty() || tree.isLeaf()) {
      return tree;
    }
    final Deque<Pending<T>> queue = new ArrayDeque<>();
    queue.push(new Pending<>(tree, true, 1));
    final List<TreePair<Tree<T>>> preorder = new ArrayList<>();
    int collapsed = 0;
    while (!queue.isEmpty()) {
      final Pending<T> current = queue.pop();
      if (current.inspect() || current.level() <= maxLookupLevel) {
        final Map<T, List<Tree<T>>> groups = new LinkedHashMap<>();
        for (Tree<T> child : current.tree().children()) {
          groups.computeIfAbsent(child.value(), key -> new ArrayList<>()).add(child);
        }
        final List<Pending<T>> next = new ArrayList<>(groups.size());
        for (Map.Entry<T, List<Tree<T>>> group : groups.entrySet()) {
          final List<Tree<T>> members = group.getValue();
          if (members.size() == 1) {
            next.add(new Pending<>(members.get(0), false, current.level() + 1));
          } else {
            collapsed += members.size() - 1;
            final List<Tree<T>> concatenated = new ArrayList<>();
            for (Tree<T> member : members) {
              concatenated.addAll(member.children());
            }
            next.add(new Pending<>(Tree.of(group.getKey(), concatenated), concatenated.size() > 1,
                current.level() + 1));
          }
        }
        preorder.add(new TreePair<>(next.size(), Tree.of(current.tree().value())));
        for (int i = next.size() - 1; i >= 0; i--) {
          queue.push(next.get(i));
        }
      } else {
        preorder.add(new TreePair<>(0, current.tree()));
      }
    }
    final int merged = collapsed;
    LOGGER.fine(() -> "Collapsed " + merged + " duplicate sibling(s) looking down to level " + maxLookupLevel);
    return TreeBuilder.fromTreePairsIterable(reversed(preorder), MergeStrategy.APPEND).get(0);
  }

  /// Inserts `child` between the given siblings of a node with value `value`
  static <T> Tree<T> insertChildDistinct(T value, List<Tree<T>> left, Tree<T> child, List<Tree<T>> right) {
    final Siblings<T> siblings = insertDistinctBetweenSiblings(left, child, right);
    return Tree.of(value, concat(siblings.left(), siblings.right()));
  }

  /// Inserts each of `children` in turn, each one after the previous
  static <T> Tree<T> insertChildrenDistinct(T value, List<Tree<T>> left, List<Tree<T>> children,
                                            List<Tree<T>> right) {
    Siblings<T> siblings = new Siblings<>(left, right);
    for (Tree<T> child : children) {
      siblings = insertDistinctBetweenSiblings(siblings.left(), child, siblings.right());
    }
    return Tree.of(value, concat(siblings.left(), siblings.right()));
  }

  /// Puts `child` at the end of `left` unless a sibling with the same value exists. The nearest one on
  /// the left wins and takes the new content after its own children, in place. Otherwise the nearest one
  /// on the right is moved to the end of `left` with the new content before its own children.
  static <T> Siblings<T> insertDistinctBetweenSiblings(List<Tree<T>> left, Tree<T> child, List<Tree<T>> right) {
    Objects.requireNonNull(child, "child must not be null");
    if (child.isEmpty()) {
      return new Siblings<>(left, right);
    }
    final T value = child.value();
    final int onLeft = TreeTraversal.lastIndexOfValue(left, value);
    if (onLeft >= 0) {
      final Tree<T> duplicate = left.get(onLeft);
      final Tree<T> merged = insertChildrenDistinct(value, duplicate.children(), child.children(), List.of());
      final List<Tree<T>> newLeft = new ArrayList<>(left);
      newLeft.set(onLeft, merged);
      return new Siblings<>(newLeft, right);
    }
    final int onRight = TreeTraversal.indexOfValue(right, value);
    if (onRight < 0) {
      return new Siblings<>(append(left, child), right);
    }
    final Tree<T> duplicate = right.get(onRight);
    final Tree<T> merged = insertChildrenDistinct(value, child.children(), duplicate.children(), List.of());
    final List<Tree<T>> newRight = new ArrayList<>(right);
    newRight.remove(onRight);
    return new Siblings<>(append(left, merged), newRight);
  }

  /// Splits the children next to the first sibling sharing the child's value, or at the front or back
  /// when there is none, and inserts there.
  static <T> Tree<T> insertChild(Tree<T> tree, Tree<T> child, MergeOrder order) {
    Objects.requireNonNull(child, "child must not be null");
    Objects.requireNonNull(order, "order must not be null");
    if (child.isEmpty()) {
      return tree;
    }
    if (tree.isEmpty()) {
      return child;
    }
    final List<Tree<T>> children = tree.children();
    final int duplicate = TreeTraversal.indexOfValue(children, child.value());
    final int split;
    if (order == MergeOrder.BEFORE) {
      split = duplicate >= 0 ? duplicate : 0;
    } else {
      split = duplicate >= 0 ? duplicate + 1 : children.size();
    }
    return insertChildDistinct(tree.value(), children.subList(0, split), child,
        children.subList(split, children.size()));
  }

  /// Follows the existing path, taking the first child with the next value at each step, and hangs the
  /// rest of the branch, as a single line, in front of the children of the last node matched.
  static <T> Tree<T> insertBranch(Tree<T> tree, List<T> branch) {
    Objects.requireNonNull(branch, "branch must not be null");
    if (branch.isEmpty()) {
      return tree;
    }
    if (tree.isEmpty()) {
      return TreeBuilder.linearTreeFromSequence(branch);
    }
    if (!tree.value().equals(branch.get(0))) {
      return tree;
    }
    final List<Tree<T>> matched = new ArrayList<>();
    final List<Integer> indexes = new ArrayList<>();
    matched.add(tree);
    Tree<T> current = tree;
    for (int i = 1; i < branch.size(); i++) {
      final List<Tree<T>> children = current.children();
      final int index = TreeTraversal.indexOfValue(children, branch.get(i));
      if (index < 0) {
        break;
      }
      current = children.get(index);
      matched.add(current);
      indexes.add(index);
    }
    if (matched.size() == branch.size()) {
      return tree;
    }
    final Tree<T> remainder = TreeBuilder.linearTreeFromSequence(branch.subList(matched.size(), branch.size()));
    Tree<T> rebuilt = Tree.of(current.value(), concat(List.of(remainder), current.children()));
    for (int i = matched.size() - 2; i >= 0; i--) {
      final Tree<T> parent = matched.get(i);
      final List<Tree<T>> children = new ArrayList<>(parent.children());
      children.set(indexes.get(i), rebuilt);
      rebuilt = Tree.of(parent.value(), children);
    }
    return rebuilt;
  }

  private static <E> List<E> reversed(List<E> list) {
    final List<E> result = new ArrayList<>(list);
    Collections.reverse(result);
    return result;
  }

  private static <T> List<Tree<T>> append(List<Tree<T>> list, Tree<T> tree) {
    final List<Tree<T>> result = new ArrayList<>(list.size() + 1);
    result.addAll(list);
    result.add(tree);
    return result;
  }

  private static <T> List<Tree<T>> concat(List<Tree<T>> first, List<Tree<T>> second) {
    final List<Tree<T>> result = new ArrayList<>(first.size() + second.size());
    result.addAll(first);
    result.addAll(second);
    return result;
  }
}
