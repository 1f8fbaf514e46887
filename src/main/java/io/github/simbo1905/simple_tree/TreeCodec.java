// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//

package io.github.simbo1905.simple_tree;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;

import static io.github.simbo1905.simple_tree.Tree.LOGGER;

/// Converts between trees and the linear encoding: child counts and values aligned by index in
/// reversed preorder, so every child is read before its parent and the root comes last.
final class TreeCodec {

  private TreeCodec() {
  }

  static <T> TreeArrays<T> toArrays(Tree<T> tree) {
    if (tree instanceof ArrayTree<T> arrayTree) {
      return TreeArrays.wrap(arrayTree.structureWindow(), arrayTree.valuesWindow());
    }
    final int size = tree.size();
    final int[] structure = new int[size];
    final Object[] values = new Object[size];
    encode(tree, structure, values);
    return TreeArrays.wrap(structure, values);
  }

  static <T> int[] toStructureArray(Tree<T> tree) {
    if (tree instanceof ArrayTree<T> arrayTree) {
      return arrayTree.structureWindow();
    }
    final int size = tree.size();
    final int[] structure = new int[size];
    encode(tree, structure, new Object[size]);
    return structure;
  }

  static <T> Tree<T> deflate(Tree<T> tree) {
    if (tree.isEmpty() || tree instanceof ArrayTree) {
      return tree;
    }
    final int size = tree.size();
    final int[] structure = new int[size];
    final Object[] values = new Object[size];
    encode(tree, structure, values);
    return new ArrayTree<>(structure, values, 0, size);
  }

  /// Fills both arrays from the end with a preorder walk, which leaves them in reversed preorder
  private static <T> void encode(Tree<T> tree, int[] structure, Object[] values) {
    if (tree.isEmpty()) {
      return;
    }
    final Deque<Tree<T>> stack = new ArrayDeque<>();
    stack.push(tree);
    int position = structure.length - 1;
    while (!stack.isEmpty()) {
      final Tree<T> node = stack.pop();
      final List<Tree<T>> children = node.children();
      structure[position] = children.size();
      values[position] = node.value();
      position--;
      for (int i = children.size() - 1; i >= 0; i--) {
        stack.push(children.get(i));
      }
    }
  }

  static <T> Iterator<TreePair<T>> pairsIterator(Tree<T> tree) {
    final TreeArrays<T> arrays = toArrays(tree);
    final int[] structure = arrays.structure();
    final List<T> values = arrays.values();
    return new Iterator<>() {
      private int index = 0;

      @Override
      public boolean hasNext() {
        return index < structure.length;
      }

      @Override
      public TreePair<T> next() {
        if (!hasNext()) {
          throw new NoSuchElementException();
        }
        final TreePair<T> pair = new TreePair<>(structure[index], values.get(index));
        index++;
        return pair;
      }
    };
  }

  /// Decodes aligned arrays into the trees they hold, the last encoded tree first.
  /// A single well formed tree comes back deflated over copies of the input.
  static <T> List<Tree<T>> decode(int[] structure, Object[] values) {
    Objects.requireNonNull(structure, "structure must not be null");
    Objects.requireNonNull(values, "values must not be null");
    if (structure.length != values.length) {
      throw new IllegalArgumentException("structure and values must have the same length but were "
          + structure.length + " and " + values.length);
    }
    final int length = structure.length;
    if (length == 0) {
      return List.of(Tree.empty());
    }
    final int[] counts = new int[length];
    final Object[] copies = new Object[length];
    for (int i = 0; i < length; i++) {
      if (structure[i] < 0) {
        final int at = i;
        LOGGER.fine(() -> "Negative child count " + structure[at] + " at " + at + " read as a leaf");
      }
      counts[i] = Math.max(0, structure[i]);
      copies[i] = Objects.requireNonNull(values[i], "values must not contain null");
    }
    if (ArrayTreeFunctions.treeSize(counts, length - 1, 0) == length) {
      return List.of(new ArrayTree<>(counts, copies, 0, length));
    }
    final List<Tree<T>> trees = assemble(counts, copies, 0, length);
    LOGGER.fine(() -> "Decoded " + trees.size() + " tree(s) from " + length + " entries");
    return trees.isEmpty() ? List.of(Tree.empty()) : List.copyOf(trees);
  }

  /// Rebuilds linked nodes from a well formed window
  static <T> Tree<T> inflate(int[] structure, Object[] values, int from, int to) {
    return TreeCodec.<T>assemble(structure, values, from, to).get(0);
  }

  @SuppressWarnings("unchecked")
  private static <T> List<Tree<T>> assemble(int[] structure, Object[] values, int from, int to) {
    final Iterator<Integer> indexes = new Iterator<>() {
      private int index = from;

      @Override
      public boolean hasNext() {
        return index < to;
      }

      @Override
      public Integer next() {
        if (!hasNext()) {
          throw new NoSuchElementException();
        }
        return index++;
      }
    };
    return StackMachine.assemble(indexes,
        index -> structure[index],
        (index, children) -> Optional.of(Tree.of((T) values[index], children)),
        index -> Tree.empty());
  }

  static <T> List<Tree<T>> decodePairs(Iterator<TreePair<T>> pairs) {
    Objects.requireNonNull(pairs, "pairs must not be null");
    final List<Tree<T>> trees = StackMachine.assemble(pairs,
        TreePair::childCount,
        (pair, children) -> Optional.of(Tree.of(pair.value(), children)),
        pair -> Tree.empty());
    return trees.isEmpty() ? List.of(Tree.empty()) : List.copyOf(trees);
  }
}
