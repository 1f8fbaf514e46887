// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//

package io.github.simbo1905.simple_tree;

import org.jetbrains.annotations.NotNull;

import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import static io.github.simbo1905.simple_tree.Tree.LOGGER;

/// Builds trees from linear encodings in reversed preorder, where each entry says how many of the
/// entries read before it are its children. Input that leaves more than one tree on the stack yields a
/// forest, the most recently completed tree first. An empty input yields a single empty tree.
///
/// Decoding is lenient: an entry asking for more children than are available is replaced by an empty
/// tree and negative counts are read as zero.
public final class TreeBuilder {

  private TreeBuilder() {
  }

  /// Decodes aligned arrays. A single well formed tree is returned deflated over copies of the arrays.
  /// @throws IllegalArgumentException if the arrays differ in length
  public static <T> List<Tree<T>> fromArrays(@NotNull int[] structure, @NotNull T[] values) {
    Objects.requireNonNull(values, "values must not be null");
    return TreeCodec.decode(structure, values);
  }

  public static <T> List<Tree<T>> fromLists(@NotNull int[] structure, @NotNull List<T> values) {
    Objects.requireNonNull(values, "values must not be null");
    return TreeCodec.decode(structure, values.toArray());
  }

  public static <T> List<Tree<T>> fromArrays(@NotNull TreeArrays<T> arrays) {
    Objects.requireNonNull(arrays, "arrays must not be null");
    return TreeCodec.decode(arrays.structure(), arrays.values().toArray());
  }

  /// @return the first tree decoded, or the empty tree
  public static <T> Tree<T> fromArraysHead(@NotNull int[] structure, @NotNull T[] values) {
    return fromArrays(structure, values).get(0);
  }

  public static <T> List<Tree<T>> fromPairsIterator(@NotNull Iterator<TreePair<T>> pairs) {
    return TreeCodec.decodePairs(pairs);
  }

  public static <T> List<Tree<T>> fromPairsIterable(@NotNull Iterable<TreePair<T>> pairs) {
    Objects.requireNonNull(pairs, "pairs must not be null");
    return TreeCodec.decodePairs(pairs.iterator());
  }

  public static <T> List<Tree<T>> fromTreePairsIterator(@NotNull Iterator<TreePair<Tree<T>>> pairs) {
    return fromTreePairsIterator(pairs, MergeStrategy.APPEND);
  }

  /// Builds from pairs whose payloads are whole trees, joining each payload with the subtrees it pops
  /// as the strategy says.
  public static <T> List<Tree<T>> fromTreePairsIterator(@NotNull Iterator<TreePair<Tree<T>>> pairs,
                                                        @NotNull MergeStrategy strategy) {
    Objects.requireNonNull(pairs, "pairs must not be null");
    Objects.requireNonNull(strategy, "strategy must not be null");
    final List<Tree<T>> trees = StackMachine.assemble(pairs,
        pair -> pair.value().isEmpty() && strategy.keepOrphanedSubtrees() ? 0 : pair.childCount(),
        (pair, subtrees) -> {
          if (pair.value().isEmpty()) {
            if (pair.childCount() > 0) {
              LOGGER.fine(() -> "Empty payload with " + pair.childCount() + " subtree(s), "
                  + (strategy.keepOrphanedSubtrees() ? "kept for the next parent" : "discarded"));
            }
            return Optional.empty();
          }
          return Optional.of(strategy.merge(pair.value(), subtrees));
        },
        pair -> Tree.empty());
    return trees.isEmpty() ? List.of(Tree.empty()) : List.copyOf(trees);
  }

  public static <T> List<Tree<T>> fromTreePairsIterable(@NotNull Iterable<TreePair<Tree<T>>> pairs) {
    return fromTreePairsIterable(pairs, MergeStrategy.APPEND);
  }

  public static <T> List<Tree<T>> fromTreePairsIterable(@NotNull Iterable<TreePair<Tree<T>>> pairs,
                                                        @NotNull MergeStrategy strategy) {
    Objects.requireNonNull(pairs, "pairs must not be null");
    return fromTreePairsIterator(pairs.iterator(), strategy);
  }

  /// Builds a single branch tree, the first value at the root
  public static <T> Tree<T> linearTreeFromSequence(@NotNull List<T> values) {
    Objects.requireNonNull(values, "values must not be null");
    Tree<T> tree = Tree.empty();
    for (int i = values.size() - 1; i >= 0; i--) {
      tree = tree.isEmpty() ? Tree.of(values.get(i)) : Tree.of(values.get(i), List.of(tree));
    }
    return tree;
  }
}
