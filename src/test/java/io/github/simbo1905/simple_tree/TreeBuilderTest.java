// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0

package io.github.simbo1905.simple_tree;

import io.github.simbo1905.LoggingControl;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static io.github.simbo1905.simple_tree.Tree.of;
import static org.assertj.core.api.Assertions.assertThat;

class TreeBuilderTest {

  @BeforeAll
  static void setupLogging() {
    LoggingControl.setupCleanLogging();
  }

  private static <T> TreePair<T> pair(int childCount, T value) {
    return new TreePair<>(childCount, value);
  }

  @Test
  void buildsFromValuePairs() {
    assertThat(TreeBuilder.fromPairsIterable(List.of(pair(0, "a"), pair(0, "b"), pair(0, "c"), pair(3, "d"))))
        .containsExactly(of("d", of("c"), of("b"), of("a")));
    assertThat(TreeBuilder.fromPairsIterable(List.of(pair(0, "a"), pair(1, "b"), pair(0, "c"), pair(1, "d"))))
        .containsExactly(of("d", of("c")), of("b", of("a")));
    assertThat(TreeBuilder.fromPairsIterator(Collections.<TreePair<String>>emptyIterator()))
        .containsExactly(Tree.empty());
  }

  @Test
  void consumesPairsLazily() {
    final AtomicInteger read = new AtomicInteger();
    final Iterator<TreePair<Integer>> counting = new Iterator<>() {
      @Override
      public boolean hasNext() {
        return read.get() < 1000;
      }

      @Override
      public TreePair<Integer> next() {
        final int i = read.getAndIncrement();
        return pair(i == 0 ? 0 : 1, i);
      }
    };
    final List<Tree<Integer>> trees = TreeBuilder.fromPairsIterator(counting);
    assertThat(read.get()).isEqualTo(1000);
    assertThat(trees).hasSize(1);
    assertThat(trees.get(0).height()).isEqualTo(1000);
    assertThat(trees.get(0).value()).isEqualTo(999);
  }

  @Test
  void appendPutsPoppedSubtreesBeforePayloadChildren() {
    final List<TreePair<Tree<String>>> pairs = List.of(
        pair(0, of("a", of("A"))), pair(0, of("b", of("B"))), pair(0, of("c", of("C"))), pair(3, of("d", of("D"))));
    assertThat(TreeBuilder.fromTreePairsIterable(pairs))
        .containsExactly(of("d", of("c", of("C")), of("b", of("B")), of("a", of("A")), of("D")));
  }

  @Test
  void appendNestsChains() {
    final List<TreePair<Tree<String>>> pairs = List.of(
        pair(0, of("a", of("A"))), pair(1, of("b", of("B"))), pair(1, of("c", of("C"))), pair(1, of("d", of("D"))));
    assertThat(TreeBuilder.fromTreePairsIterable(pairs, MergeStrategy.APPEND))
        .containsExactly(of("d", of("c", of("b", of("a", of("A")), of("B")), of("C")), of("D")));
  }

  @Test
  void replaceKeepsPayloadAndDropsSubtrees() {
    final List<TreePair<Tree<String>>> pairs = List.of(
        pair(0, of("a", of("A"))), pair(0, of("b", of("B"))), pair(0, of("c", of("C"))), pair(3, of("d", of("D"))));
    assertThat(TreeBuilder.fromTreePairsIterable(pairs, MergeStrategy.REPLACE))
        .containsExactly(of("d", of("D")));
  }

  @Test
  void emptyPayloadOrphansAreKeptByAppend() {
    final List<TreePair<Tree<String>>> pairs = List.of(pair(0, of("a")), pair(0, of("b")), pair(2, Tree.<String>empty()));
    assertThat(TreeBuilder.fromTreePairsIterable(pairs, MergeStrategy.APPEND)).containsExactly(of("b"), of("a"));
    final List<TreePair<Tree<String>>> joined = List.of(pair(0, of("a")), pair(1, Tree.<String>empty()), pair(1, of("c")));
    assertThat(TreeBuilder.fromTreePairsIterable(joined)).containsExactly(of("c", of("a")));
  }

  @Test
  void emptyPayloadOrphansAreDroppedByReplace() {
    final List<TreePair<Tree<String>>> pairs = List.of(pair(0, of("a")), pair(0, of("b")), pair(2, Tree.<String>empty()));
    assertThat(TreeBuilder.fromTreePairsIterable(pairs, MergeStrategy.REPLACE)).containsExactly(Tree.empty());
  }

  @Test
  void treePairsUnderflowLeniently() {
    final List<TreePair<Tree<String>>> pairs = List.of(pair(0, of("a")), pair(2, of("b")));
    assertThat(TreeBuilder.fromTreePairsIterable(pairs)).containsExactly(Tree.empty(), of("a"));
  }

  @Test
  void linearTrees() {
    assertThat(TreeBuilder.linearTreeFromSequence(List.of("a", "b", "c"))).isEqualTo(TreeFixtures.tree3_1);
    assertThat(TreeBuilder.linearTreeFromSequence(List.<String>of())).isEqualTo(Tree.empty());
  }
}
