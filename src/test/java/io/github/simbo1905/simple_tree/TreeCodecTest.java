// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0

package io.github.simbo1905.simple_tree;

import io.github.simbo1905.LoggingControl;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.List;

import static io.github.simbo1905.simple_tree.TreeFixtures.*;
import static io.github.simbo1905.simple_tree.Tree.of;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;

class TreeCodecTest {

  @BeforeAll
  static void setupLogging() {
    LoggingControl.setupCleanLogging();
  }

  @ParameterizedTest
  @EnumSource(Form.class)
  void encodesInReversedPreorder(Form form) {
    assertArrayEquals(new int[0], form.apply(tree0).toStructureArray());
    assertArrayEquals(new int[]{0}, form.apply(tree1).toStructureArray());
    assertArrayEquals(new int[]{0, 0, 1, 2}, form.apply(tree4_2).toStructureArray());
    final TreeArrays<String> arrays = form.apply(tree7).toArrays();
    assertArrayEquals(new int[]{0, 0, 1, 1, 0, 1, 3}, arrays.structure());
    assertThat(arrays.values()).containsExactly("g", "f", "e", "d", "c", "b", "a");
    final TreeArrays<String> nine = form.apply(tree9).toArrays();
    assertArrayEquals(new int[]{0, 1, 0, 1, 2, 0, 1, 1, 2}, nine.structure());
    assertThat(nine.values()).containsExactly("i", "h", "g", "f", "e", "d", "c", "b", "a");
  }

  @Test
  void encodingLengthIsTreeSize() {
    for (Tree<String> tree : ALL) {
      assertThat(tree.toArrays().length()).isEqualTo(tree.size());
      assertThat(tree.toPairs()).hasSize(tree.size());
    }
  }

  @Test
  void pairsFollowTheArrays() {
    assertThat(tree3_2.toPairs()).containsExactly(
        new TreePair<>(0, "c"), new TreePair<>(0, "b"), new TreePair<>(2, "a"));
    assertThat(tree3_2.deflated().toPairsIterator()).toIterable().containsExactly(
        new TreePair<>(0, "c"), new TreePair<>(0, "b"), new TreePair<>(2, "a"));
  }

  @Test
  void everyFixtureRoundTrips() {
    for (Tree<String> tree : ALL) {
      final TreeArrays<String> arrays = tree.toArrays();
      assertThat(TreeBuilder.fromArrays(arrays)).containsExactly(tree);
      assertThat(TreeBuilder.fromPairsIterator(tree.toPairsIterator())).containsExactly(tree);
    }
  }

  @Test
  void singleWellFormedTreeDecodesDeflated() {
    final int[] structure = {0, 1, 1};
    final String[] values = {"aaa", "aa", "a"};
    final Tree<String> tree = TreeBuilder.fromArraysHead(structure, values);
    assertThat(tree).isInstanceOf(ArrayTree.class);
    assertThat(tree).isEqualTo(of("a", of("aa", of("aaa"))));
    structure[1] = 0;
    values[0] = "changed";
    assertThat(tree.values()).containsExactly("a", "aa", "aaa");
  }

  @Test
  void decodesForestsAndPartialInput() {
    assertThat(TreeBuilder.fromArrays(new int[0], new String[0])).containsExactly(Tree.empty());
    assertThat(TreeBuilder.fromArrays(new int[]{0}, new String[]{"a"})).containsExactly(of("a"));
    assertThat(TreeBuilder.fromArrays(new int[]{0, 1}, new String[]{"aa", "a"}))
        .containsExactly(of("a", of("aa")));
    assertThat(TreeBuilder.fromArrays(new int[]{0, 0}, new String[]{"aa", "a"}))
        .containsExactly(of("a"), of("aa"));
    assertThat(TreeBuilder.fromArrays(new int[]{0, 1, 1}, new String[]{"aaa", "aa", "a"}))
        .containsExactly(of("a", of("aa", of("aaa"))));
    assertThat(TreeBuilder.fromArrays(new int[]{0, 0, 2}, new String[]{"aaa", "aa", "a"}))
        .containsExactly(of("a", of("aa"), of("aaa")));
    assertThat(TreeBuilder.fromArrays(new int[]{0, 0, 1}, new String[]{"aaa", "aa", "a"}))
        .containsExactly(of("a", of("aa")), of("aaa"));
    assertThat(TreeBuilder.fromArrays(new int[]{0, 0, 0}, new String[]{"aaa", "aa", "a"}))
        .containsExactly(of("a"), of("aa"), of("aaa"));
    assertThat(TreeBuilder.fromArrays(new int[]{0, 1, 0}, new String[]{"aaa", "aa", "a"}))
        .containsExactly(of("a"), of("aa", of("aaa")));
  }

  @Test
  void missingChildrenBecomeEmptyTrees() {
    assertThat(TreeBuilder.fromArrays(new int[]{1, 0, 0}, new String[]{"aaa", "aa", "a"}))
        .containsExactly(of("a"), of("aa"), Tree.empty());
    assertThat(TreeBuilder.fromArrays(new int[]{0, 3}, new String[]{"b", "a"}))
        .containsExactly(Tree.empty(), of("b"));
  }

  @Test
  void placeholdersPoppedByALaterParentDisappear() {
    final List<Tree<String>> single = TreeBuilder.fromArrays(new int[]{1, 1}, new String[]{"b", "a"});
    assertThat(single).containsExactly(of("a"));
    assertThat(single.get(0).isLeaf()).isTrue();
    final List<Tree<String>> nested = TreeBuilder.fromArrays(new int[]{1, 0, 2}, new String[]{"c", "b", "a"});
    assertThat(nested).containsExactly(of("a", of("b")));
    assertThat(nested.get(0).size()).isEqualTo(2);
    assertThat(nested.get(0).childrenCount()).isEqualTo(1);
  }

  @Test
  void negativeCountsAreLeaves() {
    assertThat(TreeBuilder.fromArrays(new int[]{0, -1}, new String[]{"b", "a"}))
        .containsExactly(of("a"), of("b"));
    assertThat(TreeBuilder.fromArrays(new int[]{-5}, new String[]{"a"})).containsExactly(of("a"));
  }

  @Test
  void mismatchedLengthsAreRejected() {
    assertThatThrownBy(() -> TreeBuilder.fromArrays(new int[]{0, 1}, new String[]{"a"}))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("same length");
    assertThatThrownBy(() -> new TreeArrays<>(new int[]{0}, List.of()))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void listsDecodeLikeArrays() {
    assertThat(TreeBuilder.fromLists(new int[]{0, 0, 2}, List.of("c", "b", "a"))).containsExactly(tree3_2);
  }

  @Test
  void treeArraysAreValues() {
    final TreeArrays<String> arrays = tree4_2.toArrays();
    assertThat(arrays).isEqualTo(tree4_2.deflated().toArrays());
    assertThat(arrays.hashCode()).isEqualTo(tree4_2.deflated().toArrays().hashCode());
    arrays.structure()[0] = 9;
    assertArrayEquals(new int[]{0, 0, 1, 2}, arrays.structure());
    assertThat(arrays.toString()).isEqualTo("TreeArrays[structure=[0, 0, 1, 2], values=[d, c, b, a]]");
  }
}
