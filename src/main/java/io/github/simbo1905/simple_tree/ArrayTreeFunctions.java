// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//

package io.github.simbo1905.simple_tree;

/// Index arithmetic over a structure array holding child counts in reversed preorder.
/// A node at `index` has its first child at `index - 1` and each following child directly below
/// the subtree of the previous one.
final class ArrayTreeFunctions {

  private ArrayTreeFunctions() {
  }

  /// Counts the entries making up the subtree rooted at `index`.
  /// @return the subtree size or -1 if the entries run out above `lowerBound` before the subtree is complete
  static int treeSize(int[] structure, int index, int lowerBound) {
    int i = index;
    int remaining = structure[i];
    while (remaining > 0 && i > lowerBound) {
      i--;
      remaining = remaining - 1 + structure[i];
    }
    return remaining == 0 ? index - i + 1 : -1;
  }

  /// @return the indexes of the children of the node at `index`, first child first
  static int[] childrenIndexes(int[] structure, int index) {
    final int count = structure[index];
    final int[] result = new int[count];
    int i = index - 1;
    for (int k = 0; k < count; k++) {
      result[k] = i;
      i -= treeSize(structure, i, 0);
    }
    return result;
  }

  /// Leaves are the entries with no children
  static int width(int[] structure, int from, int to) {
    int leaves = 0;
    for (int i = from; i < to; i++) {
      if (structure[i] == 0) {
        leaves++;
      }
    }
    return leaves;
  }

  /// Walks from the root down keeping a counter of unvisited children for every open ancestor,
  /// the depth of a node being the number of open ancestors plus one.
  static int height(int[] structure, int from, int to) {
    final int[] counters = new int[to - from];
    int top = 0;
    int max = 0;
    for (int i = to - 1; i >= from; i--) {
      max = Math.max(max, top + 1);
      if (i != to - 1) {
        counters[top - 1]--;
      }
      final int count = structure[i];
      if (count > 0) {
        counters[top++] = count;
      } else {
        while (top > 0 && counters[top - 1] == 0) {
          top--;
        }
      }
    }
    return max;
  }
}
