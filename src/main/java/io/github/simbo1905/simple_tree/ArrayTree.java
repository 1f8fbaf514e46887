// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//

package io.github.simbo1905.simple_tree;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/// Deflated tree: a window `[from, to)` over shared child-count and value arrays in reversed preorder.
/// The root is the last entry of the window. Children are views over sub-windows of the same arrays,
/// which are never written to after construction. Width and height are computed on first use.
final class ArrayTree<T> implements Tree<T> {

  private final int[] structure;
  private final Object[] values;
  private final int from;
  private final int to;
  private int width = -1;
  private int height = -1;

  ArrayTree(int[] structure, Object[] values, int from, int to) {
    assert to > from : "window must not be empty";
    this.structure = structure;
    this.values = values;
    this.from = from;
    this.to = to;
  }

  @Override
  @SuppressWarnings("unchecked")
  public T value() {
    return (T) values[to - 1];
  }

  @Override
  public List<Tree<T>> children() {
    final int[] roots = ArrayTreeFunctions.childrenIndexes(structure, to - 1);
    if (roots.length == 0) {
      return List.of();
    }
    final List<Tree<T>> result = new ArrayList<>(roots.length);
    for (int root : roots) {
      final int childSize = ArrayTreeFunctions.treeSize(structure, root, from);
      result.add(new ArrayTree<>(structure, values, root - childSize + 1, root + 1));
    }
    return Collections.unmodifiableList(result);
  }

  @Override
  public int childrenCount() {
    return structure[to - 1];
  }

  @Override
  public int size() {
    return to - from;
  }

  @Override
  public int width() {
    if (width < 0) {
      width = ArrayTreeFunctions.width(structure, from, to);
    }
    return width;
  }

  @Override
  public int height() {
    if (height < 0) {
      height = ArrayTreeFunctions.height(structure, from, to);
    }
    return height;
  }

  @Override
  public boolean isLeaf() {
    return structure[to - 1] == 0;
  }

  @Override
  public boolean isEmpty() {
    return false;
  }

  @Override
  public Tree<T> inflated() {
    return TreeCodec.inflate(structure, values, from, to);
  }

  @Override
  public Tree<T> deflated() {
    return this;
  }

  int[] structureWindow() {
    return Arrays.copyOfRange(structure, from, to);
  }

  Object[] valuesWindow() {
    return Arrays.copyOfRange(values, from, to);
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof Tree<?> other && TreeObjects.sameTrees(this, other);
  }

  @Override
  public int hashCode() {
    return TreeObjects.hash(this);
  }

  @Override
  public String toString() {
    return TreeObjects.describe(this);
  }
}
