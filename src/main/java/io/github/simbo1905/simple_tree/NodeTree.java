// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//

package io.github.simbo1905.simple_tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/// Inflated tree: a value with links to its children. Size, width and height are computed once.
final class NodeTree<T> implements Tree<T> {

  private final T value;
  private final List<Tree<T>> children;
  private final int size;
  private final int width;
  private final int height;

  NodeTree(T value, List<Tree<T>> children) {
    this.value = Objects.requireNonNull(value, "value must not be null");
    Objects.requireNonNull(children, "children must not be null");
    final List<Tree<T>> kept = new ArrayList<>(children.size());
    int size = 1;
    int width = 0;
    int height = 0;
    for (Tree<T> child : children) {
      Objects.requireNonNull(child, "child must not be null");
      if (child.isEmpty()) {
        continue;
      }
      kept.add(child);
      size += child.size();
      width += child.width();
      height = Math.max(height, child.height());
    }
    this.children = Collections.unmodifiableList(kept);
    this.size = size;
    this.width = Math.max(1, width);
    this.height = height + 1;
  }

  @Override
  public T value() {
    return value;
  }

  @Override
  public List<Tree<T>> children() {
    return children;
  }

  @Override
  public int childrenCount() {
    return children.size();
  }

  @Override
  public int size() {
    return size;
  }

  @Override
  public int width() {
    return width;
  }

  @Override
  public int height() {
    return height;
  }

  @Override
  public boolean isLeaf() {
    return children.isEmpty();
  }

  @Override
  public boolean isEmpty() {
    return false;
  }

  @Override
  public Tree<T> inflated() {
    return this;
  }

  @Override
  public Tree<T> deflated() {
    return TreeCodec.deflate(this);
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
