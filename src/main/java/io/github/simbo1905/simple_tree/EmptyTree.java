// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//

package io.github.simbo1905.simple_tree;

import java.util.List;
import java.util.NoSuchElementException;

/// The one and only empty tree. It has no node, so it is neither a leaf nor a parent.
final class EmptyTree implements Tree<Object> {

  static final EmptyTree INSTANCE = new EmptyTree();

  private EmptyTree() {
  }

  @Override
  public Object value() {
    throw new NoSuchElementException("the empty tree has no value");
  }

  @Override
  public List<Tree<Object>> children() {
    return List.of();
  }

  @Override
  public int childrenCount() {
    return 0;
  }

  @Override
  public int size() {
    return 0;
  }

  @Override
  public int width() {
    return 0;
  }

  @Override
  public int height() {
    return 0;
  }

  @Override
  public boolean isLeaf() {
    return false;
  }

  @Override
  public boolean isEmpty() {
    return true;
  }

  @Override
  public Tree<Object> inflated() {
    return this;
  }

  @Override
  public Tree<Object> deflated() {
    return this;
  }

  @Override
  public String toString() {
    return "Tree.empty";
  }
}
