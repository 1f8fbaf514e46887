// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//

package io.github.simbo1905.simple_tree;

import java.util.Objects;

/// One entry of the linear encoding: a value and how many of the entries already read are its children.
/// With a [Tree] as the value it is an entry of the tree-pairs encoding used by [TreeBuilder].
public record TreePair<T>(int childCount, T value) {
  public TreePair {
    Objects.requireNonNull(value, "value must not be null");
  }
}
