// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//

package io.github.simbo1905.simple_tree;

import java.util.Objects;

/// A subtree paired with its level, the root being at level 1
public record TreeLevel<T>(int level, Tree<T> tree) {
  public TreeLevel {
    Objects.requireNonNull(tree, "tree must not be null");
    if (level < 1) {
      throw new IllegalArgumentException("level must be at least 1 but was " + level);
    }
  }
}
