// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//

package io.github.simbo1905.simple_tree;

import java.util.ArrayList;
import java.util.List;

/// How [TreeBuilder] combines a tree payload with the subtrees popped for it
public enum MergeStrategy {

  /// The popped subtrees go in front of the payload's own children. An empty payload pops nothing,
  /// so the subtrees that would have been its children stay on the stack for the next parent.
  APPEND {
    @Override
    public <T> Tree<T> merge(Tree<T> payload, List<Tree<T>> subtrees) {
      if (subtrees.isEmpty()) {
        return payload;
      }
      final List<Tree<T>> children = new ArrayList<>(subtrees.size() + payload.childrenCount());
      children.addAll(subtrees);
      children.addAll(payload.children());
      return Tree.of(payload.value(), children);
    }

    @Override
    public boolean keepOrphanedSubtrees() {
      return true;
    }
  },

  /// The payload is kept as it is and the popped subtrees are discarded, an empty payload included
  REPLACE {
    @Override
    public <T> Tree<T> merge(Tree<T> payload, List<Tree<T>> subtrees) {
      if (!subtrees.isEmpty()) {
        Tree.LOGGER.finer(() -> "Replacing " + subtrees.size() + " subtree(s) under " + payload.value());
      }
      return payload;
    }

    @Override
    public boolean keepOrphanedSubtrees() {
      return false;
    }
  };

  public abstract <T> Tree<T> merge(Tree<T> payload, List<Tree<T>> subtrees);

  /// @return true if an empty payload leaves the subtrees it would have taken on the stack
  public abstract boolean keepOrphanedSubtrees();
}
