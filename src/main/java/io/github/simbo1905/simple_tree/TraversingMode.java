// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//

package io.github.simbo1905.simple_tree;

/// Order in which subtrees and values are visited
public enum TraversingMode {
  TOP_DOWN_DEPTH_FIRST,
  TOP_DOWN_BREADTH_FIRST;

  boolean isDepthFirst() {
    return this == TOP_DOWN_DEPTH_FIRST;
  }
}
