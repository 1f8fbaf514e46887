// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//

package io.github.simbo1905.simple_tree;

/// Where an inserted child goes relative to an existing sibling with the same value, and whether its
/// children are folded in before or after the existing children.
public enum MergeOrder {
  BEFORE,
  AFTER
}
