// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//

package io.github.simbo1905.simple_tree;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/// The deflated encoding of a tree: child counts and values aligned by index, in reversed preorder,
/// so the root is the last entry. The structure array is copied on the way in and on the way out.
public record TreeArrays<T>(int[] structure, List<T> values) {

  public TreeArrays {
    Objects.requireNonNull(structure, "structure must not be null");
    Objects.requireNonNull(values, "values must not be null");
    if (structure.length != values.size()) {
      throw new IllegalArgumentException("structure and values must have the same length but were "
          + structure.length + " and " + values.size());
    }
    structure = structure.clone();
    values = List.copyOf(values);
  }

  @SuppressWarnings("unchecked")
  static <T> TreeArrays<T> wrap(int[] structure, Object[] values) {
    return new TreeArrays<>(structure, Collections.unmodifiableList(Arrays.asList((T[]) values)));
  }

  @Override
  public int[] structure() {
    return structure.clone();
  }

  public int length() {
    return structure.length;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof TreeArrays<?> other)) return false;
    return Arrays.equals(structure, other.structure) && values.equals(other.values);
  }

  @Override
  public int hashCode() {
    return 31 * Arrays.hashCode(structure) + values.hashCode();
  }

  @Override
  public String toString() {
    return "TreeArrays[structure=" + Arrays.toString(structure) + ", values=" + values + "]";
  }
}
