// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//

package io.github.simbo1905.simple_tree;

import java.util.Iterator;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Predicate;

/// Lazily maps the source elements and skips those the filter rejects
final class MapFilterIterator<A, B> extends LookaheadIterator<B> {

  private final Iterator<A> source;
  private final Function<A, B> mapper;
  private final Predicate<B> filter;

  MapFilterIterator(Iterator<A> source, Function<A, B> mapper, Predicate<B> filter) {
    this.source = Objects.requireNonNull(source);
    this.mapper = Objects.requireNonNull(mapper);
    this.filter = Objects.requireNonNull(filter);
  }

  @Override
  protected B seekNext() {
    while (source.hasNext()) {
      final B candidate = mapper.apply(source.next());
      if (filter.test(candidate)) {
        return candidate;
      }
    }
    return null;
  }
}
