// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//

package io.github.simbo1905.simple_tree;

import java.util.Iterator;
import java.util.NoSuchElementException;

/// Iterator that finds its next element ahead of time. Subclasses return null once exhausted.
abstract class LookaheadIterator<E> implements Iterator<E> {

  private E next;
  private boolean seeked;

  protected abstract E seekNext();

  @Override
  public final boolean hasNext() {
    if (!seeked) {
      next = seekNext();
      seeked = true;
    }
    return next != null;
  }

  @Override
  public final E next() {
    if (!hasNext()) {
      throw new NoSuchElementException();
    }
    final E result = next;
    next = null;
    seeked = false;
    return result;
  }
}
