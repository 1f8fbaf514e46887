// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//

package io.github.simbo1905.simple_tree;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.ToIntFunction;

import static io.github.simbo1905.simple_tree.Tree.LOGGER;

/// The one assembly loop behind every decoder and builder. Entries arrive in reversed preorder; each one
/// pops the items it needs from the stack, most recently pushed first, and pushes what it builds.
final class StackMachine {

  private StackMachine() {
  }

  /// @param entries the input, consumed once
  /// @param popCount how many items an entry takes off the stack, negative counts are taken as zero
  /// @param build makes the item to push from an entry and its popped items, or nothing to push nothing
  /// @param onUnderflow the item pushed, without popping, when an entry asks for more than the stack holds
  /// @return what is left on the stack, top first
  static <E, R> List<R> assemble(Iterator<E> entries,
                                 ToIntFunction<E> popCount,
                                 BiFunction<E, List<R>, Optional<R>> build,
                                 Function<E, R> onUnderflow) {
    final Deque<R> stack = new ArrayDeque<>();
    int position = 0;
    while (entries.hasNext()) {
      final E entry = entries.next();
      final int count = Math.max(0, popCount.applyAsInt(entry));
      if (count > stack.size()) {
        final int at = position;
        final int available = stack.size();
        LOGGER.fine(() -> "Entry " + at + " asks for " + count + " item(s) but the stack holds " + available
            + ", pushing a placeholder");
        stack.push(onUnderflow.apply(entry));
      } else {
        final List<R> popped = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
          popped.add(stack.pop());
        }
        build.apply(entry, popped).ifPresent(stack::push);
        final int at = position;
        LOGGER.finer(() -> "Entry " + at + " popped " + count + ", stack now holds " + stack.size());
      }
      position++;
    }
    return new ArrayList<>(stack);
  }
}
