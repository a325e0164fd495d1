package bsync;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Supplier;

import com.google.common.base.Preconditions;
import com.google.common.base.Verify;
import com.google.common.collect.Lists;
import com.google.errorprone.annotations.CanIgnoreReturnValue;

/**
 * Applies edits to the block tree and the AST while remembering how to undo each one. An operation
 * records every mutation here; if a later step fails, {@link #rollback()} reverts the recorded
 * edits newest first, leaving both trees as they were before the operation started.
 */
final class EditLog {

  /** A mutation that has already been applied and knows its exact inverse. */
  interface Edit {
    void revert();
  }

  private final List<Edit> applied = new ArrayList<>();

  /** Inserts {@code element} at {@code index}, which must already be in range. */
  <T> void insert(List<T> list, int index, T element) {
    Preconditions.checkPositionIndex(index, list.size());
    list.add(index, element);
    applied.add(() -> Verify.verify(list.remove(index) == element));
  }

  @CanIgnoreReturnValue
  <T> T remove(List<T> list, int index) {
    Preconditions.checkElementIndex(index, list.size());
    T removed = list.remove(index);
    applied.add(() -> list.add(index, removed));
    return removed;
  }

  /** Removes {@code element}, compared by identity. Returns false if it is not in the list. */
  @CanIgnoreReturnValue
  <T> boolean remove(List<T> list, T element) {
    for (int i = 0; i < list.size(); i++) {
      if (list.get(i) == element) {
        remove(list, i);
        return true;
      }
    }
    return false;
  }

  /** Replaces a property value, remembering the previous one. */
  <T> void set(Supplier<T> getter, Consumer<T> setter, T value) {
    T previous = getter.get();
    setter.accept(value);
    applied.add(() -> setter.accept(previous));
  }

  /** Number of edits recorded so far. */
  int size() {
    return applied.size();
  }

  /** Reverts every recorded edit, newest first, and forgets them. */
  void rollback() {
    for (Edit edit : Lists.reverse(applied)) {
      edit.revert();
    }
    applied.clear();
  }
}
