package strata.graph.collect;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.StringJoiner;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * A FIFO doubly linked list whose entries live in an arena of slots linked by index rather than by reference.
 * {@link #enqueue} returns a slot handle which may later be passed to {@link #unlink} to remove that entry in
 * constant time. Freed slots are recycled.
 */
public class SlotList<T> {
  private static final int NONE = -1;

  private final List<T> values = new ArrayList<>();
  private int[] prev = new int[8];
  private int[] next = new int[8];
  private boolean[] linked = new boolean[8];
  private int head = NONE;
  private int tail = NONE;
  private int freeHead = NONE;
  private int size = 0;

  /**
   * Appends {@code value} at the tail.
   *
   * @return the slot now holding {@code value}
   */
  public int enqueue(T value) {
    int slot = allocate(value);
    prev[slot] = tail;
    next[slot] = NONE;
    if (tail == NONE) {
      head = slot;
    } else {
      next[tail] = slot;
    }
    tail = slot;
    linked[slot] = true;
    size++;
    return slot;
  }

  /**
   * Removes and returns the value at the head, or {@code null} if the list is empty.
   */
  @Nullable
  public T dequeue() {
    if (head == NONE) return null;
    int slot = head;
    T value = values.get(slot);
    unlink(slot);
    return value;
  }

  /**
   * Removes the entry held by {@code slot}. Unlinking a slot that is no longer linked has no effect.
   */
  public void unlink(int slot) {
    checkArgument(slot >= 0 && slot < values.size(), "Invalid slot: %s", slot);
    if (!linked[slot]) return;

    if (prev[slot] == NONE) {
      head = next[slot];
    } else {
      next[prev[slot]] = next[slot];
    }
    if (next[slot] == NONE) {
      tail = prev[slot];
    } else {
      prev[next[slot]] = prev[slot];
    }

    linked[slot] = false;
    values.set(slot, null);
    prev[slot] = NONE;
    next[slot] = freeHead;
    freeHead = slot;
    size--;
  }

  public boolean isEmpty() {
    return head == NONE;
  }

  public int size() {
    return size;
  }

  private int allocate(T value) {
    if (freeHead != NONE) {
      int slot = freeHead;
      freeHead = next[slot];
      values.set(slot, value);
      return slot;
    }
    int slot = values.size();
    values.add(value);
    if (slot == prev.length) {
      int capacity = slot * 2;
      prev = Arrays.copyOf(prev, capacity);
      next = Arrays.copyOf(next, capacity);
      linked = Arrays.copyOf(linked, capacity);
    }
    return slot;
  }

  @Override
  public String toString() {
    StringJoiner joiner = new StringJoiner(", ", "[", "]");
    for (int slot = head; slot != NONE; slot = next[slot]) {
      joiner.add(String.valueOf(values.get(slot)));
    }
    return joiner.toString();
  }
}
