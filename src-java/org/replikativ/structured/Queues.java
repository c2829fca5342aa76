package org.replikativ.structured;

import clojure.lang.*;

/**
 * First-in first-out operations over a linked list. The head is the next
 * element out, so {@code peek} and {@code dequeue} are O(1). {@code enqueue}
 * has to rebuild the whole list to append at its tail and is O(n).
 */
public class Queues {

  /**
   * Pair of the next element (null when empty) and the unchanged queue.
   */
  public static MapEntry peek(IPersistentList queue) {
    return MapEntry.create(checked(queue).count() == 0 ? null : queue.peek(), queue);
  }

  /**
   * Pair of the next element (null when empty) and the queue without it.
   */
  public static MapEntry dequeue(IPersistentList queue) {
    if (checked(queue).count() == 0) {
      return MapEntry.create(null, queue);
    }
    return MapEntry.create(queue.peek(), queue.pop());
  }

  public static IPersistentList enqueue(IPersistentList queue, Object value) {
    Object[] items = new Object[checked(queue).count() + 1];
    int len = 0;
    for (ISeq s = queue.seq(); s != null; s = s.next()) {
      items[len++] = s.first();
    }
    items[len] = value;

    IPersistentList out = PersistentList.EMPTY;
    for (int i = len; i >= 0; --i) {
      out = (IPersistentList) out.cons(items[i]);
    }
    return out;
  }

  private static IPersistentList checked(IPersistentList queue) {
    if (queue == null) {
      throw new IllegalArgumentException("queue must not be null, use PersistentList.EMPTY");
    }
    return queue;
  }
}
