package org.replikativ.structured;

import clojure.lang.*;

/**
 * Last-in first-out operations over a linked list, the head being the top.
 * {@code top}, {@code pop} and {@code push} are all O(1).
 */
public class Stacks {

  public static Object top(IPersistentList stack) {
    return top(stack, null);
  }

  /**
   * Head of {@code stack}, or {@code dflt} when it is empty.
   */
  public static Object top(IPersistentList stack, Object dflt) {
    return checked(stack).count() == 0 ? dflt : stack.peek();
  }

  public static MapEntry pop(IPersistentList stack) {
    return pop(stack, null);
  }

  /**
   * Pair of the top (or {@code dflt} when empty) and the stack without it.
   */
  public static MapEntry pop(IPersistentList stack, Object dflt) {
    if (checked(stack).count() == 0) {
      return MapEntry.create(dflt, stack);
    }
    return MapEntry.create(stack.peek(), stack.pop());
  }

  public static IPersistentList push(IPersistentList stack, Object value) {
    return (IPersistentList) checked(stack).cons(value);
  }

  private static IPersistentList checked(IPersistentList stack) {
    if (stack == null) {
      throw new IllegalArgumentException("stack must not be null, use PersistentList.EMPTY");
    }
    return stack;
  }
}
