package org.replikativ.structured;

import clojure.lang.*;
import java.util.*;

/**
 * Quicksort and mergesort over any {@link Iterable}, ordered by a
 * {@link Comparator} that defaults to {@link RT#DEFAULT_COMPARATOR}.
 */
@SuppressWarnings("unchecked")
public class Sort {

  /**
   * Quicksort with the head as pivot. The rest is split three ways (less,
   * equal, greater) so runs of duplicates do not degrade to quadratic time;
   * the equal run is placed right after the pivot.
   */
  public static IPersistentVector quicksort(Iterable coll) {
    return quicksort(coll, RT.DEFAULT_COMPARATOR);
  }

  public static <T> IPersistentVector quicksort(Iterable<T> coll, Comparator<? super T> cmp) {
    List<T> out = new ArrayList<>();
    quicksort(toList(coll), cmp, out);
    return PersistentVector.create(out);
  }

  // Explicit work stack, call depth stays constant for sorted input.
  // A run is either still to be partitioned or final (pivot and its equals).
  private static <T> void quicksort(List<T> list, Comparator<? super T> cmp, List<T> out) {
    ArrayDeque<Run<T>> stack = new ArrayDeque<>();
    stack.push(new Run<>(list, false));
    while (!stack.isEmpty()) {
      Run<T> run = stack.pop();
      if (run._final || run._items.size() <= 1) {
        out.addAll(run._items);
        continue;
      }

      T pivot = run._items.get(0);
      List<T> lesser = new ArrayList<>(),
              equivalent = new ArrayList<>(),
              greater = new ArrayList<>();
      equivalent.add(pivot);
      for (T el: run._items.subList(1, run._items.size())) {
        int d = cmp.compare(el, pivot);
        if (d < 0)
          lesser.add(el);
        else if (d > 0)
          greater.add(el);
        else
          equivalent.add(el);
      }

      // popped in reverse: lesser, then pivot and equal, then greater
      stack.push(new Run<>(greater, false));
      stack.push(new Run<>(equivalent, true));
      stack.push(new Run<>(lesser, false));
    }
  }

  static class Run<T> {
    final List<T> _items;
    final boolean _final;

    Run(List<T> items, boolean isFinal) {
      _items = items;
      _final = isFinal;
    }
  }

  /**
   * Mergesort over linked lists. Splits at round(n/2), so for odd n the first
   * half is the longer one, then merges the two sorted halves walking them
   * from their largest ends and consing into the result.
   */
  public static IPersistentList mergesort(Iterable coll) {
    return mergesort(coll, RT.DEFAULT_COMPARATOR);
  }

  public static <T> IPersistentList mergesort(Iterable<T> coll, Comparator<? super T> cmp) {
    return mergesort(toList(coll), cmp);
  }

  private static <T> IPersistentList mergesort(List<T> list, Comparator<? super T> cmp) {
    int n = list.size();
    if (n <= 1) {
      return PersistentList.create(list);
    }
    int half = (n + 1) >>> 1;
    ISeq first  = reverse(mergesort(list.subList(0, half), cmp)),
         second = reverse(mergesort(list.subList(half, n), cmp));
    return merge(first, second, cmp);
  }

  // Both inputs are descending. Whichever head is larger goes onto acc first,
  // which leaves acc ascending. Equal heads are both taken.
  private static <T> IPersistentList merge(ISeq l1, ISeq l2, Comparator<? super T> cmp) {
    IPersistentList acc = PersistentList.EMPTY;
    while (l1 != null && l2 != null) {
      T h1 = (T) l1.first(),
        h2 = (T) l2.first();
      int d = cmp.compare(h1, h2);
      if (d == 0) {
        acc = cons(h1, cons(h2, acc));
        l1 = l1.next();
        l2 = l2.next();
      } else if (d > 0) {
        acc = cons(h1, acc);
        l1 = l1.next();
      } else {
        acc = cons(h2, acc);
        l2 = l2.next();
      }
    }
    for (ISeq rest = l1 != null ? l1 : l2; rest != null; rest = rest.next()) {
      acc = cons(rest.first(), acc);
    }
    return acc;
  }

  private static ISeq reverse(IPersistentList list) {
    IPersistentList out = PersistentList.EMPTY;
    for (ISeq s = list.seq(); s != null; s = s.next()) {
      out = cons(s.first(), out);
    }
    return out.seq();
  }

  private static IPersistentList cons(Object x, IPersistentList list) {
    return (IPersistentList) list.cons(x);
  }

  private static <T> List<T> toList(Iterable<T> coll) {
    if (coll == null) {
      throw new IllegalArgumentException("coll must not be null");
    }
    List<T> out = new ArrayList<>();
    for (T el: coll) {
      out.add(el);
    }
    return out;
  }
}
