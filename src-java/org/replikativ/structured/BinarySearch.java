package org.replikativ.structured;

import clojure.lang.*;
import java.util.*;
import java.util.function.*;
import java.util.logging.Logger;

/**
 * Index lookup in a fixed-size, ascending-sorted, random-access sequence.
 *
 * The probe walk is not midpoint bisection. It starts at {@code floor(n/2)};
 * when the probed element is too large the next probe is
 * {@code floor(probe/2)}, which collapses towards index 0 instead of halving
 * the remaining range; when it is too small the next probe is
 * {@code ceil((probe + n)/2)}. The walk ends with the index on the first
 * match, and with -1 once it has probed index 0 or index n-1 without a match.
 * Present elements the walk steps over are therefore reported as -1, e.g.
 * 5 in (1 2 3 4 5 6) or 1 in (1 2).
 *
 * The walk can also cycle between inner indices without ever reaching an end
 * (n = 8: 4, 2, 5, 2, ...). When a probe would repeat, the range [low, high]
 * left open by the probes so far is bisected instead, so every search
 * terminates. Not O(log n) for adversarial inputs.
 */
@SuppressWarnings("unchecked")
public class BinarySearch {

  private static final Logger LOGGER = Logger.getLogger(BinarySearch.class.getName());

  public static int search(Object[] tuple, Object el) {
    return search(tuple, el, RT.DEFAULT_COMPARATOR);
  }

  public static int search(Object[] tuple, Object el, Comparator cmp) {
    checked(tuple);
    return search(tuple.length, i -> tuple[i], el, cmp, null);
  }

  public static int search(Indexed tuple, Object el) {
    return search(tuple, el, RT.DEFAULT_COMPARATOR);
  }

  public static int search(Indexed tuple, Object el, Comparator cmp) {
    return search(checked(tuple).count(), tuple::nth, el, cmp, null);
  }

  /**
   * Indices examined, in order, by {@code search(tuple, el)}.
   */
  public static IPersistentVector probes(Indexed tuple, Object el) {
    return probes(tuple, el, RT.DEFAULT_COMPARATOR);
  }

  public static IPersistentVector probes(Indexed tuple, Object el, Comparator cmp) {
    List<Integer> trace = new ArrayList<>();
    search(checked(tuple).count(), tuple::nth, el, cmp, trace);
    return PersistentVector.create(trace);
  }

  static int search(int len, IntFunction<Object> at, Object el, Comparator cmp, List<Integer> trace) {
    if (len == 0) {
      return -1;
    }

    BitSet seen = new BitSet(len);
    // el, if present, is within [low ... high]
    int low = 0, high = len - 1;
    int idx = len >>> 1;
    while (true) {
      if (trace != null) trace.add(idx);
      int d = cmp.compare(at.apply(idx), el);
      if (d == 0) return idx;
      if (idx == 0 || idx == len - 1) return -1;

      if (d > 0) high = Math.min(high, idx - 1);
      else       low  = Math.max(low, idx + 1);

      seen.set(idx);
      int next = d > 0 ? idx >>> 1 : (idx + len + 1) >>> 1;
      if (seen.get(next)) break;
      idx = next;
    }

    final int stop = idx, lo = low, hi = high;
    LOGGER.fine(() -> "Probe walk cycles at " + stop + " of " + len + ", bisecting [" + lo + ", " + hi + "]");
    return bisect(at, el, cmp, low, high, trace);
  }

  private static int bisect(IntFunction<Object> at, Object el, Comparator cmp, int low, int high, List<Integer> trace) {
    while (low <= high) {
      int mid = (low + high) >>> 1;
      if (trace != null) trace.add(mid);
      int d = cmp.compare(at.apply(mid), el);
      if (d == 0)
        return mid;
      else if (d < 0)
        low = mid + 1;
      else
        high = mid - 1;
    }
    return -1;
  }

  private static <T> T checked(T tuple) {
    if (tuple == null) {
      throw new IllegalArgumentException("tuple must not be null");
    }
    return tuple;
  }
}
