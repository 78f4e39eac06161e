//
// SList - a singly-linked sequence container for the JVM
// http://github.com/scaled/scaled/blob/master/LICENSE

package slist;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedList;

/**
 * Conversions between {@link SList}s (or any {@link Countable}) and the other ordered containers:
 * dynamic arrays ({@link ArrayList}), fixed-size arrays and doubly-linked lists ({@link
 * LinkedList}). Each conversion walks its source once, in order.
 *
 * <p>The three fixed-size array conversions differ only in how they treat a size mismatch. The
 * target array's length is the fixed size {@code N}, and all three reject {@code N < 1}:</p>
 * <ul>
 * <li>{@code toArrayPad} fails when the source is longer than {@code N}, pads when shorter.</li>
 * <li>{@code toArrayCut} fails when the source is shorter than {@code N}, truncates when
 * longer.</li>
 * <li>{@code toArrayAuto} pads or truncates as needed and never fails on size.</li>
 * </ul>
 */
public class SLists {

  /** Returns a new {@link ArrayList} containing the elements of {@code as}, in order. */
  public static <A> ArrayList<A> toArrayList (Countable<? extends A> as) {
    ArrayList<A> list = new ArrayList<>(as.size());
    for (A a : as) list.add(a);
    return list;
  }

  /** Returns a new {@link LinkedList} containing the elements of {@code as}, in order. */
  public static <A> LinkedList<A> toLinkedList (Iterable<? extends A> as) {
    LinkedList<A> list = new LinkedList<>();
    for (A a : as) list.add(a);
    return list;
  }

  /**
   * Copies {@code as} into {@code array} and fills the remaining slots with {@code zero}.
   * @return {@code array}.
   * @throws IllegalArgumentException if {@code array} is empty.
   * @throws CapacityException.Overflow if {@code as} has more elements than {@code array}.
   */
  public static <A> A[] toArrayPad (Countable<? extends A> as, A[] array, A zero) {
    int capacity = checkCapacity(array);
    if (as.size() > capacity) throw new CapacityException.Overflow(as.size(), capacity);
    return fill(as, array, zero);
  }

  /**
   * Copies the first {@code array.length} elements of {@code as} into {@code array}.
   * @return {@code array}.
   * @throws IllegalArgumentException if {@code array} is empty.
   * @throws CapacityException.Underflow if {@code as} has fewer elements than {@code array}.
   */
  public static <A> A[] toArrayCut (Countable<? extends A> as, A[] array) {
    int capacity = checkCapacity(array);
    if (as.size() < capacity) throw new CapacityException.Underflow(as.size(), capacity);
    Iterables.copyInto(as, capacity, array);
    return array;
  }

  /**
   * Copies as many elements of {@code as} as fit into {@code array} and fills any remaining slots
   * with {@code zero}.
   * @return {@code array}.
   * @throws IllegalArgumentException if {@code array} is empty.
   */
  public static <A> A[] toArrayAuto (Countable<? extends A> as, A[] array, A zero) {
    checkCapacity(array);
    return fill(as, array, zero);
  }

  private static <A> A[] fill (Iterable<? extends A> as, A[] array, A zero) {
    int copied = Iterables.copyInto(as, array.length, array);
    Arrays.fill(array, copied, array.length, zero);
    return array;
  }

  private static int checkCapacity (Object[] array) {
    if (array.length < 1) throw new IllegalArgumentException(
      "Array size must be a positive integer.");
    return array.length;
  }
}
