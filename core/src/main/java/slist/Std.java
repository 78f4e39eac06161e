//
// SList - a singly-linked sequence container for the JVM
// http://github.com/scaled/scaled/blob/master/LICENSE

package slist;

import java.util.Iterator;
import java.util.Objects;

/**
 * Provides utility functions and static methods that operate on {@code slist} data structures.
 */
public class Std {

  /** Returns an {@link SList} containing {@code elems}, in order. */
  @SafeVarargs @SuppressWarnings("varargs") public static <A> SList<A> list (A... elems) {
    return new SList<A>().assign(elems);
  }

  /** Returns an {@link SList} containing the elements of {@code source}, in order. */
  public static <A> SList<A> list (Iterable<? extends A> source) {
    return new SList<A>(source);
  }

  /** Returns an {@link SList} containing the remaining elements of {@code iter}, in order. */
  public static <A> SList<A> list (Iterator<? extends A> iter) {
    return new SList<A>(iter);
  }

  /**
   * Returns true if {@code a1s} and {@code a2s} are the same size and their elements are pairwise
   * equal, per {@link Objects#equals}.
   */
  public static boolean equals (Countable<?> a1s, Countable<?> a2s) {
    if (a1s.size() != a2s.size()) return false;
    Iterator<?> iter1 = a1s.iterator(), iter2 = a2s.iterator();
    while (iter1.hasNext()) if (!Objects.equals(iter1.next(), iter2.next())) return false;
    return true;
  }

  /**
   * Returns a hash code computed from the elements of {@code elems}. This hash code will be
   * equivalent to {@link java.util.List#hashCode} for a list containing the same elements.
   */
  public static int hashCode (Iterable<?> elems) {
    int result = 1;
    for (Object elem : elems) result = 31 * result + (elem == null ? 0 : elem.hashCode());
    return result;
  }
}
