//
// SList - a singly-linked sequence container for the JVM
// http://github.com/scaled/scaled/blob/master/LICENSE

package slist;

import java.util.Iterator;

public class Iterables {

  /** An iterator which does not support {@link Iterator#remove}. */
  public static abstract class ImmIterator<E> implements Iterator<E> {
    @Override public void remove () {
      throw new UnsupportedOperationException("remove() not supported");
    }
  }

  /**
   * Copies at most {@code count} leading elements of {@code as} into {@code target}, starting at
   * index zero. Stops early if {@code as} runs out of elements.
   * @return the number of elements copied.
   */
  public static int copyInto (Iterable<?> as, int count, Object[] target) {
    Iterator<?> iter = as.iterator();
    int ii = 0;
    for (; ii < count && iter.hasNext(); ii++) target[ii] = iter.next();
    return ii;
  }
}
