//
// SList - a singly-linked sequence container for the JVM
// http://github.com/scaled/scaled/blob/master/LICENSE

package slist;

import java.util.NoSuchElementException;

/**
 * A countable collection which can be appended to at the back and consumed from the front. This
 * is all a {@link Fifo} needs of its backing store.
 */
public interface Queueable<E> extends Countable<E> {

  /** Appends {@code value} after the last element. */
  void pushBack (E value);

  /** Removes and returns the first element.
    * @throws NoSuchElementException if this collection is empty. */
  E popFront ();

  /** Returns the first element.
    * @throws NoSuchElementException if this collection is empty. */
  E front ();

  /** Returns the last element.
    * @throws NoSuchElementException if this collection is empty. */
  E back ();
}
