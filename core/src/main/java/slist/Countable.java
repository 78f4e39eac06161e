//
// SList - a singly-linked sequence container for the JVM
// http://github.com/scaled/scaled/blob/master/LICENSE

package slist;

/**
 * Represents a collection with a countable number of elements.
 */
public interface Countable<E> extends Iterable<E> {

  /** Returns the number of elements in this countable collection. */
  int size ();

  /** Returns true if this collection contains no elements. */
  default boolean isEmpty () { return size() == 0; }
}
