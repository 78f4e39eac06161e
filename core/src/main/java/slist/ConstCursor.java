//
// SList - a singly-linked sequence container for the JVM
// http://github.com/scaled/scaled/blob/master/LICENSE

package slist;

import java.util.NoSuchElementException;

/**
 * A forward-only, read-only cursor over the nodes of an {@link SList}. A cursor holds a plain
 * reference to its current node and owns nothing. The end sentinel is a cursor with no node; all
 * end cursors are equal to one another.
 *
 * <p>Cursors are not tracked by their list. Any mutation of the list (push, pop, insert, erase,
 * clear, assign, move) invalidates cursors positioned at or after the mutated region, and using
 * such a cursor afterwards has no defined result.</p>
 */
public class ConstCursor<E> {

  /** Returns true if this cursor is the end sentinel. */
  public boolean atEnd () {
    return node == null;
  }

  /**
   * Returns the element at this cursor.
   * @throws NoSuchElementException if this cursor is at the end.
   */
  public E get () {
    return current().data;
  }

  /**
   * Moves this cursor to the next node (pre-increment).
   * @return this cursor, for call chaining.
   * @throws NoSuchElementException if this cursor is at the end.
   */
  public ConstCursor<E> advance () {
    node = current().next;
    return this;
  }

  /**
   * Moves this cursor to the next node (post-increment).
   * @return a copy of this cursor positioned where it was before the move.
   * @throws NoSuchElementException if this cursor is at the end.
   */
  public ConstCursor<E> postAdvance () {
    ConstCursor<E> prev = copy();
    advance();
    return prev;
  }

  /** Returns an independent cursor at the same position as this one. */
  public ConstCursor<E> copy () {
    return new ConstCursor<E>(node);
  }

  /**
   * Returns the node at this cursor, for use as a splice position, or null if this cursor is at
   * the end.
   */
  public Node<E> position () {
    return node;
  }

  @Override public boolean equals (Object other) {
    return (other instanceof ConstCursor) && ((ConstCursor<?>)other).node == node;
  }

  @Override public int hashCode () {
    return System.identityHashCode(node);
  }

  @Override public String toString () {
    return (node == null) ? "Cursor(end)" : "Cursor(" + node.data + ")";
  }

  ConstCursor (Node<E> node) {
    this.node = node;
  }

  protected Node<E> current () {
    if (node == null) throw new NoSuchElementException("Cursor is at end.");
    return node;
  }

  protected Node<E> node;
}
