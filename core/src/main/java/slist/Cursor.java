//
// SList - a singly-linked sequence container for the JVM
// http://github.com/scaled/scaled/blob/master/LICENSE

package slist;

import java.util.NoSuchElementException;

/**
 * A forward-only cursor over the nodes of an {@link SList} which can also replace the element at
 * its position. The invalidation rules of {@link ConstCursor} apply.
 */
public class Cursor<E> extends ConstCursor<E> {

  /**
   * Replaces the element at this cursor with {@code value}.
   * @return the element previously at this cursor.
   * @throws NoSuchElementException if this cursor is at the end.
   */
  public E set (E value) {
    Node<E> node = current();
    E prev = node.data;
    node.data = value;
    return prev;
  }

  @Override public Cursor<E> advance () {
    super.advance();
    return this;
  }

  @Override public Cursor<E> postAdvance () {
    Cursor<E> prev = copy();
    advance();
    return prev;
  }

  @Override public Cursor<E> copy () {
    return new Cursor<E>(node);
  }

  Cursor (Node<E> node) {
    super(node);
  }
}
