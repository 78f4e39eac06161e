//
// SList - a singly-linked sequence container for the JVM
// http://github.com/scaled/scaled/blob/master/LICENSE

package slist;

/**
 * A single link in an {@link SList} chain. Outside this package a node is an opaque position
 * token: it is obtained from a cursor and handed back to {@link SList#insertBefore} or {@link
 * SList#eraseBefore}, which validate it against their own chain.
 */
public final class Node<E> {

  E data;
  Node<E> next;

  Node (E data) {
    this.data = data;
  }

  /** Clears this node's links once it has been removed from its chain. */
  void unlink () {
    data = null;
    next = null;
  }

  @Override public String toString () {
    return "Node(" + data + ")";
  }
}
