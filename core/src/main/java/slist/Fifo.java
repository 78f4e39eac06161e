//
// SList - a singly-linked sequence container for the JVM
// http://github.com/scaled/scaled/blob/master/LICENSE

package slist;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * A first-in first-out queue layered over a {@link Queueable} store. Elements are pushed at the
 * back of the store and popped from its front. By default the store is an {@link SList}, which
 * does both in constant time.
 */
public class Fifo<E> implements Countable<E> {

  /** Creates an empty queue backed by an {@link SList}. */
  public Fifo () {
    this(new SList<E>());
  }

  /** Creates a queue backed by {@code store}, whose existing elements are retained. */
  public Fifo (Queueable<E> store) {
    _store = store;
  }

  /** Adds {@code value} to the back of this queue. */
  public void push (E value) {
    _store.pushBack(value);
  }

  /** Removes and returns the element at the front of this queue.
    * @throws NoSuchElementException if this queue is empty. */
  public E pop () {
    return _store.popFront();
  }

  /** Returns the element at the front of this queue, which will be popped next. */
  public E front () {
    return _store.front();
  }

  /** Returns the most recently pushed element. */
  public E back () {
    return _store.back();
  }

  @Override public int size () {
    return _store.size();
  }

  @Override public boolean isEmpty () {
    return _store.isEmpty();
  }

  @Override public Iterator<E> iterator () {
    return _store.iterator();
  }

  @Override public String toString () {
    return "Fifo" + _store;
  }

  private final Queueable<E> _store;
}
