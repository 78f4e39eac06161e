//
// SList - a singly-linked sequence container for the JVM
// http://github.com/scaled/scaled/blob/master/LICENSE

package slist;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedList;
import java.util.NoSuchElementException;

/**
 * A mutable singly-linked list. The list refers to its first node, each node to its successor,
 * and the list keeps a second, non-owning reference to its last node so that both ends can be
 * appended to in constant time. Removing from the front is constant time; removing from the back
 * walks the chain, as there are no back links.
 *
 * <p>Splicing is anchored on node positions obtained from a cursor ({@link Cursor#position}).
 * A position is validated against this list's chain before use, and a {@code null} position
 * denotes the end of the chain.</p>
 *
 * <p>This class is not thread safe, and cursors are not guarded against concurrent
 * modification: see {@link ConstCursor}.</p>
 */
public final class SList<E> implements Queueable<E> {

  /** Creates an empty list. */
  public SList () {}

  /** Creates a list containing the elements of {@code source}, in order. When {@code source} is
    * another {@code SList} this is a deep copy: the new list shares no nodes with it. */
  public SList (Iterable<? extends E> source) {
    for (E elem : source) pushBack(elem);
  }

  /** Creates a list containing the remaining elements of {@code iter}, in order. */
  public SList (Iterator<? extends E> iter) {
    while (iter.hasNext()) pushBack(iter.next());
  }

  /** Appends {@code value} after the last element. */
  @Override public void pushBack (E value) {
    Node<E> node = new Node<E>(value);
    if (tail == null) head = node;
    else tail.next = node;
    tail = node;
    size += 1;
  }

  /** Inserts {@code value} before the first element. */
  public void pushFront (E value) {
    Node<E> node = new Node<E>(value);
    node.next = head;
    head = node;
    if (tail == null) tail = node;
    size += 1;
  }

  /**
   * Removes and returns the first element.
   * @throws NoSuchElementException if this list is empty.
   */
  @Override public E popFront () {
    Node<E> first = head;
    if (first == null) throw new NoSuchElementException("List is empty: cannot pop front.");
    head = first.next;
    if (head == null) tail = null;
    size -= 1;
    return release(first);
  }

  /**
   * Removes and returns the last element. This walks the chain to find the new last node.
   * @throws NoSuchElementException if this list is empty.
   */
  public E popBack () {
    Node<E> last = tail;
    if (last == null) throw new NoSuchElementException("List is empty: cannot pop back.");
    if (head == last) {
      head = null;
      tail = null;
    } else {
      Node<E> prev = head;
      while (prev.next != last) prev = prev.next;
      prev.next = null;
      tail = prev;
    }
    size -= 1;
    return release(last);
  }

  /**
   * Inserts {@code value} immediately before the node at {@code position}. Inserting before the
   * first node is equivalent to {@link #pushFront}, inserting before the end ({@code null}) is
   * equivalent to {@link #pushBack}.
   * @throws PositionNotFoundException if {@code position} is not a node of this list. The list is
   * not modified in that case.
   */
  public void insertBefore (Node<E> position, E value) {
    if (position == head) pushFront(value);
    else if (position == null) pushBack(value);
    else {
      Node<E> prev = predecessor(position);
      Node<E> node = new Node<E>(value);
      node.next = position;
      prev.next = node;
      size += 1;
    }
  }

  /** Inserts {@code value} immediately before the node at {@code pos}.
    * @see #insertBefore(Node,Object) */
  public void insertBefore (ConstCursor<E> pos, E value) {
    insertBefore(pos.position(), value);
  }

  /**
   * Removes the node immediately preceding {@code position} and returns its element. A {@code
   * null} position denotes the end, in which case the last node is removed.
   * @throws IllegalStateException if this list is empty or {@code position} is the first node,
   * as nothing precedes it.
   * @throws PositionNotFoundException if {@code position} is not a node of this list.
   */
  public E eraseBefore (Node<E> position) {
    if (head == null) throw new IllegalStateException("List is empty: nothing to erase.");
    if (position == head) throw new IllegalStateException(
      "Cannot erase before the first element.");

    // find the victim (whose next is position) and the node before it, if any
    Node<E> prev = null, victim = head;
    while (victim.next != position) {
      prev = victim;
      victim = victim.next;
      if (victim == null) throw new PositionNotFoundException(position);
    }

    if (prev == null) head = victim.next;
    else prev.next = victim.next;
    if (victim == tail) tail = prev;
    size -= 1;
    return release(victim);
  }

  /** Removes the node immediately preceding {@code pos} and returns its element.
    * @see #eraseBefore(Node) */
  public E eraseBefore (ConstCursor<E> pos) {
    return eraseBefore(pos.position());
  }

  /** Removes all elements from this list. Outstanding cursors are invalidated. */
  public void clear () {
    head = null;
    tail = null;
    size = 0;
  }

  /**
   * Replaces the contents of this list with the elements of {@code source}, in order. The source
   * is read in full before this list's chain is replaced, so it may be (or may iterate over) this
   * list itself, in which case the contents are unchanged.
   * @return this list, for call chaining.
   */
  public SList<E> assign (Iterable<? extends E> source) {
    if (source == this) return this;
    return moveFrom(new SList<E>(source));
  }

  /**
   * Replaces the contents of this list with {@code values}, in order.
   * @return this list, for call chaining.
   */
  @SafeVarargs public final SList<E> assign (E... values) {
    clear();
    for (E value : values) pushBack(value);
    return this;
  }

  /**
   * Takes over the chain of {@code other}, discarding this list's previous contents. {@code
   * other} is left empty, and cursors obtained from it must no longer be used.
   * @return this list, for call chaining.
   */
  public SList<E> moveFrom (SList<E> other) {
    if (other == this) return this;
    head = other.head;
    tail = other.tail;
    size = other.size;
    other.clear();
    return this;
  }

  /** Exchanges the contents of this list and {@code other}. */
  public void swap (SList<E> other) {
    Node<E> ohead = other.head, otail = other.tail;
    int osize = other.size;
    other.head = head;
    other.tail = tail;
    other.size = size;
    head = ohead;
    tail = otail;
    size = osize;
  }

  /**
   * Returns the first element.
   * @throws NoSuchElementException if this list is empty.
   */
  @Override public E front () {
    if (head == null) throw new NoSuchElementException("List is empty: cannot access front.");
    return head.data;
  }

  /**
   * Returns the last element.
   * @throws NoSuchElementException if this list is empty.
   */
  @Override public E back () {
    if (tail == null) throw new NoSuchElementException("List is empty: cannot access back.");
    return tail.data;
  }

  /**
   * Returns the element at {@code index}, found by walking the chain.
   * @throws IndexOutOfBoundsException if {@code index} is not in {@code [0,size)}.
   */
  public E get (int index) {
    if (index < 0 || index >= size) throw new IndexOutOfBoundsException(
      index + " not in [0," + size + ")");
    Node<E> node = head;
    for (int ii = 0; ii < index; ii++) node = node.next;
    return node.data;
  }

  @Override public int size () {
    return size;
  }

  /** Returns a cursor at the first element, or the end cursor if this list is empty. */
  public Cursor<E> begin () { return new Cursor<E>(head); }

  /** Returns the end cursor: one past the last element. */
  public Cursor<E> end () { return new Cursor<E>(null); }

  /** Returns a read-only cursor at the first element. */
  public ConstCursor<E> cbegin () { return new ConstCursor<E>(head); }

  /** Returns the read-only end cursor. */
  public ConstCursor<E> cend () { return new ConstCursor<E>(null); }

  @Override public Iterator<E> iterator () {
    return new Iterables.ImmIterator<E>() {
      private Node<E> cur = head;
      @Override public boolean hasNext () {
        return cur != null;
      }
      @Override public E next () {
        Node<E> cur = this.cur;
        if (cur == null) throw new NoSuchElementException();
        this.cur = cur.next;
        return cur.data;
      }
    };
  }

  /** Returns a new {@link ArrayList} containing the elements of this list. */
  public ArrayList<E> toArrayList () {
    return SLists.toArrayList(this);
  }

  /** Returns a new {@link LinkedList} containing the elements of this list. */
  public LinkedList<E> toLinkedList () {
    return SLists.toLinkedList(this);
  }

  /** Returns a new array containing exactly the elements of this list. */
  public Object[] toArray () {
    Object[] array = new Object[size];
    Iterables.copyInto(this, size, array);
    return array;
  }

  /** Copies this list into {@code array}, padding with nulls.
    * @see SLists#toArrayPad */
  public E[] toArrayPad (E[] array) {
    return SLists.toArrayPad(this, array, null);
  }

  /** Copies this list into {@code array}, padding with {@code zero}.
    * @see SLists#toArrayPad */
  public E[] toArrayPad (E[] array, E zero) {
    return SLists.toArrayPad(this, array, zero);
  }

  /** Copies the leading elements of this list into {@code array}.
    * @see SLists#toArrayCut */
  public E[] toArrayCut (E[] array) {
    return SLists.toArrayCut(this, array);
  }

  /** Copies this list into {@code array}, truncating or padding with nulls.
    * @see SLists#toArrayAuto */
  public E[] toArrayAuto (E[] array) {
    return SLists.toArrayAuto(this, array, null);
  }

  /** Copies this list into {@code array}, truncating or padding with {@code zero}.
    * @see SLists#toArrayAuto */
  public E[] toArrayAuto (E[] array, E zero) {
    return SLists.toArrayAuto(this, array, zero);
  }

  @Override public boolean equals (Object other) {
    return (other == this) || (other instanceof SList && Std.equals(this, (SList<?>)other));
  }

  @Override public int hashCode () {
    return Std.hashCode(this);
  }

  @Override public String toString () {
    StringBuilder sb = new StringBuilder("[");
    for (Node<E> node = head; node != null; node = node.next) {
      if (node != head) sb.append(", ");
      sb.append(node.data);
    }
    return sb.append("]").toString();
  }

  /**
   * Walks the whole chain and verifies that {@code size} matches its length and that {@code tail}
   * is its last node.
   * @throws IllegalStateException describing the first violation found.
   */
  void checkInvariants () {
    if (!endsAgree()) throw new IllegalStateException(
      "Head and tail disagree [head=" + head + ", tail=" + tail + "]");
    int count = 0;
    Node<E> last = null;
    for (Node<E> node = head; node != null; node = node.next) {
      if (count++ > size) throw new IllegalStateException("Chain longer than size " + size);
      last = node;
    }
    if (count != size) throw new IllegalStateException(
      "Chain length " + count + " != size " + size);
    if (last != tail) throw new IllegalStateException(
      "Tail " + tail + " is not the last node " + last);
  }

  private boolean endsAgree () {
    return (head == null) == (tail == null) && (tail == null || tail.next == null) &&
      (size == 0) == (head == null);
  }

  private E release (Node<E> node) {
    E data = node.data;
    node.unlink();
    return data;
  }

  /** Returns the node whose successor is {@code position}. */
  private Node<E> predecessor (Node<E> position) {
    for (Node<E> node = head; node != null; node = node.next) {
      if (node.next == position) return node;
    }
    throw new PositionNotFoundException(position);
  }

  private Node<E> head;
  private Node<E> tail; // not an owner, always the last node reachable from head
  private int size;
}
