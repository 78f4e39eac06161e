//
// SList - a singly-linked sequence container for the JVM
// http://github.com/scaled/scaled/blob/master/LICENSE

package slist;

import java.util.Arrays;
import java.util.NoSuchElementException;
import org.junit.*;
import static org.junit.Assert.*;

public class SListTest {

  @Test public void testPushAndPop () {
    SList<Integer> list = new SList<>();
    assertTrue(list.isEmpty());
    list.pushBack(1);
    list.pushBack(2);
    list.pushFront(0);
    assertEquals(Std.list(0, 1, 2), list);
    assertEquals(3, list.size());
    list.checkInvariants();

    assertEquals((Integer)0, list.popFront());
    assertEquals(Std.list(1, 2), list);
    assertEquals((Integer)2, list.popBack());
    assertEquals(Std.list(1), list);
    assertEquals((Integer)1, list.front());
    assertEquals((Integer)1, list.back());
    list.checkInvariants();

    assertEquals((Integer)1, list.popBack());
    assertTrue(list.isEmpty());
    list.checkInvariants();
  }

  @Test public void testPushFrontOnEmptySetsTail () {
    SList<String> list = new SList<>();
    list.pushFront("a");
    assertEquals("a", list.back());
    list.pushBack("b");
    assertEquals(Std.list("a", "b"), list);
    list.checkInvariants();
  }

  @Test public void testPopFrontOfLastClearsTail () {
    SList<String> list = Std.list("a");
    list.popFront();
    list.checkInvariants();
    // a stale tail would link the new node after the removed one
    list.pushBack("b");
    assertEquals(Std.list("b"), list);
    assertEquals("b", list.front());
  }

  @Test public void testSizeTracksNetInsertions () {
    SList<Integer> list = new SList<>();
    int expected = 0;
    for (int ii = 0; ii < 50; ii++) {
      switch (ii % 5) {
      case 0: case 1: list.pushBack(ii); expected += 1; break;
      case 2: list.pushFront(ii); expected += 1; break;
      case 3: list.popFront(); expected -= 1; break;
      case 4: list.popBack(); expected -= 1; break;
      }
      assertEquals(expected, list.size());
      assertEquals(expected == 0, list.isEmpty());
      list.checkInvariants();
    }
  }

  @Test public void testPushPopRestores () {
    SList<Integer> list = Std.list(1, 2, 3);
    list.pushBack(4);
    list.popBack();
    assertEquals(Std.list(1, 2, 3), list);
    list.pushFront(0);
    list.popFront();
    assertEquals(Std.list(1, 2, 3), list);

    SList<Integer> empty = new SList<>();
    empty.pushFront(7);
    empty.popFront();
    assertEquals(new SList<Integer>(), empty);
  }

  @Test(expected=NoSuchElementException.class) public void testPopFrontOnEmpty () {
    new SList<Integer>().popFront();
  }

  @Test(expected=NoSuchElementException.class) public void testPopBackOnEmpty () {
    new SList<Integer>().popBack();
  }

  @Test(expected=NoSuchElementException.class) public void testFrontOnEmpty () {
    new SList<Integer>().front();
  }

  @Test(expected=NoSuchElementException.class) public void testBackOnEmpty () {
    new SList<Integer>().back();
  }

  @Test public void testGet () {
    SList<String> list = Std.list("a", "b", "c");
    assertEquals("a", list.get(0));
    assertEquals("b", list.get(1));
    assertEquals("c", list.get(2));
  }

  @Test public void testGetOutOfRange () {
    SList<String> list = Std.list("a", "b");
    for (int index : new int[] { 2, 3, -1 }) {
      try {
        list.get(index);
        fail("Expected IndexOutOfBoundsException for " + index);
      } catch (IndexOutOfBoundsException e) {
        assertEquals(index + " not in [0,2)", e.getMessage());
      }
    }
  }

  @Test public void testInsertBeforeHeadIsPushFront () {
    SList<Integer> a = Std.list(1, 2, 3), b = Std.list(1, 2, 3);
    a.insertBefore(a.begin(), 0);
    b.pushFront(0);
    assertEquals(b, a);
    a.checkInvariants();
  }

  @Test public void testInsertBeforeMiddle () {
    SList<Integer> list = Std.list(1, 3);
    Cursor<Integer> pos = list.begin().advance();
    list.insertBefore(pos, 2);
    assertEquals(Std.list(1, 2, 3), list);
    // the cursor still refers to the node it was at
    assertEquals((Integer)3, pos.get());
    list.checkInvariants();
  }

  @Test public void testInsertBeforeLast () {
    SList<Integer> list = Std.list(1, 2, 4);
    list.insertBefore(list.begin().advance().advance(), 3);
    assertEquals(Std.list(1, 2, 3, 4), list);
    assertEquals((Integer)4, list.back());
    list.checkInvariants();
  }

  @Test public void testInsertBeforeEndAppends () {
    SList<Integer> list = Std.list(1, 2);
    list.insertBefore(list.end(), 3);
    assertEquals(Std.list(1, 2, 3), list);
    assertEquals((Integer)3, list.back());
    list.checkInvariants();

    SList<Integer> empty = new SList<>();
    empty.insertBefore(empty.end(), 1);
    assertEquals(Std.list(1), empty);
    empty.checkInvariants();
  }

  @Test public void testInsertBeforeForeignPosition () {
    SList<Integer> list = Std.list(1, 2, 3);
    SList<Integer> other = Std.list(1, 2, 3);
    try {
      list.insertBefore(other.begin().advance(), 9);
      fail("Expected PositionNotFoundException");
    } catch (PositionNotFoundException e) {
      // expected
    }
    assertEquals(Std.list(1, 2, 3), list);
    assertEquals(3, list.size());
    list.checkInvariants();
  }

  @Test(expected=PositionNotFoundException.class) public void testInsertBeforeRemovedNode () {
    SList<Integer> list = Std.list(1, 2, 3);
    Node<Integer> pos = list.begin().advance().position();
    list.eraseBefore(list.begin().advance().advance());
    list.insertBefore(pos, 9);
  }

  @Test public void testEraseBefore () {
    SList<Integer> list = Std.list(1, 2, 3, 4);
    // erase the second element: the one before the third
    assertEquals((Integer)2, list.eraseBefore(list.begin().advance().advance()));
    assertEquals(Std.list(1, 3, 4), list);
    list.checkInvariants();

    // erase the first element: the one before the second
    assertEquals((Integer)1, list.eraseBefore(list.begin().advance()));
    assertEquals(Std.list(3, 4), list);
    assertEquals((Integer)3, list.front());
    list.checkInvariants();
  }

  @Test public void testEraseBeforeEndRemovesLast () {
    SList<Integer> list = Std.list(1, 2, 3);
    assertEquals((Integer)3, list.eraseBefore(list.end()));
    assertEquals((Integer)2, list.back());
    list.checkInvariants();
    list.eraseBefore(list.end());
    list.eraseBefore(list.end());
    assertTrue(list.isEmpty());
    list.checkInvariants();
  }

  @Test(expected=IllegalStateException.class) public void testEraseBeforeHead () {
    SList<Integer> list = Std.list(1, 2, 3);
    list.eraseBefore(list.begin());
  }

  @Test(expected=IllegalStateException.class) public void testEraseBeforeOnEmpty () {
    SList<Integer> list = new SList<>();
    list.eraseBefore(list.end());
  }

  @Test public void testEraseBeforeForeignPosition () {
    SList<Integer> list = Std.list(1, 2, 3);
    SList<Integer> other = Std.list(1, 2, 3);
    try {
      list.eraseBefore(other.begin().advance());
      fail("Expected PositionNotFoundException");
    } catch (PositionNotFoundException e) {
      // expected
    }
    assertEquals(Std.list(1, 2, 3), list);
    list.checkInvariants();
  }

  @Test public void testClear () {
    SList<Integer> list = Std.list(1, 2, 3);
    list.clear();
    assertTrue(list.isEmpty());
    assertEquals(0, list.size());
    assertTrue(list.begin().atEnd());
    list.checkInvariants();
    list.pushBack(4);
    assertEquals(Std.list(4), list);
  }

  @Test public void testCopyIsDeep () {
    SList<Integer> list = Std.list(1, 2, 3);
    SList<Integer> copy = new SList<>(list);
    assertEquals(list, copy);
    assertNotSame(list.begin().position(), copy.begin().position());
    copy.begin().set(9);
    copy.pushBack(4);
    assertEquals(Std.list(1, 2, 3), list);
    assertEquals(Std.list(9, 2, 3, 4), copy);
  }

  @Test public void testCopyOfLongList () {
    SList<Integer> list = new SList<>();
    for (int ii = 0; ii < 200000; ii++) list.pushBack(ii);
    SList<Integer> copy = new SList<>(list);
    assertEquals(list, copy);
    assertEquals(list.hashCode(), copy.hashCode());
  }

  @Test public void testFromIterator () {
    SList<String> list = new SList<>(Arrays.asList("a", "b", "c").iterator());
    assertEquals(Std.list("a", "b", "c"), list);
    list.checkInvariants();
  }

  @Test public void testAssign () {
    SList<Integer> list = Std.list(7, 8);
    list.assign(1, 2, 3);
    assertEquals(Std.list(1, 2, 3), list);
    list.assign(Arrays.asList(4, 5));
    assertEquals(Std.list(4, 5), list);
    list.assign(new Integer[] { 6 });
    assertEquals(Std.list(6), list);
    list.checkInvariants();
  }

  @Test public void testAssignSelf () {
    SList<Integer> list = Std.list(1, 2, 3);
    list.assign(list);
    assertEquals(Std.list(1, 2, 3), list);
  }

  @Test public void testAssignFromViewOfSelf () {
    SList<Integer> list = Std.list(1, 2, 3);
    // the queue iterates over list's own chain
    list.assign(new Fifo<>(list));
    assertEquals(Std.list(1, 2, 3), list);
    list.checkInvariants();
  }

  @Test public void testAssignReplacesChain () {
    SList<Integer> list = Std.list(7, 8, 9);
    Cursor<Integer> old = list.begin();
    list.assign(Arrays.asList(1, 2));
    assertEquals(Std.list(1, 2), list);
    assertNotEquals(old, list.begin());
    list.checkInvariants();
  }

  @Test public void testQueueableView () {
    Queueable<String> store = Std.list("a");
    store.pushBack("b");
    assertEquals("a", store.popFront());
    assertEquals("b", store.front());
    assertEquals("b", store.back());
    assertEquals(1, store.size());
  }

  @Test public void testMoveFrom () {
    SList<Integer> source = Std.list(1, 2, 3);
    Node<Integer> first = source.begin().position();
    SList<Integer> target = Std.list(9).moveFrom(source);
    assertEquals(Std.list(1, 2, 3), target);
    assertTrue(source.isEmpty());
    source.checkInvariants();
    target.checkInvariants();
    // the nodes moved with the chain
    assertSame(first, target.begin().position());
  }

  @Test public void testSwap () {
    SList<Integer> a = Std.list(1, 2, 3), b = Std.list(4);
    a.swap(b);
    assertEquals(Std.list(4), a);
    assertEquals(Std.list(1, 2, 3), b);
    a.checkInvariants();
    b.checkInvariants();
  }

  @Test public void testEquals () {
    SList<String> c1 = Std.list("one", "two", "three");
    SList<String> c2 = Std.list("one", "two", "three");
    SList<String> c3 = Std.list("one", "two", "three", "four");
    SList<Integer> c4 = Std.list(1, 2, 3);
    assertEquals(c1, c2);
    assertEquals(c2, c1);
    assertNotEquals(c1, c3);
    assertNotEquals(c3, c1);
    assertNotEquals(c1, c4);
    assertEquals(Std.list("a", null), Std.list("a", null));
    assertNotEquals(c1, Arrays.asList("one", "two", "three"));
  }

  @Test public void testHashCode () {
    // hash code should be equivalent to java.util.List.hashCode
    SList<Integer> ints = Std.list(1, 2, 3, 4, 5);
    assertEquals(Arrays.asList(1, 2, 3, 4, 5).hashCode(), ints.hashCode());
  }

  @Test public void testToString () {
    assertEquals("[]", new SList<Integer>().toString());
    assertEquals("[1, 2, 3]", Std.list(1, 2, 3).toString());
  }

  @Test public void testIterator () {
    int sum = 0;
    for (int ii : Std.list(1, 2, 3, 4, 5)) sum += ii;
    assertEquals(15, sum);
  }

  @Test(expected=UnsupportedOperationException.class) public void testIteratorRemove () {
    java.util.Iterator<Integer> iter = Std.list(1).iterator();
    iter.next();
    iter.remove();
  }

  @Test(expected=NoSuchElementException.class) public void testIteratorExhausted () {
    java.util.Iterator<Integer> iter = Std.list(1).iterator();
    iter.next();
    iter.next();
  }
}
