//
// SList - a singly-linked sequence container for the JVM
// http://github.com/scaled/scaled/blob/master/LICENSE

package slist.demo;

import java.util.ArrayList;
import java.util.LinkedList;
import java.util.Objects;
import slist.Fifo;
import slist.SList;
import slist.Std;

/**
 * Walks through the {@link SList} contract step by step: pushing and popping at both ends,
 * copying, assigning, converting to and from the other containers, iterating and queueing.
 */
public class Main {

  public static String USAGE =
    "Usage: slist-demo [count]\n" +
    "\n" +
    "  count    number of elements used by the copy, conversion and iteration steps (default 5)\n" +
    "\n" +
    "Pass -Dslist.verbose=true to log every step rather than just the outcome.";

  /** One named step of the walk-through. A step fails by throwing. */
  static class Step {
    public final String name;
    public final Runnable body;
    public Step (String name, Runnable body) {
      this.name = name;
      this.body = body;
    }
  }

  public static void main (String[] args) {
    Log log = Log.to(System.err);
    int count = 5;
    if (args.length > 0) {
      try { count = Integer.parseInt(args[0]); }
      catch (NumberFormatException e) { fail(log, USAGE); }
    }
    if (count < 1) fail(log, USAGE);

    Main main = new Main(log, Boolean.getBoolean("slist.verbose"));
    if (!main.run(count)) System.exit(1);
  }

  public Main (Log log, boolean verbose) {
    _log = log;
    _verbose = verbose;
  }

  /**
   * Runs every step using lists of {@code count} elements.
   * @return true if all steps passed.
   * @throws IllegalArgumentException if {@code count} is less than one.
   */
  public boolean run (int count) {
    if (count < 1) throw new IllegalArgumentException("count must be positive: " + count);
    Fifo<Step> steps = steps(count);
    int total = steps.size();
    boolean passed = run(steps);
    if (passed) _log.log("All steps passed", "steps", total, "count", count);
    return passed;
  }

  /** Runs {@code steps} in order, stopping at the first failure. */
  boolean run (Fifo<Step> steps) {
    while (!steps.isEmpty()) {
      Step step = steps.pop();
      try {
        step.body.run();
        if (_verbose) _log.log("Step passed", "step", step.name);
      } catch (RuntimeException e) {
        _log.log("Step failed", "step", step.name, "remaining", steps.size(), e);
        return false;
      }
    }
    return true;
  }

  Fifo<Step> steps (int count) {
    Fifo<Step> steps = new Fifo<>();
    SList<Integer> source = new SList<>();
    for (int ii = 1; ii <= count; ii++) source.pushBack(ii);

    steps.push(new Step("push and pop", () -> {
      SList<Integer> list = new SList<>();
      expect("empty", true, list.isEmpty());
      list.pushBack(1);
      list.pushBack(2);
      list.pushFront(0);
      expect("size", 3, list.size());
      expect("front", 0, list.front());
      expect("back", 2, list.back());
      expect("get(1)", 1, list.get(1));
      list.popFront();
      list.popBack();
      expect("size", 1, list.size());
      expect("front", 1, list.front());
    }));

    steps.push(new Step("clear", () -> {
      SList<Integer> list = Std.list(1, 2, 3);
      list.clear();
      expect("empty", true, list.isEmpty());
    }));

    steps.push(new Step("copy", () -> {
      SList<Integer> copy = new SList<>(source);
      expect("copy", source, copy);
      copy.pushBack(0);
      expect("source size", count, source.size());
    }));

    steps.push(new Step("assign", () -> {
      SList<Integer> list = Std.list(9);
      list.assign(source);
      expect("assigned", source, list);
    }));

    steps.push(new Step("array list", () -> {
      ArrayList<Integer> vec = source.toArrayList();
      expect("round trip", source, new SList<Integer>().assign(vec));
    }));

    steps.push(new Step("array", () -> {
      Integer[] arr = source.toArrayAuto(new Integer[count]);
      expect("round trip", source, new SList<Integer>().assign(arr));
    }));

    steps.push(new Step("linked list", () -> {
      LinkedList<Integer> list = source.toLinkedList();
      expect("round trip", source, new SList<Integer>().assign(list));
    }));

    steps.push(new Step("iterate", () -> {
      long sum = 0;
      for (int elem : source) sum += elem;
      expect("sum", (long)count * (count + 1) / 2, sum);
    }));

    steps.push(new Step("queue", () -> {
      Fifo<Integer> queue = new Fifo<>();
      queue.push(10);
      queue.push(20);
      queue.push(30);
      expect("front", 10, queue.front());
      expect("back", 30, queue.back());
      queue.pop();
      expect("size", 2, queue.size());
    }));

    return steps;
  }

  static void expect (String what, Object want, Object got) {
    if (!Objects.equals(want, got)) throw new IllegalStateException(
      "Unexpected " + what + ": wanted " + want + ", got " + got);
  }

  private static void fail (Log log, String msg) {
    log.log(msg);
    System.exit(255);
  }

  private final Log _log;
  private final boolean _verbose;
}
