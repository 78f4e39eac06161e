//
// SList - a singly-linked sequence container for the JVM
// http://github.com/scaled/scaled/blob/master/LICENSE

package slist;

/**
 * Reports a size mismatch between a list and the fixed-size array it is being copied into.
 */
public abstract class CapacityException extends IllegalArgumentException {

  /** Thrown when the list holds more elements than the target array has slots. */
  public static class Overflow extends CapacityException {
    public Overflow (int size, int capacity) {
      super("List size " + size + " exceeds array size " + capacity, size, capacity);
    }
    private static final long serialVersionUID = 1L;
  }

  /** Thrown when the list holds fewer elements than the target array has slots. */
  public static class Underflow extends CapacityException {
    public Underflow (int size, int capacity) {
      super("Array size " + capacity + " exceeds list size " + size, size, capacity);
    }
    private static final long serialVersionUID = 1L;
  }

  /** The number of elements in the source list. */
  public final int size;

  /** The length of the target array. */
  public final int capacity;

  protected CapacityException (String message, int size, int capacity) {
    super(message);
    this.size = size;
    this.capacity = capacity;
  }

  private static final long serialVersionUID = 1L;
}
