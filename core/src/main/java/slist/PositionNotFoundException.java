//
// SList - a singly-linked sequence container for the JVM
// http://github.com/scaled/scaled/blob/master/LICENSE

package slist;

/**
 * Thrown when a splice position does not belong to the chain it was handed to: it came from a
 * different list, or its node has since been removed.
 */
public class PositionNotFoundException extends IllegalArgumentException {

  public PositionNotFoundException (Node<?> position) {
    super("Position not found: " + position);
  }

  private static final long serialVersionUID = 1L;
}
