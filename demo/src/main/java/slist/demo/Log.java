//
// SList - a singly-linked sequence container for the JVM
// http://github.com/scaled/scaled/blob/master/LICENSE

package slist.demo;

import java.io.PrintStream;

/** Ye olde log facade. */
public abstract class Log {

  /** Returns a log which prints each message on its own line to {@code out}. Errors are followed
    * by their stack trace. */
  public static Log to (PrintStream out) {
    return new Log() {
      public void log (String msg) { out.println(msg); }
      public void log (String msg, Throwable error) { log(msg); error.printStackTrace(out); }
    };
  }

  /** Records {@code msg} to the log. */
  public abstract void log (String msg);

  /** Records {@code msg} and {@code error} to the log. */
  public abstract void log (String msg, Throwable error);

  /**
   * Records {@code msg} plus {@code [key=value, ...]} to the log. If the last {@code keyVals}
   * argument is a lone exception, its stack trace will be logged.
   */
  public void log (String msg, String key, Object value, Object... keyVals) {
    boolean trailingError = (keyVals.length % 2 == 1) &&
      (keyVals[keyVals.length-1] instanceof Throwable);
    String text = format(msg, key, value, keyVals);
    if (trailingError) log(text, (Throwable)keyVals[keyVals.length-1]);
    else log(text);
  }

  /** Formats {@code msg} followed by its key/value pairs. An unpaired trailing argument is
    * omitted from the text. */
  static String format (String msg, String key, Object value, Object... keyVals) {
    StringBuilder sb = new StringBuilder(msg);
    sb.append(" [").append(key).append("=").append(value);
    for (int ii = 0, ll = keyVals.length-1; ii < ll; ii += 2) {
      sb.append(", ").append(keyVals[ii]).append("=").append(keyVals[ii+1]);
    }
    return sb.append("]").toString();
  }
}
