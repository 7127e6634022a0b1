package com.cliffc.wf;

/** Symbolic IR kernel for finite-element weak forms.
 */

public abstract class WF {
  public static RuntimeException unimpl( String msg) { return new RuntimeException(msg); }

  // Spatial dimension used by Forms contexts built without one.
  public static final int DEFAULT_DIM = 3;

  // Debug printers
  public static boolean DEBUG = false;
  // Print every rule application in MapDag; requires DEBUG
  public static boolean TRACE = false;
  public static <T> T p(T x, String s) {
    if( !WF.DEBUG ) return x;
    System.err.println(s);
    return x;
  }
  public static boolean trace() { return DEBUG && TRACE; }
}
