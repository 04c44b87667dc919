package com.cliffc.lc;

/** an implementation of the untyped lambda calculus
 */

public abstract class LC {
  public static RuntimeException TODO( String msg) { throw new RuntimeException(msg); }

  // Default beta-step budget for Reduce; <= 0 means no budget at all.
  public static int MAX_STEPS = 100000;

  // Debug printers
  public static boolean DEBUG = false;
  public static <T> T p(T x, String s) {
    if( !LC.DEBUG ) return x;
    System.err.println(s);
    return x;
  }
}
