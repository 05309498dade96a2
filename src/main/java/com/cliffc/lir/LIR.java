package com.cliffc.lir;

/** Text printer for a logic IR: types, lifetimes, trait refs, where-clauses
 *  and proof goals, as produced by a trait-resolution engine.
 */

public abstract class LIR {
  // Debug printers
  public static boolean DEBUG = false;
  public static <T> T p(T x, String s) {
    if( !LIR.DEBUG ) return x;
    System.err.println(s);
    return x;
  }
}
