package com.cliffc.lir.util;

import java.io.IOException;
import java.io.UncheckedIOException;

/** Tight/tiny StringBuilder wrapper.
 *  Short short names on purpose; so they don't obscure the printing.
 *  Appends to any Appendable; a failing sink throws UncheckedIOException
 *  wrapping the original IOException, which aborts the print. */
public final class SB {
  public final Appendable _sb;
  public SB(        ) { _sb = new StringBuilder( ); }
  public SB(String s) { _sb = new StringBuilder(s); }
  public SB(Appendable a) { _sb = a; }
  public SB p( String s ) {
    try { _sb.append(s); }
    catch( IOException ioe ) { throw new UncheckedIOException(ioe); }
    return this;
  }
  public SB p( char   s ) {
    try { _sb.append(s); }
    catch( IOException ioe ) { throw new UncheckedIOException(ioe); }
    return this;
  }
  public SB p( int    s ) { return p(Integer.toString(s)); }
  public SB p( long   s ) { return p(Long   .toString(s)); }
  // Not spelled "p" on purpose: too easy to accidentally say "p(1.0)" and
  // suddenly call the autoboxed version.
  public SB pobj( Object s ) { return p(s.toString()); }
  public SB s() { return p(' '); }

  @Override public String toString() { return _sb.toString(); }
}
