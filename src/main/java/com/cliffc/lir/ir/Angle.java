package com.cliffc.lir.ir;

import com.cliffc.lir.util.SB;

import java.util.List;

/** Generic-argument bracketing: "<a, b, c>", or nothing at all for an empty
 *  list.  Elements print in order; used for type constructor arguments,
 *  trait arguments and the synthetic Normalize argument list. */
public final class Angle {
  private Angle() {}
  public static SB str( SB sb, List<? extends Str> xs ) {
    if( xs.isEmpty() ) return sb;
    sb.p('<');
    for( int i=0; i<xs.size(); i++ ) {
      if( i > 0 ) sb.p(", ");
      xs.get(i).str(sb);
    }
    return sb.p('>');
  }
}
