package com.cliffc.lir.ir;

import com.cliffc.lir.util.SB;

import java.util.Objects;

// Asserts _a and _b are equal: "(a = b)"
public final class Unify<T extends Str> extends Term {
  public final T _a, _b;
  public Unify( T a, T b ) { _a = a; _b = b; }
  @Override public SB str( SB sb ) { return _b.str(_a.str(sb.p('(')).p(" = ")).p(')'); }
  @Override public boolean equals( Object o ) {
    if( this==o ) return true;
    if( !(o instanceof Unify<?> u) ) return false;
    return _a.equals(u._a) && _b.equals(u._b);
  }
  @Override public int hashCode() { return Objects.hash(_a,_b); }
}
