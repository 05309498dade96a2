package com.cliffc.lir.ir;

import com.cliffc.lir.util.SB;

import java.util.Objects;

// Higher-ranked type: introduces _num_binders fresh bound type variables
// scoped over _ty.  Binders are not named, just counted.
public final class QuantifiedTy extends Ty {
  public final int _num_binders;
  public final Ty _ty;
  public QuantifiedTy( int num_binders, Ty ty ) { assert num_binders >= 0; _num_binders = num_binders; _ty = ty; }
  @Override public SB str( SB sb ) { return _ty.str(sb.p("for<").p(_num_binders).p("> ")); }
  @Override public boolean equals( Object o ) {
    if( this==o ) return true;
    if( !(o instanceof QuantifiedTy q) ) return false;
    return _num_binders==q._num_binders && _ty.equals(q._ty);
  }
  @Override public int hashCode() { return Objects.hash(_num_binders,_ty); }
}
