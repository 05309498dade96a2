package com.cliffc.lir.ir;

import com.cliffc.lir.util.SB;

import java.util.ArrayList;
import java.util.Objects;

/** Asserts a projection normalizes to a type.  Printed in associated-type
 *  binding syntax, with the binding as the last angle argument:
 *  "Self as Trait<Args, Name = Ty>".
 */
public final class Normalize extends WhereClause {
  public final ProjectionTy _projection;
  public final Ty _ty;
  public Normalize( ProjectionTy projection, Ty ty ) { _projection = projection; _ty = ty; }

  @Override public SB str( SB sb ) {
    TraitRef tr = _projection._trait_ref;
    ArrayList<Str> args = new ArrayList<>(tr.rest());
    args.add(sb2 -> _ty.str(sb2.p(_projection._name).p(" = ")));
    return Angle.str(tr._trait_id.str(tr.self_param().str(sb).p(" as ")),args);
  }
  @Override public boolean equals( Object o ) {
    if( this==o ) return true;
    if( !(o instanceof Normalize n) ) return false;
    return _projection.equals(n._projection) && _ty.equals(n._ty);
  }
  @Override public int hashCode() { return Objects.hash(_projection,_ty); }
}
