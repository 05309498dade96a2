package com.cliffc.lir.ir;

import com.cliffc.lir.util.SB;

// Types: a De Bruijn bound variable (Var), an applied type constructor
// (ApplicationTy), an associated type projection (ProjectionTy) or a
// higher-ranked type (QuantifiedTy).
public abstract class Ty extends Term {
  // Wrap as a type argument
  public final ParameterKind<Ty,Lifetime> param() { return ParameterKind.ty(this); }

  // Bound type variable; depth counts enclosing binders, innermost is 0
  public static final class Var extends Ty {
    public final int _depth;
    public Var( int depth ) { assert depth >= 0; _depth = depth; }
    @Override public SB str( SB sb ) { return sb.p('?').p(_depth); }
    @Override public boolean equals( Object o ) {
      return this==o || (o instanceof Var v && _depth==v._depth);
    }
    @Override public int hashCode() { return _depth; }
  }
}
