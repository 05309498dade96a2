package com.cliffc.lir.ir;

import com.cliffc.lir.util.SB;

// Lifetimes: a bound variable or a skolemized placeholder in some universe
public abstract class Lifetime extends Term {
  // Wrap as a lifetime argument
  public final ParameterKind<Ty,Lifetime> param() { return ParameterKind.lifetime(this); }

  public static final class Var extends Lifetime {
    public final int _depth;
    public Var( int depth ) { assert depth >= 0; _depth = depth; }
    @Override public SB str( SB sb ) { return sb.p("'?").p(_depth); }
    @Override public boolean equals( Object o ) {
      return this==o || (o instanceof Var v && _depth==v._depth);
    }
    @Override public int hashCode() { return _depth; }
  }

  public static final class ForAll extends Lifetime {
    public final UniverseIndex _u;
    public ForAll( UniverseIndex u ) { _u = u; }
    @Override public SB str( SB sb ) { return sb.p("'!").p(_u._counter); }
    @Override public boolean equals( Object o ) {
      return this==o || (o instanceof ForAll f && _u.equals(f._u));
    }
    @Override public int hashCode() { return _u.hashCode()*31+2; }
  }
}
