package com.cliffc.lir.ir;

import com.cliffc.lir.util.SB;

// The head of an applied type: a declared item (ItemId), a rigid skolemized
// universal (ForAll) or an associated type (AssociatedType).
public abstract class TypeName extends Term {

  // Placeholder for a universally quantified type, living in universe _u
  public static final class ForAll extends TypeName {
    public final UniverseIndex _u;
    public ForAll( UniverseIndex u ) { _u = u; }
    @Override public SB str( SB sb ) { return sb.p('!').p(_u._counter); }
    @Override public boolean equals( Object o ) {
      return this==o || (o instanceof ForAll f && _u.equals(f._u));
    }
    @Override public int hashCode() { return _u.hashCode()*31+1; }
  }
}
