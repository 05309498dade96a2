package com.cliffc.lir.ir;

import com.cliffc.lir.util.SB;

// Constraints assumed or required during proof search: Normalize or
// Implemented.
public abstract class WhereClause extends WhereClauseGoal {

  // "Self as Trait<Args>", the trait is implemented for Self
  public static final class Implemented extends WhereClause {
    public final TraitRef _trait_ref;
    public Implemented( TraitRef trait_ref ) { _trait_ref = trait_ref; }
    @Override public SB str( SB sb ) { return _trait_ref.str(sb); }
    @Override public boolean equals( Object o ) {
      return this==o || (o instanceof Implemented i && _trait_ref.equals(i._trait_ref));
    }
    @Override public int hashCode() { return _trait_ref.hashCode()*31+1; }
  }
}
