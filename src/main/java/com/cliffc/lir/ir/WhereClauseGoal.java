package com.cliffc.lir.ir;

import com.cliffc.lir.util.SB;

/** Leaf assertion of a Goal.  Every WhereClause (Normalize, Implemented) is
 *  also a WhereClauseGoal; goals additionally allow raw type unification.
 */
public abstract class WhereClauseGoal extends Term {

  public static final class UnifyTys extends WhereClauseGoal {
    public final Unify<Ty> _unify;
    public UnifyTys( Unify<Ty> unify ) { _unify = unify; }
    public UnifyTys( Ty a, Ty b ) { this(new Unify<>(a,b)); }
    @Override public SB str( SB sb ) { return _unify.str(sb); }
    @Override public boolean equals( Object o ) {
      return this==o || (o instanceof UnifyTys u && _unify.equals(u._unify));
    }
    @Override public int hashCode() { return _unify.hashCode(); }
  }
}
