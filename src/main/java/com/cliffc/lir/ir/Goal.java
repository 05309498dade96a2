package com.cliffc.lir.ir;

import com.cliffc.lir.util.SB;

import java.util.Objects;

/** Proof obligations: quantification, implication and conjunction over leaf
 *  where-clause assertions.
 *<pre>
 *   ForAll<type> { ... }     Quantified, one fresh binder
 *   if (wc) { ... }          Implies
 *   (g1, g2)                 And
 *   wc                       Leaf
 *</pre>
 */
public abstract class Goal extends Term {

  public static final class Quantified extends Goal {
    public final QuantifierKind _kind;
    public final ParameterKind<Unit,Unit> _binder;
    public final Goal _goal;
    public Quantified( QuantifierKind kind, ParameterKind<Unit,Unit> binder, Goal goal ) { _kind = kind; _binder = binder; _goal = goal; }
    // Binder label names the kind of the quantified variable
    @Override public SB str( SB sb ) {
      _kind.str(sb).p(_binder.is_ty() ? "<type>" : "<lifetime>");
      return _goal.str(sb.p(" { ")).p(" }");
    }
    @Override public boolean equals( Object o ) {
      if( this==o ) return true;
      if( !(o instanceof Quantified q) ) return false;
      return _kind==q._kind && _binder.equals(q._binder) && _goal.equals(q._goal);
    }
    @Override public int hashCode() { return Objects.hash(_kind,_binder,_goal); }
  }

  public static final class Implies extends Goal {
    public final WhereClause _clause;
    public final Goal _goal;
    public Implies( WhereClause clause, Goal goal ) { _clause = clause; _goal = goal; }
    @Override public SB str( SB sb ) { return _goal.str(_clause.str(sb.p("if (")).p(") { ")).p(" }"); }
    @Override public boolean equals( Object o ) {
      if( this==o ) return true;
      if( !(o instanceof Implies i) ) return false;
      return _clause.equals(i._clause) && _goal.equals(i._goal);
    }
    @Override public int hashCode() { return Objects.hash(_clause,_goal); }
  }

  public static final class And extends Goal {
    public final Goal _g1, _g2;
    public And( Goal g1, Goal g2 ) { _g1 = g1; _g2 = g2; }
    @Override public SB str( SB sb ) { return _g2.str(_g1.str(sb.p('(')).p(", ")).p(')'); }
    @Override public boolean equals( Object o ) {
      if( this==o ) return true;
      if( !(o instanceof And a) ) return false;
      return _g1.equals(a._g1) && _g2.equals(a._g2);
    }
    @Override public int hashCode() { return Objects.hash(_g1,_g2,3); }
  }

  public static final class Leaf extends Goal {
    public final WhereClauseGoal _wc;
    public Leaf( WhereClauseGoal wc ) { _wc = wc; }
    @Override public SB str( SB sb ) { return _wc.str(sb); }
    @Override public boolean equals( Object o ) {
      return this==o || (o instanceof Leaf l && _wc.equals(l._wc));
    }
    @Override public int hashCode() { return _wc.hashCode()*31+4; }
  }
}
