package com.cliffc.lir.ir;

import com.cliffc.lir.Program;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;

public class TestClauses {
  private static final Program PROG = new Program();
  private static final ItemId SELF = PROG.add_struct("SelfTy",0);
  private static final ItemId T    = PROG.add_trait ("T",1);
  private static final ItemId ARG  = PROG.add_struct("Arg",0);
  private static final ItemId OUT  = PROG.add_struct("OutTy",0);

  private static final Ty SELF_TY = new ApplicationTy(SELF);
  private static final Ty ARG_TY  = new ApplicationTy(ARG );
  private static final Ty OUT_TY  = new ApplicationTy(OUT );
  private static final TraitRef TR = new TraitRef(T, SELF_TY.param(), ARG_TY.param());

  private static String str( Term t ) { return Program.set_current_program(PROG, t::toString); }

  @Test public void testNormalize() {
    Normalize n = new Normalize(new ProjectionTy(TR,"Item"), OUT_TY);
    assertEquals("SelfTy as T<Arg, Item = OutTy>", str(n));
    // Only a Self parameter: the binding is the only angle argument
    Normalize n1 = new Normalize(new ProjectionTy(new TraitRef(T, SELF_TY.param()),"Item"), new Ty.Var(0));
    assertEquals("SelfTy as T<Item = ?0>", str(n1));
    // Bound type is itself a projection
    Normalize n2 = new Normalize(new ProjectionTy(TR,"Item"), new ProjectionTy(new TraitRef(T, new Ty.Var(1).param()),"Item"));
    assertEquals("SelfTy as T<Arg, Item = <?1 as T>::Item>", str(n2));
  }

  @Test public void testImplemented() {
    WhereClause wc = new WhereClause.Implemented(TR);
    assertEquals("SelfTy as T<Arg>", str(wc));
    assertEquals(str(TR), str(wc));
    assertEquals("SelfTy as T", str(new WhereClause.Implemented(new TraitRef(T, SELF_TY.param()))));
  }

  @Test public void testUnify() {
    assertEquals("(?0 = OutTy)", str(new Unify<>(new Ty.Var(0), OUT_TY)));
    assertEquals("('?0 = '!1)", new Unify<Lifetime>(new Lifetime.Var(0), new Lifetime.ForAll(new UniverseIndex(1))).toString());
    assertEquals("(?0 = OutTy)", str(new WhereClauseGoal.UnifyTys(new Ty.Var(0), OUT_TY)));
  }

  @Test public void testAnd() {
    Goal g = new Goal.And(new Goal.Leaf(new WhereClause.Implemented(TR)),
                          new Goal.Leaf(new WhereClauseGoal.UnifyTys(new Unify<>(new Ty.Var(0), OUT_TY))));
    assertEquals("(SelfTy as T<Arg>, (?0 = OutTy))", str(g));
  }

  @Test public void testImplies() {
    Goal g = new Goal.Implies(new WhereClause.Implemented(TR),
                              new Goal.Leaf(new Normalize(new ProjectionTy(TR,"Item"), OUT_TY)));
    assertEquals("if (SelfTy as T<Arg>) { SelfTy as T<Arg, Item = OutTy> }", str(g));
  }

  // A type binder and a lifetime binder get distinct labels.  Older dumps
  // labelled both "<type>".
  @Test public void testQuantified() {
    Goal leaf = new Goal.Leaf(new WhereClause.Implemented(new TraitRef(T, new Ty.Var(0).param())));
    assertEquals("ForAll<type> { ?0 as T }", str(new Goal.Quantified(QuantifierKind.FOR_ALL, ParameterKind.TY, leaf)));
    assertEquals("Exists<type> { ?0 as T }", str(new Goal.Quantified(QuantifierKind.EXISTS , ParameterKind.TY, leaf)));
    Goal lt = new Goal.Leaf(new WhereClause.Implemented(new TraitRef(T, new Lifetime.Var(0).param())));
    assertEquals("ForAll<lifetime> { '?0 as T }", str(new Goal.Quantified(QuantifierKind.FOR_ALL, ParameterKind.LIFETIME, lt)));
  }

  @Test public void testNested() {
    Goal inner = new Goal.And(new Goal.Leaf(new WhereClauseGoal.UnifyTys(new Ty.Var(0), new Ty.Var(1))),
                              new Goal.Leaf(new WhereClause.Implemented(new TraitRef(T, new Ty.Var(1).param(), ARG_TY.param()))));
    Goal g = new Goal.Quantified(QuantifierKind.FOR_ALL, ParameterKind.TY,
               new Goal.Quantified(QuantifierKind.EXISTS, ParameterKind.TY,
                 new Goal.Implies(new WhereClause.Implemented(TR), inner)));
    String s = "ForAll<type> { Exists<type> { if (SelfTy as T<Arg>) { ((?0 = ?1), ?1 as T<Arg>) } } }";
    assertEquals(s, str(g));
    assertEquals(s, str(g));    // Same again
  }

  @Test public void testEquals() {
    Goal g0 = new Goal.Leaf(new Normalize(new ProjectionTy(TR,"Item"), OUT_TY));
    Goal g1 = new Goal.Leaf(new Normalize(new ProjectionTy(new TraitRef(new ItemId(1), SELF_TY.param(), ARG_TY.param()),"Item"), OUT_TY));
    assertEquals(g0,g1);
    assertEquals(g0.hashCode(),g1.hashCode());
    assertNotEquals(g0, new Goal.Leaf(new Normalize(new ProjectionTy(TR,"Other"), OUT_TY)));
    assertNotEquals(new Goal.Quantified(QuantifierKind.FOR_ALL, ParameterKind.TY, g0),
                    new Goal.Quantified(QuantifierKind.FOR_ALL, ParameterKind.LIFETIME, g0));
  }
}
