package com.cliffc.lir.ir;

import com.cliffc.lir.util.SB;

import java.util.Objects;

/** Either a type-valued or a lifetime-valued slot.  Used for argument lists
 *  as {@code ParameterKind<Ty,Lifetime>}, and with Unit payloads to tag the
 *  kind of a binder.  The wrapper prints nothing of its own. */
public final class ParameterKind<T extends Str, L extends Str> extends Term {
  public static final ParameterKind<Unit,Unit> TY       = ty      (Unit.UNIT);
  public static final ParameterKind<Unit,Unit> LIFETIME = lifetime(Unit.UNIT);

  // Exactly one is set
  private final T _ty;
  private final L _lt;
  private ParameterKind( T ty, L lt ) { assert (ty==null) != (lt==null); _ty = ty; _lt = lt; }
  public static <T extends Str, L extends Str> ParameterKind<T,L> ty      ( T t ) { return new ParameterKind<>(t,null); }
  public static <T extends Str, L extends Str> ParameterKind<T,L> lifetime( L l ) { return new ParameterKind<>(null,l); }

  public boolean is_ty() { return _ty!=null; }
  public T ty() { assert is_ty(); return _ty; }
  public L lifetime() { assert !is_ty(); return _lt; }

  @Override public SB str( SB sb ) { return is_ty() ? _ty.str(sb) : _lt.str(sb); }
  @Override public boolean equals( Object o ) {
    if( this==o ) return true;
    if( !(o instanceof ParameterKind<?,?> pk) ) return false;
    return Objects.equals(_ty,pk._ty) && Objects.equals(_lt,pk._lt);
  }
  @Override public int hashCode() { return Objects.hash(_ty,_lt); }
}
