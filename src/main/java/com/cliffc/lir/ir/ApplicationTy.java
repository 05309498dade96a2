package com.cliffc.lir.ir;

import com.cliffc.lir.util.SB;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Objects;

// A type constructor applied to arguments, e.g. "Vec<?0>"
public final class ApplicationTy extends Ty {
  public final TypeName _name;
  public final List<ParameterKind<Ty,Lifetime>> _params;
  public ApplicationTy( @NotNull TypeName name, @NotNull List<ParameterKind<Ty,Lifetime>> params ) {
    _name = name;
    _params = List.copyOf(params);
  }
  @SafeVarargs
  public ApplicationTy( @NotNull TypeName name, ParameterKind<Ty,Lifetime>... params ) { this(name,List.of(params)); }

  @Override public SB str( SB sb ) { return Angle.str(_name.str(sb),_params); }
  @Override public boolean equals( Object o ) {
    if( this==o ) return true;
    if( !(o instanceof ApplicationTy a) ) return false;
    return _name.equals(a._name) && _params.equals(a._params);
  }
  @Override public int hashCode() { return Objects.hash(_name,_params); }
}
