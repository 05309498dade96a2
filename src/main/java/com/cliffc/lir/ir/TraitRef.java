package com.cliffc.lir.ir;

import com.cliffc.lir.util.SB;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Objects;

/** A trait applied to parameters.  The first parameter is always the
 *  implementing ("Self") type; the rest are the trait's own generic
 *  arguments.  Prints as "Self as Trait<Args>".
 *
 *  An empty parameter list is a bug in whoever built the TraitRef. */
public final class TraitRef extends Term {
  public final ItemId _trait_id;
  public final List<ParameterKind<Ty,Lifetime>> _params;
  public TraitRef( @NotNull ItemId trait_id, @NotNull List<ParameterKind<Ty,Lifetime>> params ) {
    assert !params.isEmpty() : "TraitRef without a Self parameter";
    _trait_id = trait_id;
    _params = List.copyOf(params);
  }
  @SafeVarargs
  public TraitRef( @NotNull ItemId trait_id, ParameterKind<Ty,Lifetime>... params ) { this(trait_id,List.of(params)); }

  public ParameterKind<Ty,Lifetime> self_param() { return _params.get(0); }
  public List<ParameterKind<Ty,Lifetime>> rest() { return _params.subList(1,_params.size()); }

  @Override public SB str( SB sb ) { return Angle.str(_trait_id.str(self_param().str(sb).p(" as ")),rest()); }
  @Override public boolean equals( Object o ) {
    if( this==o ) return true;
    if( !(o instanceof TraitRef t) ) return false;
    return _trait_id.equals(t._trait_id) && _params.equals(t._params);
  }
  @Override public int hashCode() { return Objects.hash(_trait_id,_params); }
}
