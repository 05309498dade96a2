package com.cliffc.lir.ir;

import com.cliffc.lir.util.SB;

import java.util.Objects;

// An associated type named by its trait, e.g. "(Iterator::Item)"
public final class AssociatedType extends TypeName {
  public final ItemId _trait_id;
  public final String _name;
  public AssociatedType( ItemId trait_id, String name ) { _trait_id = trait_id; _name = name; }
  @Override public SB str( SB sb ) { return _trait_id.str(sb.p('(')).p("::").p(_name).p(')'); }
  @Override public boolean equals( Object o ) {
    if( this==o ) return true;
    if( !(o instanceof AssociatedType a) ) return false;
    return _trait_id.equals(a._trait_id) && _name.equals(a._name);
  }
  @Override public int hashCode() { return Objects.hash(_trait_id,_name); }
}
