package com.cliffc.lir.ir;

import com.cliffc.lir.util.SB;

import java.util.Objects;

// Associated type access: "<Self as Trait>::Name"
public final class ProjectionTy extends Ty {
  public final TraitRef _trait_ref;
  public final String _name;
  public ProjectionTy( TraitRef trait_ref, String name ) { _trait_ref = trait_ref; _name = name; }
  @Override public SB str( SB sb ) { return _trait_ref.str(sb.p('<')).p(">::").p(_name); }
  @Override public boolean equals( Object o ) {
    if( this==o ) return true;
    if( !(o instanceof ProjectionTy p) ) return false;
    return _trait_ref.equals(p._trait_ref) && _name.equals(p._name);
  }
  @Override public int hashCode() { return Objects.hash(_trait_ref,_name); }
}
