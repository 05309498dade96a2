package com.cliffc.lir;

import java.util.Objects;

// Registry entry for one declared item: what sort of item, its declared
// name, and how many generic binders it takes.
public final class TypeKind {
  public enum Sort { STRUCT, TRAIT }
  public final Sort _sort;
  public final String _name;
  public final int _binders;
  public TypeKind( Sort sort, String name, int binders ) {
    assert name!=null && binders >= 0;
    _sort = sort; _name = name; _binders = binders;
  }
  @Override public String toString() { return _name+":"+_sort.name().toLowerCase()+"<"+_binders+">"; }
  @Override public boolean equals( Object o ) {
    if( this==o ) return true;
    if( !(o instanceof TypeKind k) ) return false;
    return _sort==k._sort && _name.equals(k._name) && _binders==k._binders;
  }
  @Override public int hashCode() { return Objects.hash(_sort,_name,_binders); }
}
