package com.cliffc.lir.ir;

import com.cliffc.lir.Program;
import com.cliffc.lir.util.SB;

/** Opaque index of a declared type or trait.  Equality is by index only.
 *
 *  Prints as the declared name from the current Program, if any Program is
 *  installed and knows this id.  Otherwise prints the raw index, so a
 *  missing Program still gives a debuggable dump. */
public final class ItemId extends TypeName {
  public final int _index;
  public ItemId( int index ) { assert index >= 0; _index = index; }

  @Override public SB str( SB sb ) {
    return Program.with_current_program(prog -> {
        String name = prog==null ? null : prog.name_of(this);
        return name==null ? sb.p("ItemId { index: ").p(_index).p(" }") : sb.p(name);
      });
  }
  @Override public boolean equals( Object o ) {
    return this==o || (o instanceof ItemId id && _index==id._index);
  }
  @Override public int hashCode() { return _index; }
}
