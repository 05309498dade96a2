package com.cliffc.lir.ir;

import com.cliffc.lir.util.SB;

// Position in the strictly ordered universe hierarchy.  Placeholders
// introduced by skolemization live in some universe.
public final class UniverseIndex extends Term {
  public static final UniverseIndex ROOT = new UniverseIndex(0);
  public final int _counter;
  public UniverseIndex( int counter ) { assert counter >= 0; _counter = counter; }
  public UniverseIndex next() { return new UniverseIndex(_counter+1); }
  public boolean can_see( UniverseIndex u ) { return _counter >= u._counter; }

  @Override public SB str( SB sb ) { return sb.p('U').p(_counter); }
  @Override public boolean equals( Object o ) {
    return this==o || (o instanceof UniverseIndex u && _counter==u._counter);
  }
  @Override public int hashCode() { return _counter; }
}
