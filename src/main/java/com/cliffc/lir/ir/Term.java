package com.cliffc.lir.ir;

import com.cliffc.lir.util.SB;

/** Base of all IR terms.  Terms are immutable trees, owned by value.
 *
 *  To keep printing consistent, this is the only toString call in the Term
 *  hierarchy.  Subtypes override 'str(SB)', and compose by passing the same
 *  SB down the tree; nothing is buffered beyond the SB itself.
 */
public abstract class Term implements Str {
  @Override public final String toString() { return str(new SB()).toString(); }
}
