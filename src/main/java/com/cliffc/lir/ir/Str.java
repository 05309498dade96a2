package com.cliffc.lir.ir;

import com.cliffc.lir.util.SB;

// Anything that prints itself into an SB: IR terms, list elements, and
// synthetic fragments like the "Name = Ty" binding in a Normalize.
@FunctionalInterface
public interface Str { SB str( SB sb ); }
