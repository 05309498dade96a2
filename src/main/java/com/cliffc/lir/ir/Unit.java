package com.cliffc.lir.ir;

import com.cliffc.lir.util.SB;

// Empty payload, used to tag binder kinds with a ParameterKind
public enum Unit implements Str {
  UNIT;
  @Override public SB str( SB sb ) { return sb.p("()"); }
}
