package com.cliffc.lir.ir;

import com.cliffc.lir.util.SB;

public enum QuantifierKind implements Str {
  FOR_ALL("ForAll"),
  EXISTS ("Exists");
  public final String _str;
  QuantifierKind( String str ) { _str = str; }
  @Override public SB str( SB sb ) { return sb.p(_str); }
}
