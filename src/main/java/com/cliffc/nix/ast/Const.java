package com.cliffc.nix.ast;

import com.cliffc.nix.util.SB;

// Integer literal
public class Const extends AST {
  public final long _con;
  public Const( long con ) { _con = con; }
  @Override public SB str(SB sb) { return sb.p(_con); }
  @Override boolean delimited() { return false; }
}
