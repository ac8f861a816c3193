package com.cliffc.nix.ast;

import com.cliffc.nix.Pos;
import com.cliffc.nix.util.SB;

// Prefix boolean negation
public class Not extends AST {
  public final AST _e;
  public final Pos _loc;
  public Not( AST e, Pos loc ) { _e = e; _loc = loc; }
  @Override public SB str(SB sb) { return _e.str(sb.p("(! ")).p(')'); }
}
