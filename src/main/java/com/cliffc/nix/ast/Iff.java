package com.cliffc.nix.ast;

import com.cliffc.nix.util.SB;

// if c then t else f
public class Iff extends AST {
  public final AST _pred, _t, _f;
  public Iff( AST pred, AST t, AST f ) { _pred = pred; _t = t; _f = f; }
  @Override public SB str(SB sb) {
    _pred.str(sb.p("(if ")).p(" then ");
    _t.str(sb).p(" else ");
    return _f.str(sb).p(')');
  }
}
