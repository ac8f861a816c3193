package com.cliffc.nix.ast;

import com.cliffc.nix.Pos;
import com.cliffc.nix.util.SB;

// assert cond; body
public class Assert extends AST {
  public final AST _cond, _body;
  public final Pos _loc;        // Blamed when the assertion fails
  public Assert( AST cond, AST body, Pos loc ) { _cond = cond; _body = body; _loc = loc; }
  @Override public SB str(SB sb) {
    _cond.str(sb.p("(assert ")).p("; ");
    return _body.str(sb).p(')');
  }
}
