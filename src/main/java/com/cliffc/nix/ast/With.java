package com.cliffc.nix.ast;

import com.cliffc.nix.Pos;
import com.cliffc.nix.util.SB;

// with scope; body.  The body sees the attributes of scope as variables.
public class With extends AST {
  public final AST _scope, _body;
  public final Pos _loc;
  public With( AST scope, AST body, Pos loc ) { _scope = scope; _body = body; _loc = loc; }
  @Override public SB str(SB sb) {
    _scope.str(sb.p("(with ")).p("; ");
    return _body.str(sb).p(')');
  }
}
