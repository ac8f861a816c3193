package com.cliffc.nix.ast;

import com.cliffc.nix.util.SB;

// Function application by juxtaposition; always exactly one argument
public class Call extends AST {
  public final AST _fun, _arg;
  public Call( AST fun, AST arg ) { _fun = fun; _arg = arg; }

  // (fun arg)
  @Override public SB str(SB sb) {
    _fun.str(sb.p('(')).p(' ');
    return _arg.str(sb).p(')');
  }
}
