package com.cliffc.nix.ast;

import com.cliffc.nix.Pos;
import com.cliffc.nix.util.SB;

/** Single-argument function.  The argument is a plain name, an attribute-set
 *  pattern, or a pattern plus an '@' alias naming the whole argument. */
public class Lambda extends AST {
  public final String _arg;       // Plain argument or alias; null if neither
  public final Formals _formals;  // Pattern, or null for a plain argument
  public final AST _body;
  public final Pos _loc;

  public Lambda( String arg, Formals formals, AST body, Pos loc ) {
    assert arg != null || formals != null;
    _arg = arg;  _formals = formals;  _body = body;  _loc = loc;
  }

  // (x: body) or ({ a, b }@x: body)
  @Override public SB str(SB sb) {
    sb.p('(');
    if( _formals != null ) {
      _formals.str(sb);
      if( _arg != null ) sb.p('@').p(_arg);
    } else sb.p(_arg);
    return _body.str(sb.p(": ")).p(')');
  }
}
