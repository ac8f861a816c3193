package com.cliffc.nix;

import com.cliffc.nix.ast.AST;

// Outcome of one parse: exactly one of an AST root or an error
public class Result {
  public final AST _ast;
  public final ErrMsg _err;
  Result( AST ast, ErrMsg err ) {
    assert (ast==null) != (err==null);
    _ast = ast;
    _err = err;
  }
  @Override public String toString() { return _err==null ? _ast.toString() : _err.toString(); }
}
