package com.cliffc.nix.ast;

import com.cliffc.nix.util.Ary;
import com.cliffc.nix.util.SB;

// List literal: [ e0 e1 ... ]
public class Lst extends AST {
  private final AST[] _elems;
  public Lst( Ary<AST> elems ) { _elems = elems.asAry().clone(); }

  public int len() { return _elems.length; }
  public AST at( int i ) { return _elems[i]; }

  @Override public SB str(SB sb) {
    sb.p('[');
    for( AST e : _elems ) e.str(sb.s());
    return sb.p(" ]");
  }
}
