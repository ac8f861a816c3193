package com.cliffc.nix.ast;

import com.cliffc.nix.Pos;
import com.cliffc.nix.util.SB;

// Attribute selection: base.name
public class Field extends AST {
  public final AST _base;
  public final String _name;
  public final Pos _loc;
  public Field( AST base, String name, Pos loc ) { _base = base; _name = name; _loc = loc; }

  @Override public SB str(SB sb) {
    if( _base.delimited() ) _base.str(sb);
    else _base.str(sb.p('(')).p(')');
    return sb.p('.').p(_name);
  }
}
