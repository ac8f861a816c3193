package com.cliffc.nix.ast;

import com.cliffc.nix.Pos;
import com.cliffc.nix.util.SB;

// e ? name: does the attribute set e have attribute name
public class HasAttr extends AST {
  public final AST _e;
  public final String _name;
  public final Pos _loc;
  public HasAttr( AST e, String name, Pos loc ) { _e = e; _name = name; _loc = loc; }
  @Override public SB str(SB sb) { return _e.str(sb.p('(')).p(" ? ").p(_name).p(')'); }
}
