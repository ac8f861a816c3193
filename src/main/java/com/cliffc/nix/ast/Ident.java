package com.cliffc.nix.ast;

import com.cliffc.nix.util.SB;

// Variable reference
public class Ident extends AST {
  public final String _name;
  public Ident( String name ) { _name = name; }
  @Override public SB str(SB sb) { return sb.p(_name); }
}
