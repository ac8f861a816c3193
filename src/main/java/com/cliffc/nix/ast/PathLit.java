package com.cliffc.nix.ast;

import com.cliffc.nix.util.SB;

// Path literal, already made absolute against the parse base directory
public class PathLit extends AST {
  public final String _path;
  public PathLit( String path ) { _path = path; }
  @Override public SB str(SB sb) { return sb.p(_path); }
  @Override boolean delimited() { return false; }
}
