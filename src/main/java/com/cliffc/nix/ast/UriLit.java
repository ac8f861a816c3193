package com.cliffc.nix.ast;

import com.cliffc.nix.util.SB;

// URI literal; just a string with no quotes
public class UriLit extends AST {
  public final String _uri;
  public UriLit( String uri ) { _uri = uri; }
  @Override public SB str(SB sb) { return sb.p(_uri); }
  @Override boolean delimited() { return false; }
}
