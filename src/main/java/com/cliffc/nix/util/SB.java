package com.cliffc.nix.util;

/** Tight/tiny StringBuilder wrapper.
 *  Short short names on purpose; so they don't obscure the printing. */
public final class SB {
  public final StringBuilder _sb;
  public SB(        ) { _sb = new StringBuilder( ); }
  public SB p( String s ) { _sb.append(s); return this; }
  public SB p( char   s ) { _sb.append(s); return this; }
  public SB p( int    s ) { _sb.append(s); return this; }
  public SB p( long   s ) { _sb.append(s); return this; }
  public SB s() { _sb.append(' '); return this; }

  // Append string contents escaped for use between double quotes
  public SB pesc( String s ) {
    for( int i=0; i<s.length(); i++ ) {
      char c = s.charAt(i);
      switch( c ) {
      case '"'  -> _sb.append("\\\"");
      case '\\' -> _sb.append("\\\\");
      case '\n' -> _sb.append("\\n");
      case '\r' -> _sb.append("\\r");
      case '\t' -> _sb.append("\\t");
      case '$'  -> _sb.append(i+1 < s.length() && s.charAt(i+1)=='{' ? "\\$" : "$");
      default   -> _sb.append(c);
      }
    }
    return this;
  }

  public SB nl( ) { return p('\n'); }

  // Remove last character(s)
  public SB unchar(int x) { _sb.setLength(_sb.length()-x); return this; }

  @Override public String toString() { return _sb.toString(); }
}
