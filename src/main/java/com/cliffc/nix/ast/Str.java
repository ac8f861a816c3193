package com.cliffc.nix.ast;

import com.cliffc.nix.util.Ary;
import com.cliffc.nix.util.SB;

/** String literal, possibly with interpolated expressions.  A Str with a
 *  single literal part is a plain constant string; anything else is the
 *  in-order concatenation of its parts. */
public class Str extends AST {

  /** One piece of a string: literal text or an interpolated expression, never both. */
  public static final class Part {
    public final String _lit;
    public final AST _e;
    private Part( String lit, AST e ) { _lit = lit; _e = e; }
    public static Part lit ( String s ) { return new Part(s,null); }
    public static Part expr( AST e ) { return new Part(null,e); }
    public boolean is_lit() { return _lit != null; }
  }

  private final Part[] _parts;
  public Str( Ary<Part> parts ) { _parts = parts.asAry().clone(); }
  public static Str con( String s ) { return new Str(new Ary<>(new Part[]{Part.lit(s)})); }

  public int len() { return _parts.length; }
  public Part at( int i ) { return _parts[i]; }
  // The constant value, or null if not a constant
  public String con() { return _parts.length==1 && _parts[0].is_lit() ? _parts[0]._lit : null; }

  // "text${expr}text"
  @Override public SB str(SB sb) {
    sb.p('"');
    for( Part p : _parts )
      if( p.is_lit() ) sb.pesc(p._lit);
      else p._e.str(sb.p("${")).p('}');
    return sb.p('"');
  }
}
