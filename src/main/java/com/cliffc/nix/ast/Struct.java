package com.cliffc.nix.ast;

import com.cliffc.nix.Pos;
import com.cliffc.nix.util.SB;

import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/** Attribute set: unique names bound to expressions, sorted by name.  Built
 *  only by {@link Attrs}, which merges dotted paths and inherits and rejects
 *  duplicates. */
public class Struct extends AST {

  // One binding
  public static final class Def {
    public final AST _e;
    public final Pos _loc;         // Where the name was defined
    public final boolean _inherit; // Inherited from the enclosing scope; never sees a 'rec' self
    Def( AST e, Pos loc, boolean inherit ) { _e = e; _loc = loc; _inherit = inherit; }
  }

  public final boolean _rec;
  private final SortedMap<String,Def> _defs;

  Struct( boolean rec, TreeMap<String,Def> defs ) {
    _rec = rec;
    _defs = Collections.unmodifiableSortedMap(defs);
  }

  public SortedMap<String,Def> defs() { return _defs; }
  public Def def( String name ) { return _defs.get(name); }
  public AST get( String name ) { Def d = _defs.get(name); return d==null ? null : d._e; }
  public int len() { return _defs.size(); }

  // rec { x = e; inherit y; }
  @Override public SB str(SB sb) {
    sb.p(_rec ? "rec { " : "{ ");
    for( Map.Entry<String,Def> e : _defs.entrySet() ) {
      Def d = e.getValue();
      if( d._inherit ) sb.p("inherit ").p(e.getKey()).p("; ");
      else d._e.str(sb.p(e.getKey()).p(" = ")).p("; ");
    }
    return sb.p('}');
  }
  @Override boolean delimited() { return false; }
}
