package com.cliffc.nix.ast;

import com.cliffc.nix.ErrMsg;
import com.cliffc.nix.Pos;
import com.cliffc.nix.util.Ary;
import com.cliffc.nix.util.SB;

import java.util.HashMap;

/** An attribute-set pattern for a lambda argument: { a, b ? dflt, ... }.
 *  Formal names, plus an optional alias bound by '@', must be unique. */
public class Formals {

  public static final class Formal {
    public final String _name;
    public final AST _dflt;     // Default value, or null if the attribute is required
    public final Pos _loc;
    public Formal( String name, AST dflt, Pos loc ) { _name = name; _dflt = dflt; _loc = loc; }
  }

  private final Formal[] _formals;
  public final boolean _ellipsis; // Extra attributes allowed

  public Formals( Ary<Formal> formals, boolean ellipsis ) {
    _formals = formals.asAry().clone();
    _ellipsis = ellipsis;
  }

  public int len() { return _formals.length; }
  public Formal at( int i ) { return _formals[i]; }
  public Formal find( String name ) {
    for( Formal f : _formals ) if( f._name.equals(name) ) return f;
    return null;
  }

  /** Reject duplicate names.  The alias (null if none) is checked along with
   *  the formals; aliasFirst says which came first in the source, so the
   *  later definition is the one blamed. */
  public Formals check( String alias, Pos aliasLoc, boolean aliasFirst ) {
    HashMap<String,Pos> seen = new HashMap<>();
    if( alias != null && aliasFirst ) seen.put(alias,aliasLoc);
    for( Formal f : _formals ) {
      Pos prior = seen.putIfAbsent(f._name,f._loc);
      if( prior != null ) throw ErrMsg.dup_formal(f._name,f._loc,prior).fail();
    }
    if( alias != null && !aliasFirst ) {
      Pos prior = seen.get(alias);
      if( prior != null ) throw ErrMsg.dup_formal(alias,aliasLoc,prior).fail();
    }
    return this;
  }

  // { a, b ? e, ... }
  public SB str(SB sb) {
    sb.p("{ ");
    for( Formal f : _formals ) {
      sb.p(f._name);
      if( f._dflt != null ) f._dflt.str(sb.p(" ? "));
      sb.p(", ");
    }
    if( _ellipsis ) sb.p("..., ");
    if( _formals.length > 0 || _ellipsis ) sb.unchar(2).s();
    return sb.p('}');
  }
}
