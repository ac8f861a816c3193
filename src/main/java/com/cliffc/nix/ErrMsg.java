package com.cliffc.nix;

import com.cliffc.nix.util.SB;

// Error messages
public class ErrMsg {

  // Error levels
  public enum Level {
    Syntax,                   // Token stream matches no production
    DupAttr,                  // Duplicate attribute in one attribute set literal
    DupFormal,                // Duplicate formal argument in one lambda pattern
    FileSys,                  // Cannot stat, follow or read a source file
  }

  public final Pos _loc;      // Point in code to blame; null if no source position
  public final Pos _prior;    // Earlier definition, for duplicates
  public final String _msg;   // Printable error message, minus code context
  public final Level _lvl;
  public ErrMsg(Pos loc, String msg, Level lvl) { this(loc,null,msg,lvl); }
  public ErrMsg(Pos loc, Pos prior, String msg, Level lvl) { _loc=loc; _prior=prior; _msg=msg; _lvl=lvl; }

  public static ErrMsg syntax(Pos loc, String msg) {
    return new ErrMsg(loc,msg,Level.Syntax);
  }
  public static ErrMsg unexpected(Token tok) {
    return syntax(tok._loc,"syntax error, unexpected "+tok.describe());
  }
  public static ErrMsg dup_attr(String name, Pos loc, Pos prior) {
    return new ErrMsg(loc,prior,"duplicate attribute '"+name+"'",Level.DupAttr);
  }
  public static ErrMsg dup_formal(String name, Pos loc, Pos prior) {
    return new ErrMsg(loc,prior,"duplicate formal function argument '"+name+"'",Level.DupFormal);
  }
  public static ErrMsg filesys(String msg) {
    return new ErrMsg(null,msg,Level.FileSys);
  }

  // Path, line and column of the blamed token; null/0 when there is no position
  public String path() { return _loc==null ? null : _loc._path; }
  public int line() { return _loc==null ? 0 : _loc._line; }
  public int col () { return _loc==null ? 0 : _loc._col ; }

  @Override public String toString() {
    SB sb = new SB().p(_msg);
    if( _loc  !=null ) _loc  .str(sb.p(", at "));
    if( _prior!=null ) _prior.str(sb.p("; previously defined at "));
    return sb.toString();
  }
  // The message, then the blamed line of source text and a caret under the column
  public String errLocMsg( String text ) {
    SB sb = new SB().p(toString()).nl();
    if( _loc==null || text==null || _loc._line < 1 ) return sb.toString();
    String[] lines = text.split("\n",-1);
    if( _loc._line > lines.length ) return sb.toString();
    sb.p(lines[_loc._line-1]).nl();
    for( int i=1; i<_loc._col; i++ ) sb.s();
    return sb.p('^').nl().toString();
  }

  @Override public boolean equals(Object obj) {
    if( this==obj ) return true;
    if( !(obj instanceof ErrMsg err) ) return false;
    return _lvl==err._lvl && _msg.equals(err._msg) &&
      java.util.Objects.equals(_loc,err._loc) && java.util.Objects.equals(_prior,err._prior);
  }
  @Override public int hashCode() {
    return (_loc==null ? 0 : _loc.hashCode())+_msg.hashCode()+_lvl.hashCode();
  }

  /** Thrown to abandon a parse on the first error; the entry points catch it
   *  and hand the ErrMsg back to the caller. */
  public static class Fail extends RuntimeException {
    public final ErrMsg _err;
    public Fail(ErrMsg err) { super(err.toString(),null,false,false); _err=err; }
  }
  public Fail fail() { return new Fail(this); }
}
