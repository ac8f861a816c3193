package com.cliffc.nix;

import com.cliffc.nix.util.SB;
import org.jetbrains.annotations.NotNull;

/** A source position: the logical path label plus a 1-based line and column.
 *  Used to blame errors and carried by the AST nodes that need diagnostics. */
public final class Pos {
  public final String _path;    // Source label for error messages; usually a file name
  public final int _line, _col; // 1-based

  public Pos( @NotNull String path, int line, int col ) { _path=path; _line=line; _col=col; }

  public SB str(SB sb) { return sb.p(_path).p(':').p(_line).p(':').p(_col); }
  @Override public String toString() { return str(new SB()).toString(); }

  @Override public boolean equals(Object o) {
    if( this==o ) return true;
    if( !(o instanceof Pos p) ) return false;
    return _line==p._line && _col==p._col && _path.equals(p._path);
  }
  @Override public int hashCode() { return _path.hashCode()+(_line<<10)+_col; }
}
