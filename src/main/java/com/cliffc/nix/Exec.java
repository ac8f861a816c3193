package com.cliffc.nix;

import java.io.IOException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;

import static com.cliffc.nix.NIX.*;

/** Entry points: parse program text, or parse a file found by following
 *  symlinks and directory defaults.  Both end in the same text parse.
 */
public abstract class Exec {

  /** Parse text.  The path is only a label for error messages; the base
   *  directory anchors relative path literals. */
  public static Result parse_string( String text, String path, String base ) {
    try {
      return new Parse(path,abs(base).toString(),text).prog();
    } catch( ErrMsg.Fail f ) {
      return new Result(null,f._err);
    }
  }

  public static Result parse_file( String path ) { return parse_file(FileSys.LOCAL,path); }

  /** Parse a file.  Symlinks are followed one hop at a time, relative
   *  targets resolving against the link's directory, so that relative path
   *  literals in the file are relative to where the file really lives.  A
   *  directory means its default file. */
  public static Result parse_file( FileSys fs, String path ) {
    try {
      Path p = abs(path);
      FileSys.Kind kind;
      int hops = 0;
      while( (kind = lstat(fs,p)) == FileSys.Kind.Symlink ) {
        if( hops++ >= MAX_SYMLINKS )
          return new Result(null,ErrMsg.filesys("too many levels of symbolic links resolving '"+path+"'"));
        Path target = p.resolveSibling(abs_link(read_link(fs,p))).normalize();
        p = NIX.p(target,"following symlink "+p+" to "+target);
      }
      if( kind == FileSys.Kind.Dir ) p = p.resolve(DEFAULT_FILE);
      String text = read(fs,p);
      Path dir = p.getParent();
      return new Parse(p.toString(),(dir==null ? p : dir).toString(),text).prog();
    } catch( ErrMsg.Fail f ) {
      return new Result(null,f._err);
    }
  }

  private static FileSys.Kind lstat( FileSys fs, Path p ) {
    try { return fs.lstat(p.toString()); }
    catch( IOException e ) { throw ErrMsg.filesys("getting status of '"+p+"': "+reason(e)).fail(); }
  }
  private static String read_link( FileSys fs, Path p ) {
    try { return fs.read_link(p.toString()); }
    catch( IOException e ) { throw ErrMsg.filesys("reading symbolic link '"+p+"': "+reason(e)).fail(); }
  }
  private static String read( FileSys fs, Path p ) {
    try { return fs.read_file(p.toString()); }
    catch( IOException e ) { throw ErrMsg.filesys("reading file '"+p+"': "+reason(e)).fail(); }
  }
  private static String reason( IOException e ) {
    String msg = e.getMessage();
    return e.getClass().getSimpleName()+(msg==null ? "" : " "+msg);
  }

  // Malformed paths (e.g. holding a NUL) are filesystem errors
  private static Path abs( String path ) {
    try { return Paths.get(path).toAbsolutePath().normalize(); }
    catch( InvalidPathException e ) { throw ErrMsg.filesys("invalid path '"+path+"': "+e.getReason()).fail(); }
  }
  private static Path abs_link( String target ) {
    try { return Paths.get(target); }
    catch( InvalidPathException e ) { throw ErrMsg.filesys("invalid symbolic link target '"+target+"': "+e.getReason()).fail(); }
  }
}
