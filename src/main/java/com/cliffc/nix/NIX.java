package com.cliffc.nix;

/** A front end for a lazy build-description language: source text to AST.
 */

public abstract class NIX {
  // Conventional file name loaded when a directory is named
  public static final String DEFAULT_FILE = "default.nix";
  // Symlink chains longer than this are an error
  public static final int MAX_SYMLINKS = 1024;

  public static void main( String[] args ) {
    if( args.length == 0 ) { REPL.go(); return; }
    // Command line program
    for( int i=0; i<args.length; i++ ) {
      Result rez = args[i].equals("-e") && i+1 < args.length
        ? Exec.parse_string(args[++i],"(string)",System.getProperty("user.dir"))
        : Exec.parse_file(args[i]);
      if( rez._err!=null ) System.err.println("error: "+rez._err);
      else System.out.println(rez._ast);
    }
  }

  // Debug printers
  public static boolean DEBUG = false;
  public static <T> T p(T x, String s) {
    if( !NIX.DEBUG ) return x;
    System.err.println(s);
    return x;
  }
}
