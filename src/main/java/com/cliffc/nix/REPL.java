package com.cliffc.nix;

import java.util.Scanner;

/** Read a line, parse it as an expression, print the tree or the error. */
public abstract class REPL {
  public static final String prompt="nix> ";
  public static final String SRC="(stdin)";

  public static void go( ) {
    init();
    Scanner stdin = new Scanner(System.in);
    while( stdin.hasNextLine() )
      go_one(stdin.nextLine());
  }

  static void init() {
    System.out.print(prompt);
    System.out.flush();
  }

  static void go_one( String line ) {
    if( !line.isBlank() ) {
      Result rez = Exec.parse_string(line,SRC,System.getProperty("user.dir"));
      if( rez._err == null ) System.out.println(rez._ast);
      else System.out.print("error: "+rez._err.errLocMsg(line));
    }
    System.out.print(prompt);
    System.out.flush();
  }

}
