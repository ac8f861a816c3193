package com.cliffc.nix.ast;

import com.cliffc.nix.util.SB;

/** Abstract Syntax Tree.  A closed set of node kinds, all in this package;
 *  every node is immutable once built.  Consumers dispatch with
 *  {@code instanceof} patterns.
 */
public abstract class AST {
  // Package-private: no node kinds outside this package
  AST() { }

  // Default toString
  @Override public final String toString() {  return str(new SB()).toString();  }

  // Everybody has to have a pretty print.  Compound forms print their own
  // surrounding parens, so the printed form shows the parsed grouping.
  abstract public SB str(SB sb);

  // True if str() output can be followed by ".attr" without parens
  boolean delimited() { return true; }
}
