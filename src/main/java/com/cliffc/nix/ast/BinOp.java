package com.cliffc.nix.ast;

import com.cliffc.nix.Pos;
import com.cliffc.nix.util.SB;

// Binary operators.  Precedence is resolved by the parser, so the tree shape is the grouping.
public class BinOp extends AST {
  public enum Op {
    Eq("=="), NEq("!="), And("&&"), Or("||"), Impl("->"), Update("//"),
    ConcatStrings("+"), ConcatLists("++"), SubPath("~");
    public final String _str;
    Op(String str) { _str = str; }
  }

  public final Op _op;
  public final AST _lhs, _rhs;
  public final Pos _loc;        // Operator token
  public BinOp( Op op, AST lhs, AST rhs, Pos loc ) { _op = op; _lhs = lhs; _rhs = rhs; _loc = loc; }

  // (lhs op rhs)
  @Override public SB str(SB sb) {
    _lhs.str(sb.p('(')).p(' ').p(_op._str).p(' ');
    return _rhs.str(sb).p(')');
  }
}
