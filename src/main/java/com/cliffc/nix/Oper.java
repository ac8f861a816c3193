package com.cliffc.nix;

import com.cliffc.nix.Token.Kind;
import com.cliffc.nix.ast.BinOp;

/** Binary operator precedence and associativity.

Lowest binding first:

   ->          nonassoc   a -> b -> c    is a syntax error
   ||          left
   &&          left
   == !=       nonassoc   a == b == c    is a syntax error
   //          right      a // b // c    is  a // (b // c)
   !           prefix     !a // b        is  (!a) // b  but  !a + b  is  !(a + b)
   +           left
   ++          right      a ++ b ++ c    is  a ++ (b ++ c)
   ?           nonassoc   right hand side is an attribute name, not an expression
   ~           nonassoc

Application (juxtaposition) binds tighter than all of these, and attribute
selection tighter still; neither has an operator token so neither appears here.
 */
public enum Oper {
  IMPL  (Kind.IMPL    , 1,Assoc.NON  ,BinOp.Op.Impl         ),
  OR    (Kind.OR      , 2,Assoc.LEFT ,BinOp.Op.Or           ),
  AND   (Kind.AND     , 3,Assoc.LEFT ,BinOp.Op.And          ),
  EQ    (Kind.EQ      , 4,Assoc.NON  ,BinOp.Op.Eq           ),
  NEQ   (Kind.NEQ     , 4,Assoc.NON  ,BinOp.Op.NEq          ),
  UPDATE(Kind.UPDATE  , 5,Assoc.RIGHT,BinOp.Op.Update       ),
  PLUS  (Kind.PLUS    , 7,Assoc.LEFT ,BinOp.Op.ConcatStrings),
  CONCAT(Kind.CONCAT  , 8,Assoc.RIGHT,BinOp.Op.ConcatLists  ),
  HAS   (Kind.QUESTION, 9,Assoc.NON  ,null                  ), // e ? name
  SUB   (Kind.TILDE   ,10,Assoc.NON  ,BinOp.Op.SubPath      );

  public enum Assoc { LEFT, RIGHT, NON }

  public static final int MIN_PREC = 1;
  public static final int NEG_PREC = 6; // Prefix '!' sits between // and +

  public final Kind _tok;       // Operator token
  public final int _prec;       // Precedence; larger binds tighter
  public final Assoc _assoc;
  public final BinOp.Op _op;    // AST operator built, or null for special forms

  Oper( Kind tok, int prec, Assoc assoc, BinOp.Op op ) { _tok=tok; _prec=prec; _assoc=assoc; _op=op; }

  // Minimum precedence of the right operand
  public int rhs_prec() { return _assoc==Assoc.RIGHT ? _prec : _prec+1; }

  // Lookup the token as a binary operator.  Return null if no match.
  public static Oper bin_op( Kind tok ) {
    for( Oper op : values() )
      if( op._tok==tok ) return op;
    return null;
  }
}
