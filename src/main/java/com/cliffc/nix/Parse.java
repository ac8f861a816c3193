package com.cliffc.nix;

import com.cliffc.nix.Token.Kind;
import com.cliffc.nix.ast.*;
import com.cliffc.nix.util.Ary;

import java.nio.file.Paths;

/*** Parser for the build-description language.
 *
 *  GRAMMAR:
 *  prog = expr END
 *  expr = id : expr                      // Lambda, plain argument
 *  expr = { formals } [@ id] : expr      // Lambda, attribute-set pattern
 *  expr = id @ { formals } : expr        // Lambda, alias first
 *  expr = assert expr ; expr
 *  expr = with expr ; expr               // Attributes of the first expr are in scope
 *  expr = let binds in expr              // Sugar for (rec { binds; <let-body> = expr; }).<let-body>
 *  expr = ifex
 *  ifex = if expr then expr else expr | opex
 *  opex = ! opex | opex binop opex | opex ? id | apply  // See Oper for precedence
 *  apply= sel+                           // Application-as-adjacent; left assoc
 *  sel  = fact [. id]*                   // Attribute selection
 *  fact = id | int | path | uri | str | istr | ( expr )
 *  fact = [rec] { binds }                // Attribute set
 *  fact = let { binds }                  // Legacy let; sugar for (rec { binds }).body
 *  fact = [ sel* ]                       // List; elements are sel, so [ f x ] is two elements
 *  binds= [attrpath = expr ; | inherit [( expr )] id* ;]*
 *  attrpath = id [. id]*                 // a.b.c = e  is  a = { b = { c = e; }; }
 *  formals = empty | ... | formal [, formal]* [, ...]
 *  formal = id [? expr]                  // Optional default
 *  str  = " [text | ${ expr }]* "
 *  istr = '' [text | ${ expr }]* ''      // Common indentation stripped
 *
 *  Ambiguities, resolved by looking ahead at most 3 tokens:
 *    '{' starts formals for "{ }" followed by ':' or '@', for "{ ...", and
 *        for "{ id" followed by ',' '?' or '}'; otherwise an attribute set.
 *    "id :" is a lambda and "id @" an aliased pattern; otherwise id is a fact.
 *    "let {" is the legacy let; otherwise a let-in.
 *    Application consumes every following token that can start a sel.
 *
 *  Parsing stops at the first error; there is no recovery and no partial tree.
 */

public class Parse {
  public static final String LET_BODY = "<let-body>"; // Not a valid id, cannot collide
  public static final int MAX_DEPTH = 600;  // Nested expr, opex and fact calls


  private final String _path;   // Source label for error messages; usually a file name
  private final String _base;   // Directory for relative path literals
  private final String _text;   // Program source
  private Token[] _toks;        // Tokens being parsed
  private int _x;               // Parser index
  private int _depth;           // Current recursion depth

  public Parse( String path, String base, String text ) {
    _path = path;
    _base = base;
    _text = text;
  }

  // Handy for the debugger to print
  @Override public String toString() { return _toks==null ? _text : _toks[_x].toString(); }

  /** Parse a top-level:
   *  prog = expr END */
  public Result prog() {
    try {
      _toks = new Lexer(_path,_text).lex().asAry();
      _x = 0;
      _depth = 0;
      AST rez = expr();
      if( tok()._kind != Kind.EOF ) throw unexpected();
      return new Result(rez,null);
    } catch( ErrMsg.Fail f ) {
      return new Result(null,f._err);
    }
  }

  /** expr = function | assert | with | let-in | ifex */
  private AST expr() {
    deeper();
    AST e = expr0();
    _depth--;
    return e;
  }
  private AST expr0() {
    Token t = tok();
    switch( t._kind ) {
    case ID:
      if( peek(1)==Kind.COLON ) {           // x: body
        _x += 2;
        return new Lambda(t._str,null,expr(),t._loc);
      }
      if( peek(1)==Kind.AT ) {              // x @ { formals }: body
        _x += 2;
        require(Kind.LBRACE);
        Formals fs = formals().check(t._str,t._loc,true);
        require(Kind.RBRACE);
        require(Kind.COLON);
        return new Lambda(t._str,fs,expr(),t._loc);
      }
      break;
    case LBRACE:
      if( is_formals() ) {                  // { formals } [@ x]: body
        _x++;
        Formals fs = formals();
        require(Kind.RBRACE);
        Token alias = null;
        if( peek(Kind.AT) ) alias = require(Kind.ID);
        require(Kind.COLON);
        fs.check(alias==null ? null : alias._str, alias==null ? null : alias._loc, false);
        return new Lambda(alias==null ? null : alias._str,fs,expr(),t._loc);
      }
      break;
    case ASSERT: {
      _x++;
      AST cond = expr();
      require(Kind.SEMI);
      return new Assert(cond,expr(),t._loc);
    }
    case WITH: {
      _x++;
      AST scope = expr();
      require(Kind.SEMI);
      return new With(scope,expr(),t._loc);
    }
    case LET: {
      if( peek(1)==Kind.LBRACE ) break;     // Legacy let { }, a fact
      _x++;
      Attrs binds = binds(Kind.IN);
      require(Kind.IN);
      binds.add(LET_BODY,expr(),t._loc);
      return new Field(binds.build(true),LET_BODY,t._loc);
    }
    default:
      break;
    }
    return ifex();
  }

  // At '{': formals or an attribute set?
  private boolean is_formals() {
    return switch( peek(1) ) {
    case RBRACE   -> peek(2)==Kind.COLON || peek(2)==Kind.AT;
    case ELLIPSIS -> true;
    case ID       -> peek(2)==Kind.COMMA || peek(2)==Kind.QUESTION || peek(2)==Kind.RBRACE;
    default       -> false;
    };
  }

  /** formals = empty | ... | formal [, formal]* [, ...]
   *  formal = id [? expr] */
  private Formals formals() {
    Ary<Formals.Formal> fs = new Ary<>(Formals.Formal.class);
    boolean ellipsis = false;
    while( tok()._kind != Kind.RBRACE ) {
      if( peek(Kind.ELLIPSIS) ) { ellipsis = true; break; }
      Token id = require(Kind.ID);
      AST dflt = peek(Kind.QUESTION) ? expr() : null;
      fs.push(new Formals.Formal(id._str,dflt,id._loc));
      if( !peek(Kind.COMMA) ) break;
    }
    return new Formals(fs,ellipsis);
  }

  /** ifex = if expr then expr else expr | opex */
  private AST ifex() {
    if( !peek(Kind.IF) ) return opex(Oper.MIN_PREC);
    AST pred = expr();
    require(Kind.THEN);
    AST t = expr();
    require(Kind.ELSE);
    return new Iff(pred,t,expr());
  }

  /** Precedence climbing over the Oper table.  Parses an operand, then
   *  folds in binary operators binding at least as tight as prec.  Left
   *  associative operators parse their right side one level tighter, right
   *  associative ones at the same level.  A non-associative operator may not
   *  be directly followed by another at its own level.
   *    opex = ! opex
   *    opex = apply [binop opex]*
   */
  private AST opex( int prec ) {
    deeper();
    AST e = opex0(prec);
    _depth--;
    return e;
  }
  private AST opex0( int prec ) {
    Token t = tok();
    AST lhs;
    if( peek(Kind.NOT) ) lhs = new Not(opex(Oper.NEG_PREC+1),t._loc);
    else if( (lhs = apply()) == null ) throw unexpected();
    int nonassoc = -1;          // Level of a just-folded nonassoc operator
    while( true ) {
      Token optok = tok();
      Oper op = Oper.bin_op(optok._kind);
      if( op == null || op._prec < prec ) return lhs;
      if( op._prec == nonassoc ) throw unexpected();
      _x++;
      if( op == Oper.HAS ) lhs = new HasAttr(lhs,require(Kind.ID)._str,optok._loc);
      else lhs = new BinOp(op._op,lhs,opex(op.rhs_prec()),optok._loc);
      nonassoc = op._assoc==Oper.Assoc.NON ? op._prec : -1;
    }
  }

  /** Function application by juxtaposition: take every following sel.
   *  apply = sel+ */
  private AST apply() {
    AST fun = sel();
    if( fun == null ) return null;
    while( starts_sel() )
      fun = new Call(fun,sel());
    return fun;
  }

  // Can the current token start a sel?
  private boolean starts_sel() {
    return switch( tok()._kind ) {
    case ID, INT, PATH, URI, DQUOTE, IND_OPEN, LPAREN, LBRACE, LBRACK, REC -> true;
    case LET -> peek(1)==Kind.LBRACE;
    default -> false;
    };
  }

  /** sel = fact [. id]* */
  private AST sel() {
    AST e = fact();
    if( e == null ) return null;
    while( peek(Kind.DOT) ) {
      Token id = require(Kind.ID);
      e = new Field(e,id._str,id._loc);
    }
    return e;
  }

  /** Parse a factor, a leaf grammar token, or a bracketed form.  Returns null
   *  if the current token cannot start a factor. */
  private AST fact() {
    deeper();
    AST e = fact0();
    _depth--;
    return e;
  }
  private AST fact0() {
    Token t = tok();
    switch( t._kind ) {
    case ID:   _x++; return new Ident(t._str);
    case INT:  _x++; return new Const(t._num);
    case URI:  _x++; return new UriLit(t._str);
    case PATH: _x++; return new PathLit(abs_path(t._str));
    case DQUOTE:   _x++; return str();
    case IND_OPEN: _x++; return Indent.strip(str_parts(Kind.IND_STR,Kind.IND_CLOSE));
    case LPAREN: {
      _x++;
      AST e = expr();
      require(Kind.RPAREN);
      return e;
    }
    case REC:
      _x++;
      require(Kind.LBRACE);
      return struct(true);
    case LBRACE:
      _x++;
      return struct(false);
    case LET:                   // let { binds }, the value of the body attribute
      if( peek(1)!=Kind.LBRACE ) return null;
      _x += 2;
      return new Field(struct(true),"body",t._loc);
    case LBRACK: {
      _x++;
      Ary<AST> es = new Ary<>(AST.class);
      while( !peek(Kind.RBRACK) ) {
        AST e = sel();
        if( e == null ) throw unexpected();
        es.push(e);
      }
      return new Lst(es);
    }
    default:
      return null;
    }
  }

  // Past the '{'; binds and the closing '}'
  private Struct struct( boolean rec ) {
    Attrs binds = binds(Kind.RBRACE);
    require(Kind.RBRACE);
    return binds.build(rec);
  }

  /** Bindings up to (not including) the end token.  Duplicates are caught
   *  as each binding is added.
   *  binds = [attrpath = expr ; | inherit [( expr )] id* ;]* */
  private Attrs binds( Kind end ) {
    Attrs attrs = new Attrs();
    while( tok()._kind != end ) {
      Token t = tok();
      if( peek(Kind.INHERIT) ) {
        AST src = null;
        if( peek(Kind.LPAREN) ) {
          src = expr();
          require(Kind.RPAREN);
        }
        while( tok()._kind == Kind.ID ) {
          Token id = tok();
          _x++;
          if( src == null ) attrs.inherit(id._str,id._loc);
          else attrs.inherit(src,id._str,id._loc);
        }
        require(Kind.SEMI);
      } else if( t._kind == Kind.ID ) {
        Ary<String> path = new Ary<>(String.class);
        path.push(require(Kind.ID)._str);
        while( peek(Kind.DOT) ) path.push(require(Kind.ID)._str);
        require(Kind.ASSIGN);
        attrs.add(path,expr(),t._loc);
        require(Kind.SEMI);
      } else throw unexpected();
    }
    return attrs;
  }

  // Past the opening quote
  private AST str() {
    Ary<Str.Part> parts = str_parts(Kind.STR,Kind.DQUOTE);
    return parts.isEmpty() ? Str.con("") : new Str(parts);
  }

  // Literal text and interpolations up to and including the close token
  private Ary<Str.Part> str_parts( Kind text, Kind close ) {
    Ary<Str.Part> parts = new Ary<>(Str.Part.class);
    while( !peek(close) ) {
      Token t = tok();
      if( t._kind == text ) { _x++; parts.push(Str.Part.lit(t._str)); }
      else if( peek(Kind.DOLLAR_CURLY) ) {
        parts.push(Str.Part.expr(expr()));
        require(Kind.RBRACE);
      } else throw unexpected();
    }
    return parts;
  }

  // Relative paths are relative to the base directory.  No symlink resolution.
  private String abs_path( String p ) {
    return Paths.get(_base).resolve(p).normalize().toString();
  }

  // ------------ TOKENS -----------------------------------------------

  private Token tok() { return _toks[_x]; }
  // Kind of the token n ahead; EOF past the end
  private Kind peek( int n ) { return _x+n < _toks.length ? _toks[_x+n]._kind : Kind.EOF; }
  // Skip and return true if the current token is a k
  private boolean peek( Kind k ) {
    if( tok()._kind != k ) return false;
    _x++;
    return true;
  }
  // Require a token of kind k, or a syntax error
  private Token require( Kind k ) {
    Token t = tok();
    if( t._kind != k ) throw unexpected();
    _x++;
    return t;
  }

  // Recursion guard; nesting past MAX_DEPTH is a syntax error rather than a stack overflow
  private void deeper() {
    if( ++_depth > MAX_DEPTH )
      throw ErrMsg.syntax(tok()._loc,"syntax error, expression nested too deeply").fail();
  }

  private ErrMsg.Fail unexpected() { return ErrMsg.unexpected(tok()).fail(); }
}
