package com.cliffc.nix;

import com.cliffc.nix.Token.Kind;
import com.cliffc.nix.util.Ary;

/** Turns source text into a token stream.  Plain strings, indented strings
 *  and interpolations are lexed in separate modes kept on a stack: a '{' or
 *  '${' pushes normal mode and the matching '}' pops back to whatever mode
 *  was active before, possibly the middle of a string.
 */
public class Lexer {
  private enum Mode { NORMAL, STRING, IND_STRING }

  private final String _path;   // Source label for positions
  private final String _buf;    // Text being lexed
  private int _x;               // Lexer index
  private int _line, _col;      // 1-based position of _x
  private final Ary<Mode> _modes = new Ary<>(Mode.class);

  public Lexer( String path, String text ) {
    _path = path;
    _buf  = text;
    _x    = 0;
    _line = 1;
    _col  = 1;
    _modes.push(Mode.NORMAL);
  }

  // Handy for the debugger to print
  @Override public String toString() { return _buf.substring(_x); }

  /** Lex the whole text; the last token is always EOF. */
  public Ary<Token> lex() {
    Ary<Token> toks = new Ary<>(Token.class);
    while( true ) {
      Token tok = switch( _modes.last() ) {
      case NORMAL     -> normal();
      case STRING     -> string();
      case IND_STRING -> ind_string();
      };
      toks.push(tok);
      if( tok._kind == Kind.EOF ) return toks;
    }
  }

  private Pos pos() { return new Pos(_path,_line,_col); }

  // ------------ NORMAL MODE -----------------------------------------------

  private Token normal() {
    skipWS();
    Pos loc = pos();
    if( _x >= _buf.length() ) return new Token(Kind.EOF,loc);
    char c = _buf.charAt(_x);

    // Indented string open swallows trailing spaces and a single newline
    if( peek("''") ) {
      int x = _x;
      while( x < _buf.length() && _buf.charAt(x)==' ' ) x++;
      if( x < _buf.length() && _buf.charAt(x)=='\n' ) skip(x+1-_x);
      _modes.push(Mode.IND_STRING);
      return new Token(Kind.IND_OPEN,loc);
    }
    if( c=='"' ) { skip(1); _modes.push(Mode.STRING); return new Token(Kind.DQUOTE,loc); }
    if( peek("${") ) { _modes.push(Mode.NORMAL); return new Token(Kind.DOLLAR_CURLY,loc); }

    // Longest match amongst the valued tokens; ties go to id/int, then path, then uri
    int lid = match_id(), lint = match_int(), lpath = match_path(), luri = match_uri();
    int len = Math.max(Math.max(lid,lint),Math.max(lpath,luri));
    if( len > 0 ) {
      String s = _buf.substring(_x,_x+len);
      skip(len);
      if( len==lid ) {
        Kind kw = Kind.keyword(s);
        return kw==null ? new Token(Kind.ID,s,0,loc) : new Token(kw,loc);
      }
      if( len==lint ) {
        try { return new Token(Kind.INT,s,Long.parseLong(s),loc); }
        catch( NumberFormatException e ) { throw ErrMsg.syntax(loc,"invalid integer '"+s+"'").fail(); }
      }
      if( len==lpath ) return new Token(Kind.PATH,s,0,loc);
      return new Token(Kind.URI,s,0,loc);
    }

    // Operators, longest first
    for( Kind k : OPS )
      if( peek(k._text) ) {
        if( k==Kind.LBRACE ) _modes.push(Mode.NORMAL);
        if( k==Kind.RBRACE && _modes.len() > 1 ) _modes.pop();
        return new Token(k,loc);
      }
    throw ErrMsg.syntax(loc,"syntax error, unexpected character '"+c+"'").fail();
  }
  private static final Kind[] OPS = {
    Kind.ELLIPSIS,
    Kind.EQ, Kind.NEQ, Kind.AND, Kind.OR, Kind.IMPL, Kind.UPDATE, Kind.CONCAT,
    Kind.LBRACE, Kind.RBRACE, Kind.LBRACK, Kind.RBRACK, Kind.LPAREN, Kind.RPAREN,
    Kind.SEMI, Kind.COLON, Kind.DOT, Kind.COMMA, Kind.ASSIGN, Kind.AT,
    Kind.QUESTION, Kind.NOT, Kind.PLUS, Kind.TILDE,
  };

  // id = [a-zA-Z_][a-zA-Z0-9_'-]*
  private int match_id() {
    if( !isAlpha0(at(_x)) ) return 0;
    int x = _x+1;
    while( isAlpha1(at(x)) ) x++;
    return x-_x;
  }
  // int = [0-9]+
  private int match_int() {
    int x = _x;
    while( isDigit(at(x)) ) x++;
    return x-_x;
  }
  // path = [pc]*(/[pc]+)+
  private int match_path() {
    int x = _x;
    while( isPath(at(x)) ) x++;
    int end = -1;
    while( at(x)=='/' && isPath(at(x+1)) ) {
      x++;
      while( isPath(at(x)) ) x++;
      end = x;
    }
    return end==-1 ? 0 : end-_x;
  }
  // uri = [a-zA-Z][a-zA-Z0-9+.-]*:[uc]+
  private int match_uri() {
    if( !isLetter(at(_x)) ) return 0;
    int x = _x+1;
    while( isLetter(at(x)) || isDigit(at(x)) || "+-.".indexOf(at(x)) >= 0 ) x++;
    if( at(x) != ':' || !isUri(at(x+1)) ) return 0;
    x++;
    while( isUri(at(x)) ) x++;
    return x-_x;
  }

  // ------------ STRING MODES -----------------------------------------------

  // Inside "...": literal text up to the close quote or an interpolation
  private Token string() {
    Pos loc = pos();
    if( peek("\"") ) { _modes.pop(); return new Token(Kind.DQUOTE,loc); }
    if( peek("${") ) { _modes.push(Mode.NORMAL); return new Token(Kind.DOLLAR_CURLY,loc); }
    StringBuilder sb = new StringBuilder();
    while( true ) {
      if( _x >= _buf.length() ) throw ErrMsg.syntax(loc,"syntax error, unterminated string").fail();
      char c = _buf.charAt(_x);
      if( c=='"' || (c=='$' && at(_x+1)=='{') ) break;
      if( c=='\\' ) {
        if( _x+1 >= _buf.length() ) throw ErrMsg.syntax(loc,"syntax error, unterminated string").fail();
        sb.append(unescape(_buf.charAt(_x+1)));
        skip(2);
      } else {
        sb.append(c);
        skip(1);
      }
    }
    return new Token(Kind.STR,sb.toString(),0,loc);
  }

  // Inside ''...'': literal text up to the close or an interpolation
  private Token ind_string() {
    Pos loc = pos();
    if( peek("${") ) { _modes.push(Mode.NORMAL); return new Token(Kind.DOLLAR_CURLY,loc); }
    if( _buf.startsWith("''",_x) && !is_ind_escape(_x) ) {
      skip(2);
      _modes.pop();
      return new Token(Kind.IND_CLOSE,loc);
    }
    StringBuilder sb = new StringBuilder();
    while( true ) {
      if( _x >= _buf.length() ) throw ErrMsg.syntax(loc,"syntax error, unterminated indented string").fail();
      if( _buf.startsWith("${",_x) ) break;
      if( _buf.startsWith("''",_x) ) {
        if( !is_ind_escape(_x) ) break;
        char c = _buf.charAt(_x+2);
        if( c=='$' ) { sb.append('$');  skip(3); }
        else if( c=='\'' ) { sb.append("''"); skip(3); }
        else { sb.append(unescape(_buf.charAt(_x+3))); skip(4); }
      } else {
        sb.append(_buf.charAt(_x));
        skip(1);
      }
    }
    return new Token(Kind.IND_STR,sb.toString(),0,loc);
  }
  // At "''": is this an escape ''$ ''' or ''\c, rather than the close?
  private boolean is_ind_escape( int x ) {
    char c = at(x+2);
    return c=='$' || c=='\'' || (c=='\\' && x+3 < _buf.length());
  }

  private static char unescape( char c ) {
    return switch( c ) {
    case 'n' -> '\n';
    case 'r' -> '\r';
    case 't' -> '\t';
    default  -> c;
    };
  }

  // ------------ CHARACTERS -----------------------------------------------

  // Character at x, or 0 past the end
  private char at( int x ) { return x < _buf.length() ? _buf.charAt(x) : 0; }

  // Advance, tracking line and column
  private void skip( int n ) {
    for( int i=0; i<n; i++ ) {
      if( _buf.charAt(_x++)=='\n' ) { _line++; _col=1; }
      else _col++;
    }
  }
  // Skip and return true if the text matches at _x
  private boolean peek( String s ) {
    if( !_buf.startsWith(s,_x) ) return false;
    skip(s.length());
    return true;
  }

  /** Advance to the first non-whitespace, non-comment character. */
  private void skipWS() {
    while( _x < _buf.length() ) {
      char c = _buf.charAt(_x);
      if( c=='#' ) { while( _x < _buf.length() && _buf.charAt(_x) != '\n' ) skip(1); continue; }
      if( c=='/' && at(_x+1)=='*' ) { skipBlock(); continue; }
      if( !isWS(c) ) return;
      skip(1);
    }
  }
  private void skipBlock() {
    Pos loc = pos();
    int end = _buf.indexOf("*/",_x+2);
    if( end == -1 ) throw ErrMsg.syntax(loc,"syntax error, unterminated comment").fail();
    skip(end+2-_x);
  }

  /** Return true if `c` passes a test */
  private static boolean isWS    (char c) { return c == ' ' || c == '\t' || c == '\n' || c == '\r'; }
  private static boolean isLetter(char c) { return ('a'<=c && c <= 'z') || ('A'<=c && c <= 'Z'); }
  private static boolean isAlpha0(char c) { return isLetter(c) || c=='_'; }
  private static boolean isAlpha1(char c) { return isAlpha0(c) || isDigit(c) || c=='\'' || c=='-'; }
  private static boolean isPath  (char c) { return isLetter(c) || isDigit(c) || "._-+".indexOf(c) >= 0; }
  private static boolean isUri   (char c) { return isLetter(c) || isDigit(c) || "%/?:@&=+$,-_.!~*'".indexOf(c) >= 0; }
  public  static boolean isDigit (char c) { return '0' <= c && c <= '9'; }
}
