package com.cliffc.nix;

/** A lexical token: kind, semantic value and the position of its first character. */
public final class Token {
  public enum Kind {
    ID, INT, PATH, URI,
    STR, IND_STR,               // Literal text inside "..." and ''...''
    DQUOTE("\""),               // Opens and closes a plain string
    IND_OPEN("''"), IND_CLOSE("''"),
    DOLLAR_CURLY("${"),         // Opens an interpolation; a plain '}' closes it
    IF("if"), THEN("then"), ELSE("else"), ASSERT("assert"), WITH("with"),
    LET("let"), IN("in"), REC("rec"), INHERIT("inherit"),
    EQ("=="), NEQ("!="), AND("&&"), OR("||"), IMPL("->"), UPDATE("//"), CONCAT("++"),
    ELLIPSIS("..."),
    LBRACE("{"), RBRACE("}"), LBRACK("["), RBRACK("]"), LPAREN("("), RPAREN(")"),
    SEMI(";"), COLON(":"), DOT("."), COMMA(","), ASSIGN("="), AT("@"),
    QUESTION("?"), NOT("!"), PLUS("+"), TILDE("~"),
    EOF;

    public final String _text;  // Fixed spelling, or null for valued tokens
    Kind() { this(null); }
    Kind(String text) { _text=text; }

    // Keyword kinds, indexed by spelling
    static Kind keyword( String s ) {
      return switch( s ) {
      case "if"      -> IF;
      case "then"    -> THEN;
      case "else"    -> ELSE;
      case "assert"  -> ASSERT;
      case "with"    -> WITH;
      case "let"     -> LET;
      case "in"      -> IN;
      case "rec"     -> REC;
      case "inherit" -> INHERIT;
      default        -> null;
      };
    }
  }

  public final Kind _kind;
  public final String _str;     // Identifier, literal text, path or uri; fixed spelling otherwise
  public final long _num;       // Value of an INT
  public final Pos _loc;

  Token( Kind kind, String str, long num, Pos loc ) { _kind=kind; _str=str; _num=num; _loc=loc; }
  Token( Kind kind, Pos loc ) { this(kind,kind._text,0,loc); }

  // Human-readable token for error messages
  public String describe() {
    return switch( _kind ) {
    case ID      -> "identifier '"+_str+"'";
    case INT     -> "integer "+_num;
    case PATH    -> "path '"+_str+"'";
    case URI     -> "uri '"+_str+"'";
    case STR, IND_STR -> "string";
    case EOF     -> "end of file";
    default      -> "'"+_kind._text+"'";
    };
  }

  @Override public String toString() { return _kind+(_str==null ? "" : "("+_str+")")+"@"+_loc; }
}
