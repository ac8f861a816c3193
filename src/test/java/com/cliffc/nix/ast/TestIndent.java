package com.cliffc.nix.ast;

import com.cliffc.nix.ErrMsg;
import com.cliffc.nix.Exec;
import com.cliffc.nix.Result;
import com.cliffc.nix.util.Ary;
import org.junit.Test;

import static org.junit.Assert.*;

public class TestIndent {

  // Common indentation goes, relative indentation stays
  @Test public void testIndent00() {
    test("''\n  a\n  b\n''", "\"a\\nb\\n\"");
    test("''\n  a\n    b\n  ''", "\"a\\n  b\\n\"");
    test("''\n    a\n  b\n''", "\"  a\\nb\\n\"");
    test("''abc''", "\"abc\"");
    test("''''", "\"\"");
    test("''   \n  a''", "\"a\"");
    test("''  a''", "\"a\"");
  }

  // Blank and space-only lines have no say in the indentation
  @Test public void testIndent01() {
    test("''\n  a\n\n  b\n''", "\"a\\n\\nb\\n\"");
    test("''\n  a\n \n  b\n''", "\"a\\n\\nb\\n\"");
    test("''\n  a\n      \n  b\n''", "\"a\\n    \\nb\\n\"");
  }

  // Interpolations are content, and end the indentation of their line
  @Test public void testIndent02() {
    test("''\n  x ${y}\n  z''", "\"x ${y}\\nz\"");
    test("''\n  ${a}\n    b\n''", "\"${a}\\n  b\\n\"");
    test("''\n    a\n  ${b}''", "\"  a\\n${b}\"");
    test("''${a}''", "\"${a}\"");
    Str s = (Str)parse("''${a}''");
    assertEquals(1, s.len());
    assertNull(s.con());
    assertEquals("a", ((Ident)s.at(0)._e)._name);
  }

  // Escapes, and an unterminated string
  @Test public void testIndent03() {
    test("''a''${b} '''c''\\n''", "\"a\\${b} ''c\\n\"");
    Result rez = Exec.parse_string("''abc","test","/base");
    assertEquals(ErrMsg.Level.Syntax, rez._err._lvl);
    assertEquals("syntax error, unterminated indented string", rez._err._msg);
    assertEquals(3, rez._err.col());
  }

  // The stripper directly, without the parser
  @Test public void testIndent04() {
    Ary<Str.Part> parts = new Ary<>(Str.Part.class);
    parts.push(Str.Part.lit("   a\n "));
    parts.push(Str.Part.expr(new Ident("x")));
    parts.push(Str.Part.lit("\n  "));
    assertEquals(1, Indent.min_indent(parts));
    assertEquals("\"  a\\n${x}\\n\"", Indent.strip(parts).toString());

    Ary<Str.Part> blank = new Ary<>(Str.Part.class);
    blank.push(Str.Part.lit("   \n  "));
    assertEquals(Integer.MAX_VALUE, Indent.min_indent(blank));
    assertEquals("\n", ((Str)Indent.strip(blank)).con());

    assertEquals("", ((Str)Indent.strip(new Ary<>(Str.Part.class))).con());
  }

  static AST parse( String prog ) {
    Result rez = Exec.parse_string(prog,"test","/base");
    assertNull(rez._err);
    return rez._ast;
  }
  static void test( String prog, String expected ) {
    assertEquals(expected, parse(prog).toString());
  }
}
