package com.cliffc.nix.ast;

import com.cliffc.nix.ErrMsg;
import com.cliffc.nix.Exec;
import com.cliffc.nix.Pos;
import com.cliffc.nix.Result;
import com.cliffc.nix.util.Ary;
import org.junit.Test;

import static org.junit.Assert.*;

public class TestFormals {

  @Test public void testFormals00() {
    Lambda l = (Lambda)parse("{ a, b ? a, ... }@all: b");
    Formals fs = l._formals;
    assertEquals("all", l._arg);
    assertEquals(2, fs.len());
    assertTrue(fs._ellipsis);
    assertEquals("a", fs.at(0)._name);
    assertNull(fs.find("a")._dflt);
    assertEquals("a", fs.find("b")._dflt.toString());
    assertNull(fs.find("all"));
    assertEquals(new Pos("test",1,6), fs.find("b")._loc);
  }

  // Duplicate names, with and without an alias on either side
  @Test public void testFormals01() {
    testerr("{ a, a }: a", "a", 1, 6, 1, 3);
    testerr("{ a ? 1, b, a ? 2 }: a", "a", 1, 13, 1, 3);
    testerr("{ a }@a: a", "a", 1, 7, 1, 3);
    testerr("a@{ a }: a", "a", 1, 5, 1, 1);
    testerr("a@{ b, a, a }: a", "a", 1, 8, 1, 1);
    testerr("{ b, a, a }@a: a", "a", 1, 9, 1, 6);
  }

  // Distinct names are fine, and a nested lambda is checked on its own
  @Test public void testFormals02() {
    assertNull(Exec.parse_string("{ a, b }@c: c","test","/base")._err);
    assertNull(Exec.parse_string("{ a }: { a }: a","test","/base")._err);
    assertNull(Exec.parse_string("a: { a }: a","test","/base")._err);
    testerr("{ a }: { b, b }: a", "b", 1, 13, 1, 10);
  }

  // The validator directly, without the parser
  @Test public void testFormals03() {
    Pos p0 = new Pos("x",1,1), p1 = new Pos("x",1,5), p2 = new Pos("x",1,9);
    Ary<Formals.Formal> ary = new Ary<>(Formals.Formal.class);
    ary.push(new Formals.Formal("a",null,p0));
    ary.push(new Formals.Formal("b",null,p1));
    Formals fs = new Formals(ary,false);
    assertSame(fs, fs.check(null,null,false));
    assertSame(fs, fs.check("c",p2,false));
    try {
      fs.check("b",p2,false);
      fail();
    } catch( ErrMsg.Fail f ) {
      assertEquals(ErrMsg.dup_formal("b",p2,p1), f._err);
    }
    try {
      fs.check("a",p2,true);
      fail();
    } catch( ErrMsg.Fail f ) {
      assertEquals(ErrMsg.dup_formal("a",p0,p2), f._err);
    }
  }

  static AST parse( String prog ) {
    Result rez = Exec.parse_string(prog,"test","/base");
    assertNull(rez._err);
    return rez._ast;
  }
  static void testerr( String prog, String name, int line, int col, int pline, int pcol ) {
    Result rez = Exec.parse_string(prog,"test","/base");
    assertNull(rez._ast);
    assertEquals(ErrMsg.dup_formal(name,new Pos("test",line,col),new Pos("test",pline,pcol)), rez._err);
    assertEquals(ErrMsg.Level.DupFormal, rez._err._lvl);
    assertEquals("duplicate formal function argument '"+name+"', at "+new Pos("test",line,col)+
                 "; previously defined at "+new Pos("test",pline,pcol), rez._err.toString());
  }
}
