package com.cliffc.nix;

import com.cliffc.nix.ast.PathLit;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;

import static org.junit.Assert.*;

public class TestExec {
  @Rule public final TemporaryFolder tmp = new TemporaryFolder();

  private Path root() { return tmp.getRoot().toPath().toAbsolutePath().normalize(); }
  private Path write( String rel, String text ) throws IOException {
    Path p = root().resolve(rel);
    Files.createDirectories(p.getParent());
    Files.write(p,text.getBytes(StandardCharsets.UTF_8));
    return p;
  }
  private Path link( String rel, String target ) throws IOException {
    Path p = root().resolve(rel);
    Files.createDirectories(p.getParent());
    return Files.createSymbolicLink(p,Paths.get(target));
  }
  // Parse the file and return the single path literal it holds
  private String path_of( Path p ) {
    Result rez = Exec.parse_file(p.toString());
    assertNull(rez._err);
    return ((PathLit)rez._ast)._path;
  }

  // Text entry: the label only names errors, the base anchors paths
  @Test public void testExec00() {
    Result rez = Exec.parse_string("./a","some label","/x/y");
    assertEquals("/x/y/a", rez.toString());
    rez = Exec.parse_string("a )","some label","/x/y");
    assertEquals("syntax error, unexpected ')', at some label:1:3", rez.toString());
  }

  // A plain file is relative to its own directory
  @Test public void testExec01() throws IOException {
    Path f = write("src/a.nix", "./b.nix");
    assertEquals(root().resolve("src/b.nix").toString(), path_of(f));
  }

  // A directory means its default file
  @Test public void testExec02() throws IOException {
    write("pkg/default.nix", "./x");
    assertEquals(root().resolve("pkg/x").toString(), path_of(root().resolve("pkg")));
  }

  // Relative link targets resolve against the link's directory, and the
  // file's real directory is the base
  @Test public void testExec03() throws IOException {
    write("real/file.nix", "../y");
    Path l = link("links/f.nix", "../real/file.nix");
    assertEquals(root().resolve("y").toString(), path_of(l));
  }

  // A chain of links ending at a directory
  @Test public void testExec04() throws IOException {
    write("pkg/default.nix", "./z");
    link("l2", "pkg");
    Path l1 = link("l1", root().resolve("l2").toString());
    assertEquals(root().resolve("pkg/z").toString(), path_of(l1));
  }

  // Filesystem failures come back as errors without positions
  @Test public void testExec05() throws IOException {
    link("loop1", "loop2");
    link("loop2", "loop1");
    String loop = root().resolve("loop1").toString();
    ErrMsg err = Exec.parse_file(loop)._err;
    assertEquals(ErrMsg.Level.FileSys, err._lvl);
    assertEquals("too many levels of symbolic links resolving '"+loop+"'", err._msg);
    assertNull(err._loc);
    assertNull(err.path());
    assertEquals(0, err.line());

    String missing = root().resolve("nope.nix").toString();
    err = Exec.parse_file(missing)._err;
    assertEquals(ErrMsg.Level.FileSys, err._lvl);
    assertTrue(err._msg, err._msg.startsWith("getting status of '"+missing+"': NoSuchFileException"));

    Files.createDirectories(root().resolve("empty"));
    err = Exec.parse_file(root().resolve("empty").toString())._err;
    assertTrue(err._msg, err._msg.startsWith("reading file '"+root().resolve("empty/default.nix")+"'"));
  }

  // Syntax errors name the resolved file
  @Test public void testExec06() throws IOException {
    Path f = write("bad.nix", "{ a = 1;\n  a = 2; }");
    ErrMsg err = Exec.parse_file(link("ln.nix","bad.nix").toString())._err;
    assertEquals(ErrMsg.Level.DupAttr, err._lvl);
    assertEquals(f.toString(), err.path());
    assertEquals(2, err.line());
    assertEquals(3, err.col());
    assertEquals(new Pos(f.toString(),1,3), err._prior);
  }

  // In-memory filesystem: symlink hop limit
  @Test public void testExec07() {
    MemFS fs = new MemFS();
    for( int i=0; i<NIX.MAX_SYMLINKS; i++ )
      fs.link("/l"+i, "l"+(i+1));
    fs.file("/l"+NIX.MAX_SYMLINKS, "./ok");
    Result rez = Exec.parse_file(fs,"/l0");
    assertEquals("/ok", rez.toString());

    fs.link("/m", "l0");        // One hop too many
    rez = Exec.parse_file(fs,"/m");
    assertEquals("too many levels of symbolic links resolving '/m'", rez._err._msg);
  }

  // In-memory filesystem: directories and absolute link targets
  @Test public void testExec08() {
    MemFS fs = new MemFS();
    fs.dir("/a/b");
    fs.file("/a/b/default.nix", "[ ./c ../d ]");
    fs.link("/x/y", "/a/b");
    assertEquals("[ /a/b/c /a/d ]", Exec.parse_file(fs,"/x/y").toString());
    assertEquals("[ /a/b/c /a/d ]", Exec.parse_file(fs,"/x/../a/./b/default.nix").toString());
    Result rez = Exec.parse_file(fs,"/x/z");
    assertEquals("getting status of '/x/z': NoSuchFileException /x/z", rez._err._msg);
  }

  // Malformed paths are filesystem errors, not exceptions
  @Test public void testExec09() {
    ErrMsg err = Exec.parse_file("bad\0path")._err;
    assertEquals(ErrMsg.Level.FileSys, err._lvl);
    assertTrue(err._msg, err._msg.startsWith("invalid path 'bad\0path': "));
    assertNull(err._loc);

    Result rez = Exec.parse_string("1","test","bad\0base");
    assertNull(rez._ast);
    assertEquals(ErrMsg.Level.FileSys, rez._err._lvl);

    MemFS fs = new MemFS();
    fs.link("/l", "x\0y");
    err = Exec.parse_file(fs,"/l")._err;
    assertEquals(ErrMsg.Level.FileSys, err._lvl);
    assertTrue(err._msg, err._msg.startsWith("invalid symbolic link target 'x\0y': "));

    try {
      FileSys.LOCAL.lstat("bad\0path");
      fail();
    } catch( IOException e ) {
      assertTrue(e.getCause() instanceof java.nio.file.InvalidPathException);
    }
  }

  // Minimal filesystem over maps
  private static class MemFS implements FileSys {
    final HashMap<String,String> _files = new HashMap<>(), _links = new HashMap<>();
    final HashMap<String,Boolean> _dirs = new HashMap<>();
    void file( String p, String text ) { _files.put(p,text); }
    void link( String p, String target ) { _links.put(p,target); }
    void dir ( String p ) { _dirs.put(p,true); }
    @Override public Kind lstat( String p ) throws IOException {
      if( _links.containsKey(p) ) return Kind.Symlink;
      if( _dirs .containsKey(p) ) return Kind.Dir;
      if( _files.containsKey(p) ) return Kind.File;
      throw new NoSuchFileException(p);
    }
    @Override public String read_link( String p ) { return _links.get(p); }
    @Override public String read_file( String p ) throws IOException {
      String s = _files.get(p);
      if( s==null ) throw new NoSuchFileException(p);
      return s;
    }
  }
}
