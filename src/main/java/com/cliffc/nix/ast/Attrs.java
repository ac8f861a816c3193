package com.cliffc.nix.ast;

import com.cliffc.nix.ErrMsg;
import com.cliffc.nix.Pos;
import com.cliffc.nix.util.Ary;

import java.util.Map;
import java.util.TreeMap;

/** Collects the bindings of one attribute set literal and merges them into a
 *  {@link Struct}.
 *
 *  Bindings are inserted into a prefix tree keyed by attribute path.  A
 *  single-name binding is a leaf; a dotted path {@code a.b.c = e;} makes or
 *  extends interior nodes for {@code a} and {@code a.b}, which become nested
 *  non-recursive sets.  All binding forms (plain, dotted, {@code inherit x;}
 *  and {@code inherit (src) x;}) fill the same tree, so putting anything
 *  where a leaf already sits, or a leaf where an interior node sits, is a
 *  duplicate attribute error naming both definitions.
 *
 *  Checking happens as each binding is added, so the first duplicate in
 *  source order is the one reported.
 */
public class Attrs {

  // Prefix tree node: either a leaf definition or an interior set of kids
  private static final class Trie {
    final Pos _loc;             // First definition; blamed as the prior on a duplicate
    final Struct.Def _leaf;     // Leaf binding, or null for interior nodes
    final TreeMap<String,Trie> _kids;
    Trie( Struct.Def leaf ) { _loc = leaf._loc; _leaf = leaf; _kids = null; }
    Trie( Pos loc ) { _loc = loc; _leaf = null; _kids = new TreeMap<>(); }
  }

  private final Trie _root = new Trie((Pos)null);

  /** name = e; */
  public Attrs add( String name, AST e, Pos loc ) {
    return insert(new Ary<>(new String[]{name}),new Struct.Def(e,loc,false));
  }

  /** a.b.c = e; */
  public Attrs add( Ary<String> path, AST e, Pos loc ) {
    return insert(path,new Struct.Def(e,loc,false));
  }

  /** inherit name;  The name resolves in the enclosing lexical scope, even
   *  inside a 'rec' set. */
  public Attrs inherit( String name, Pos loc ) {
    return insert(new Ary<>(new String[]{name}),new Struct.Def(new Ident(name),loc,true));
  }

  /** inherit (src) name;  Selects name out of src.  All names in one
   *  inherit clause share the same src node. */
  public Attrs inherit( AST src, String name, Pos loc ) {
    return insert(new Ary<>(new String[]{name}),new Struct.Def(new Field(src,name,loc),loc,false));
  }

  private Attrs insert( Ary<String> path, Struct.Def def ) {
    assert !path.isEmpty();
    Trie t = _root;
    for( int i=0; i<path._len-1; i++ ) {
      String name = path.at(i);
      Trie kid = t._kids.get(name);
      if( kid == null ) t._kids.put(name, kid = new Trie(def._loc));
      else if( kid._leaf != null ) throw dup(path,i,def,kid);
      t = kid;
    }
    String name = path.last();
    Trie old = t._kids.get(name);
    if( old != null ) throw dup(path,path._len-1,def,old);
    t._kids.put(name,new Trie(def));
    return this;
  }

  private static ErrMsg.Fail dup( Ary<String> path, int idx, Struct.Def def, Trie old ) {
    StringBuilder sb = new StringBuilder(path.at(0));
    for( int i=1; i<=idx; i++ ) sb.append('.').append(path.at(i));
    return ErrMsg.dup_attr(sb.toString(),def._loc,old._loc).fail();
  }

  /** Build the attribute set.  Only the outermost set takes the rec flag;
   *  sets made from dotted paths are never recursive. */
  public Struct build( boolean rec ) { return build(_root,rec); }

  private static Struct build( Trie t, boolean rec ) {
    TreeMap<String,Struct.Def> defs = new TreeMap<>();
    for( Map.Entry<String,Trie> e : t._kids.entrySet() ) {
      Trie kid = e.getValue();
      defs.put(e.getKey(), kid._leaf != null ? kid._leaf : new Struct.Def(build(kid,false),kid._loc,false));
    }
    return new Struct(rec,defs);
  }
}
