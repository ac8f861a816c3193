package com.cliffc.nix.ast;

import com.cliffc.nix.util.Ary;

/** Strips the common indentation from the parts of an indented string
 *  ({@code ''...''}).
 *
 *  The minimum indentation counts leading spaces on every line that has some
 *  content; lines holding only spaces do not count.  An interpolation ends
 *  the leading space of its line just like a non-space character does.
 *  That many spaces are then dropped from the start of every line.  If the
 *  string ends with a line of nothing but spaces, those spaces go too and
 *  the string ends with the newline.  Literal parts left empty are dropped.
 */
public abstract class Indent {

  public static AST strip( Ary<Str.Part> parts ) {
    int min = min_indent(parts);

    Ary<Str.Part> rez = new Ary<>(Str.Part.class);
    boolean sol = true;         // At start of line: seen only spaces on this line
    int dropped = 0;            // Spaces dropped so far on this line
    for( int i=0; i<parts._len; i++ ) {
      Str.Part p = parts.at(i);
      if( !p.is_lit() ) {
        sol = false;
        dropped = 0;
        rez.push(p);
        continue;
      }
      String s = p._lit;
      StringBuilder sb = new StringBuilder();
      for( int j=0; j<s.length(); j++ ) {
        char c = s.charAt(j);
        if( sol ) {
          if( c == ' ' ) {
            if( dropped++ >= min ) sb.append(c);
          } else if( c == '\n' ) {
            dropped = 0;
            sb.append(c);
          } else {
            sol = false;
            dropped = 0;
            sb.append(c);
          }
        } else {
          sb.append(c);
          if( c == '\n' ) sol = true;
        }
      }
      // Final line of only spaces is dropped, keeping the newline
      if( i == parts._len-1 ) {
        int nl = sb.lastIndexOf("\n");
        if( nl != -1 && only_spaces(sb,nl+1) ) sb.setLength(nl+1);
      }
      if( sb.length() > 0 ) rez.push(Str.Part.lit(sb.toString())); // Nothing left of an all-indent part
    }

    if( rez.isEmpty() ) return Str.con("");
    // A single literal is just a constant string
    if( rez._len==1 && rez.at(0).is_lit() ) return Str.con(rez.at(0)._lit);
    return new Str(rez);
  }

  // Smallest leading-space count over all lines with content
  static int min_indent( Ary<Str.Part> parts ) {
    boolean sol = true;
    int min = Integer.MAX_VALUE;
    int cur = 0;
    for( Str.Part p : parts ) {
      if( !p.is_lit() ) {
        if( sol ) {
          sol = false;
          min = Math.min(min,cur);
        }
        continue;
      }
      String s = p._lit;
      for( int j=0; j<s.length(); j++ ) {
        char c = s.charAt(j);
        if( sol ) {
          if( c == ' ' ) cur++;
          else if( c == '\n' ) cur = 0; // Blank line; no say in the minimum
          else {
            sol = false;
            min = Math.min(min,cur);
          }
        } else if( c == '\n' ) {
          sol = true;
          cur = 0;
        }
      }
    }
    return min;
  }

  private static boolean only_spaces( StringBuilder sb, int x ) {
    for( int i=x; i<sb.length(); i++ )
      if( sb.charAt(i) != ' ' ) return false;
    return true;
  }
}
