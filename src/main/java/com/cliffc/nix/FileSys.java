package com.cliffc.nix;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.nio.file.attribute.BasicFileAttributes;

/** The filesystem operations the file entry point needs.  Swappable so
 *  callers can load sources from somewhere other than the local disk. */
public interface FileSys {
  enum Kind { File, Dir, Symlink }

  /** Kind of the path itself, not following a final symlink. */
  Kind lstat( String path ) throws IOException;
  /** Target of a symlink, exactly as stored; may be relative. */
  String read_link( String path ) throws IOException;
  /** Whole file contents as UTF-8 text. */
  String read_file( String path ) throws IOException;

  FileSys LOCAL = new FileSys() {
    @Override public Kind lstat( String path ) throws IOException {
      BasicFileAttributes attrs = Files.readAttributes(path(path),BasicFileAttributes.class,LinkOption.NOFOLLOW_LINKS);
      return attrs.isSymbolicLink() ? Kind.Symlink : (attrs.isDirectory() ? Kind.Dir : Kind.File);
    }
    @Override public String read_link( String path ) throws IOException {
      return Files.readSymbolicLink(path(path)).toString();
    }
    @Override public String read_file( String path ) throws IOException {
      return Files.readString(path(path),StandardCharsets.UTF_8);
    }
    // Malformed path strings fail like any other unreadable path
    private Path path( String path ) throws IOException {
      try { return Paths.get(path); }
      catch( InvalidPathException e ) { throw new IOException(e.getMessage(),e); }
    }
  };
}
