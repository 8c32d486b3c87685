package edu.stanford.nlp.lpmln.ast;

/**
 * A position in a source file. Carried by every node of the tree, and copied onto every node
 * derived from it, so that errors can point back at the statement that caused them.
 */
public class Location {
  public static final Location UNKNOWN = new Location("<unknown>", 0, 0);

  public final String filename;
  public final int line;
  public final int column;

  public Location(String filename, int line, int column) {
    this.filename = filename;
    this.line = line;
    this.column = column;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Location)) return false;
    Location other = (Location) o;
    return line == other.line && column == other.column && filename.equals(other.filename);
  }

  @Override
  public int hashCode() {
    int result = filename.hashCode();
    result = 31 * result + line;
    result = 31 * result + column;
    return result;
  }

  @Override
  public String toString() {
    return filename + ":" + line + ":" + column;
  }
}
