package edu.stanford.nlp.lpmln.ast;

/**
 * A ground constant appearing in a program: either an integer or a string.
 */
public class Symbol {
  public enum Kind { NUMBER, STRING }

  public final Kind kind;
  private final long number;
  private final String string;

  private Symbol(Kind kind, long number, String string) {
    this.kind = kind;
    this.number = number;
    this.string = string;
  }

  public static Symbol number(long value) {
    return new Symbol(Kind.NUMBER, value, null);
  }

  public static Symbol string(String value) {
    if (value == null) { throw new IllegalArgumentException("String symbol cannot be null"); }
    return new Symbol(Kind.STRING, 0L, value);
  }

  public boolean isNumber() { return kind == Kind.NUMBER; }

  public boolean isString() { return kind == Kind.STRING; }

  /** @throws IllegalStateException if this is not a number */
  public long getNumber() {
    if (kind != Kind.NUMBER) { throw new IllegalStateException("Not a number: " + this); }
    return number;
  }

  /** @throws IllegalStateException if this is not a string */
  public String getString() {
    if (kind != Kind.STRING) { throw new IllegalStateException("Not a string: " + this); }
    return string;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Symbol)) return false;
    Symbol other = (Symbol) o;
    return kind == other.kind && number == other.number
        && (string == null ? other.string == null : string.equals(other.string));
  }

  @Override
  public int hashCode() {
    int result = kind.hashCode();
    result = 31 * result + Long.hashCode(number);
    result = 31 * result + (string != null ? string.hashCode() : 0);
    return result;
  }

  @Override
  public String toString() {
    if (kind == Kind.NUMBER) {
      return Long.toString(number);
    }
    StringBuilder b = new StringBuilder("\"");
    for (char c : string.toCharArray()) {
      switch (c) {
        case '"': b.append("\\\""); break;
        case '\\': b.append("\\\\"); break;
        case '\n': b.append("\\n"); break;
        default: b.append(c);
      }
    }
    return b.append('"').toString();
  }
}
