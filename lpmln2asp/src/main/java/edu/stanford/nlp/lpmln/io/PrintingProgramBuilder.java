package edu.stanford.nlp.lpmln.io;

import edu.stanford.nlp.lpmln.ast.AST;

import java.io.PrintWriter;
import java.io.Writer;

/**
 * Writes a program in gringo syntax, one statement per line.
 */
public class PrintingProgramBuilder implements ProgramBuilder, AutoCloseable {
  private final PrintWriter out;
  private int count = 0;

  public PrintingProgramBuilder(Writer out) {
    this.out = out instanceof PrintWriter ? (PrintWriter) out : new PrintWriter(out);
  }

  @Override
  public void add(AST statement) {
    out.println(statement);
    count += 1;
  }

  /** The number of statements written so far. */
  public int count() {
    return count;
  }

  public void flush() {
    out.flush();
  }

  @Override
  public void close() {
    out.close();
  }
}
