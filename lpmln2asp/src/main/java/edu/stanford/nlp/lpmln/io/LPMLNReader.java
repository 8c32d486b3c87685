package edu.stanford.nlp.lpmln.io;

import edu.stanford.nlp.lpmln.ast.*;
import edu.stanford.nlp.lpmln.translate.TranslationException;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.StringReader;
import java.util.*;

/**
 * A parser for LP^MLN programs: gringo rules, weak constraints and directives, plus theory atoms
 * ({@code &weight(2)}, {@code &evidence(p)}, ...) and the weight prefix {@code w : rule}.
 *
 * <p>
 *   A weight prefix is rewritten to a weight annotation at the end of the body, so that
 *   {@code 2 : a :- b.} reads as {@code a :- b, &weight(2).} and {@code 0.5 : a.} as
 *   {@code a :- &weight("0.5").}. The prefix {@code alpha :} marks a hard rule, and adds nothing.
 * </p>
 */
public class LPMLNReader {

  private enum TokenType { IDENTIFIER, VARIABLE, NUMBER, DECIMAL, STRING, DIRECTIVE, PUNCTUATION, EOF }

  private static class Token {
    final TokenType type;
    final String text;
    final Location location;

    Token(TokenType type, String text, Location location) {
      this.type = type;
      this.text = text;
      this.location = location;
    }

    boolean is(String punctuation) {
      return (type == TokenType.PUNCTUATION || type == TokenType.DIRECTIVE) && text.equals(punctuation);
    }

    boolean isKeyword(String keyword) {
      return type == TokenType.IDENTIFIER && text.equals(keyword);
    }

    @Override
    public String toString() {
      return type == TokenType.EOF ? "end of input" : "'" + text + "'";
    }
  }

  /** Longest first, so that ":-" is not read as ":" */
  private static final String[] PUNCTUATION = {
      ":-", ":~", "!=", "<=", ">=", "==",
      ":", ",", ";", ".", "(", ")", "{", "}", "[", "]", "@", "&", "=", "<", ">", "+", "-", "*", "/", "\\"
  };

  private final List<Token> tokens;
  private int position = 0;
  private boolean inTheoryAtom = false;

  private LPMLNReader(String text, String filename) {
    this.tokens = tokenize(text, filename);
  }

  public static List<AST> parse(BufferedReader in, String filename) throws IOException {
    StringBuilder text = new StringBuilder();
    String line;
    while ( (line = in.readLine()) != null ) {
      text.append(line).append('\n');
    }
    return parse(text.toString(), filename);
  }

  /**
   * Parse a program.
   * @throws TranslationException of kind {@link TranslationException.Kind#SYNTAX_ERROR} on malformed input.
   */
  public static List<AST> parse(String text, String filename) {
    return new LPMLNReader(text, filename).program();
  }

  public static List<AST> parse(String text) {
    try {
      return parse(new BufferedReader(new StringReader(text)), "<string>");
    } catch (IOException ex) {
      throw new RuntimeException(ex);
    }
  }

  //
  //  --------------------
  //  Tokens
  //  --------------------
  //

  private static List<Token> tokenize(String text, String filename) {
    List<Token> tokens = new ArrayList<>();
    int i = 0;
    int line = 1;
    int lineStart = 0;
    while (i < text.length()) {
      char c = text.charAt(i);
      if (c == '\n') {
        line += 1;
        lineStart = i + 1;
        i += 1;
        continue;
      }
      if (Character.isWhitespace(c)) { i += 1; continue; }
      Location loc = new Location(filename, line, i - lineStart + 1);
      if (c == '%') {
        if (i + 1 < text.length() && text.charAt(i + 1) == '*') {
          int end = text.indexOf("*%", i + 2);
          if (end < 0) { throw syntaxError(loc, "unterminated block comment"); }
          for (int k = i; k < end; ++k) {
            if (text.charAt(k) == '\n') { line += 1; lineStart = k + 1; }
          }
          i = end + 2;
        } else {
          while (i < text.length() && text.charAt(i) != '\n') { i += 1; }
        }
        continue;
      }
      int start = i;
      if (c == '_' || Character.isLetter(c)) {
        while (i < text.length() && text.charAt(i) == '_') { i += 1; }
        if (i < text.length() && Character.isLetter(text.charAt(i))) {
          boolean upper = Character.isUpperCase(text.charAt(i));
          while (i < text.length() && isNameChar(text.charAt(i))) { i += 1; }
          tokens.add(new Token(upper ? TokenType.VARIABLE : TokenType.IDENTIFIER, text.substring(start, i), loc));
        } else if (i - start == 1) {
          tokens.add(new Token(TokenType.VARIABLE, "_", loc));
        } else {
          throw syntaxError(loc, "invalid name '" + text.substring(start, i) + "'");
        }
      } else if (Character.isDigit(c)) {
        while (i < text.length() && Character.isDigit(text.charAt(i))) { i += 1; }
        boolean decimal = false;
        if (i + 1 < text.length() && text.charAt(i) == '.' && Character.isDigit(text.charAt(i + 1))) {
          decimal = true;
          i += 1;
          while (i < text.length() && Character.isDigit(text.charAt(i))) { i += 1; }
        }
        if (i < text.length() && (text.charAt(i) == 'e' || text.charAt(i) == 'E')) {
          int k = i + 1;
          if (k < text.length() && (text.charAt(k) == '+' || text.charAt(k) == '-')) { k += 1; }
          if (k < text.length() && Character.isDigit(text.charAt(k))) {
            decimal = true;
            i = k;
            while (i < text.length() && Character.isDigit(text.charAt(i))) { i += 1; }
          }
        }
        tokens.add(new Token(decimal ? TokenType.DECIMAL : TokenType.NUMBER, text.substring(start, i), loc));
      } else if (c == '"') {
        StringBuilder value = new StringBuilder();
        i += 1;
        while (true) {
          if (i >= text.length() || text.charAt(i) == '\n') { throw syntaxError(loc, "unterminated string"); }
          char s = text.charAt(i);
          if (s == '"') { i += 1; break; }
          if (s == '\\' && i + 1 < text.length()) {
            char escaped = text.charAt(i + 1);
            value.append(escaped == 'n' ? '\n' : escaped);
            i += 2;
          } else {
            value.append(s);
            i += 1;
          }
        }
        tokens.add(new Token(TokenType.STRING, value.toString(), loc));
      } else if (c == '#') {
        i += 1;
        while (i < text.length() && Character.isLetter(text.charAt(i))) { i += 1; }
        tokens.add(new Token(TokenType.DIRECTIVE, text.substring(start, i), loc));
      } else {
        String punctuation = null;
        for (String candidate : PUNCTUATION) {
          if (text.startsWith(candidate, i)) { punctuation = candidate; break; }
        }
        if (punctuation == null) { throw syntaxError(loc, "unexpected character '" + c + "'"); }
        i += punctuation.length();
        tokens.add(new Token(TokenType.PUNCTUATION, punctuation, loc));
      }
    }
    tokens.add(new Token(TokenType.EOF, "", new Location(filename, line, i - lineStart + 1)));
    return tokens;
  }

  private static boolean isNameChar(char c) {
    return Character.isLetterOrDigit(c) || c == '_' || c == '\'';
  }

  private Token peek() { return tokens.get(position); }

  private Token peek(int offset) { return tokens.get(Math.min(position + offset, tokens.size() - 1)); }

  private Token next() {
    Token token = tokens.get(position);
    if (token.type != TokenType.EOF) { position += 1; }
    return token;
  }

  private boolean accept(String punctuation) {
    if (peek().is(punctuation)) {
      position += 1;
      return true;
    }
    return false;
  }

  private Token expect(String punctuation) {
    if (!peek().is(punctuation)) {
      throw syntaxError(peek().location, "expected '" + punctuation + "' but found " + peek());
    }
    return next();
  }

  private static TranslationException syntaxError(Location location, String message) {
    return new TranslationException(TranslationException.Kind.SYNTAX_ERROR, location, message);
  }

  //
  //  --------------------
  //  Statements
  //  --------------------
  //

  private List<AST> program() {
    List<AST> statements = new ArrayList<>();
    while (peek().type != TokenType.EOF) {
      statements.add(statement());
    }
    return statements;
  }

  private AST statement() {
    Token first = peek();
    if (first.is(":~")) {
      return weakConstraint();
    } else if (first.is("#show")) {
      return show();
    } else if (first.is("#external")) {
      return external();
    }
    // Weight prefix
    AST weight = null;
    if (first.isKeyword("alpha") && peek(1).is(":")) {
      position += 2;
    } else if (isWeightToken(first) && peek(1).is(":")) {
      weight = weightTerm(next(), false);
      position += 1;
    } else if (first.is("-") && isWeightToken(peek(1)) && peek(2).is(":")) {
      next();
      weight = weightTerm(next(), true);
      position += 1;
    }
    return rule(first.location, weight);
  }

  private static boolean isWeightToken(Token token) {
    return token.type == TokenType.NUMBER || token.type == TokenType.DECIMAL || token.type == TokenType.STRING;
  }

  /** Integers stay integers; anything else becomes a string for the weight parser. */
  private static AST weightTerm(Token token, boolean negative) {
    if (token.type == TokenType.NUMBER) {
      long value = Long.parseLong(token.text);
      return new AST.SymbolicTerm(token.location, Symbol.number(negative ? -value : value));
    }
    return new AST.SymbolicTerm(token.location, Symbol.string((negative ? "-" : "") + token.text));
  }

  private AST rule(Location loc, AST weight) {
    AST head;
    if (peek().is(":-")) {
      head = new AST.Literal(peek().location, Sign.NO_SIGN, new AST.BooleanConstant(peek().location, false));
    } else {
      head = head();
    }
    List<AST> body = new ArrayList<>();
    if (accept(":-")) {
      body = body();
    }
    expect(".");
    if (weight != null) {
      AST.Function annotation = new AST.Function(weight.location, "weight", Collections.singletonList(weight));
      body.add(new AST.Literal(weight.location, Sign.NO_SIGN, new AST.TheoryAtom(weight.location, annotation)));
    }
    return new AST.Rule(loc, head, body);
  }

  private AST weakConstraint() {
    Location loc = expect(":~").location;
    List<AST> body = peek().is(".") ? new ArrayList<>() : body();
    expect(".");
    expect("[");
    AST weight = term();
    AST priority = new AST.SymbolicTerm(weight.location, Symbol.number(0));
    if (accept("@")) {
      priority = term();
    }
    List<AST> terms = new ArrayList<>();
    while (accept(",")) {
      terms.add(term());
    }
    expect("]");
    return new AST.Minimize(loc, weight, priority, terms, body);
  }

  private AST show() {
    Location loc = expect("#show").location;
    boolean positive = !accept("-");
    Token name = next();
    if (name.type != TokenType.IDENTIFIER) { throw syntaxError(name.location, "expected a predicate name but found " + name); }
    expect("/");
    Token arity = next();
    if (arity.type != TokenType.NUMBER) { throw syntaxError(arity.location, "expected an arity but found " + arity); }
    expect(".");
    return new AST.ShowSignature(loc, name.text, Integer.parseInt(arity.text), positive);
  }

  private AST external() {
    Location loc = expect("#external").location;
    AST atom = atom(term());
    List<AST> body = new ArrayList<>();
    if (accept(":")) {
      body = body();
    }
    expect(".");
    return new AST.External(loc, atom, body);
  }

  //
  //  --------------------
  //  Heads and Bodies
  //  --------------------
  //

  private AST head() {
    Token first = peek();
    if (first.is("&")) {
      return theoryAtom();
    }
    Sign sign = sign();
    if (peek().is("#false") || peek().is("#true")) {
      return new AST.Literal(first.location, sign, booleanConstant());
    }
    if (peek().is("{")) {
      return aggregate(null);
    }
    AST term = term();
    AST.Guard leftGuard = leftGuard(term);
    if (leftGuard != null) {
      return aggregate(leftGuard);
    }
    return new AST.Literal(first.location, sign, atom(term));
  }

  private List<AST> body() {
    List<AST> body = new ArrayList<>();
    body.add(bodyLiteral());
    while (accept(",") || accept(";")) {
      body.add(bodyLiteral());
    }
    return body;
  }

  private AST bodyLiteral() {
    Location loc = peek().location;
    Sign sign = sign();
    if (peek().is("&")) {
      return new AST.Literal(loc, sign, theoryAtom());
    }
    if (peek().is("{")) {
      return new AST.Literal(loc, sign, aggregate(null));
    }
    return literal(loc, sign, true);
  }

  /** A literal over an atom, a comparison or a boolean constant; in a body, also a guarded aggregate. */
  private AST literal(Location loc, Sign sign, boolean allowAggregate) {
    if (peek().is("#false") || peek().is("#true")) {
      return new AST.Literal(loc, sign, booleanConstant());
    }
    AST term = term();
    if (allowAggregate) {
      AST.Guard leftGuard = leftGuard(term);
      if (leftGuard != null) {
        return new AST.Literal(loc, sign, aggregate(leftGuard));
      }
    }
    Optional<ComparisonOperator> op = comparisonOperator(peek());
    if (op.isPresent()) {
      next();
      return new AST.Literal(loc, sign, new AST.Comparison(term.location, op.get(), term, term()));
    }
    return new AST.Literal(loc, sign, atom(term));
  }

  private Sign sign() {
    if (peek().isKeyword("not")) {
      next();
      if (peek().isKeyword("not")) {
        next();
        return Sign.DOUBLE_NEGATION;
      }
      return Sign.NEGATION;
    }
    return Sign.NO_SIGN;
  }

  private AST booleanConstant() {
    Token token = next();
    return new AST.BooleanConstant(token.location, token.is("#true"));
  }

  private AST atom(AST term) {
    if (!(term instanceof AST.Function) || ((AST.Function) term).isTuple()) {
      throw syntaxError(term.location, "expected an atom but found '" + term + "'");
    }
    return new AST.SymbolicAtom(term.location, term);
  }

  private AST theoryAtom() {
    Location loc = expect("&").location;
    Token name = next();
    if (name.type != TokenType.IDENTIFIER) { throw syntaxError(name.location, "expected a theory atom name but found " + name); }
    List<AST> arguments = new ArrayList<>();
    inTheoryAtom = true;
    try {
      if (accept("(")) {
        arguments = terms(")");
        expect(")");
      }
    } finally {
      inTheoryAtom = false;
    }
    // an empty element list is allowed, as in &query(p){}
    if (accept("{")) {
      expect("}");
    }
    return new AST.TheoryAtom(loc, new AST.Function(name.location, name.text, arguments));
  }

  //
  //  --------------------
  //  Aggregates
  //  --------------------
  //

  /** If a term is followed by an aggregate, the guard it forms; a term directly before '{' means '&lt;='. */
  private AST.Guard leftGuard(AST term) {
    if (peek().is("{")) {
      return new AST.Guard(term.location, ComparisonOperator.LESS_EQUAL, term);
    }
    Optional<ComparisonOperator> op = comparisonOperator(peek());
    if (op.isPresent() && peek(1).is("{")) {
      next();
      return new AST.Guard(term.location, op.get(), term);
    }
    return null;
  }

  private AST aggregate(AST.Guard leftGuard) {
    Location loc = expect("{").location;
    List<AST> elements = new ArrayList<>();
    if (!peek().is("}")) {
      elements.add(conditionalLiteral());
      while (accept(";")) {
        elements.add(conditionalLiteral());
      }
    }
    expect("}");
    AST.Guard rightGuard = null;
    Optional<ComparisonOperator> op = comparisonOperator(peek());
    if (op.isPresent()) {
      Token opToken = next();
      rightGuard = new AST.Guard(opToken.location, op.get(), term());
    } else if (peek().type == TokenType.NUMBER || peek().type == TokenType.VARIABLE) {
      AST bound = term();
      rightGuard = new AST.Guard(bound.location, ComparisonOperator.LESS_EQUAL, bound);
    }
    return new AST.Aggregate(leftGuard == null ? loc : leftGuard.location, leftGuard, elements, rightGuard);
  }

  private AST conditionalLiteral() {
    Location loc = peek().location;
    AST literal = literal(loc, sign(), false);
    List<AST> condition = new ArrayList<>();
    if (accept(":")) {
      Location condLoc = peek().location;
      condition.add(literal(condLoc, sign(), false));
      while (accept(",")) {
        condLoc = peek().location;
        condition.add(literal(condLoc, sign(), false));
      }
    }
    return new AST.ConditionalLiteral(loc, literal, condition);
  }

  private static Optional<ComparisonOperator> comparisonOperator(Token token) {
    if (token.type != TokenType.PUNCTUATION) { return Optional.empty(); }
    return ComparisonOperator.fromSymbol(token.text);
  }

  //
  //  --------------------
  //  Terms
  //  --------------------
  //

  private List<AST> terms(String closing) {
    List<AST> terms = new ArrayList<>();
    if (peek().is(closing)) { return terms; }
    terms.add(term());
    while (accept(",")) {
      terms.add(term());
    }
    return terms;
  }

  private AST term() {
    AST left = product();
    while (peek().is("+") || peek().is("-")) {
      Token op = next();
      left = new AST.BinaryOperation(op.location,
          op.is("+") ? AST.BinaryOperation.Operator.PLUS : AST.BinaryOperation.Operator.MINUS, left, product());
    }
    return left;
  }

  private AST product() {
    AST left = unary();
    while (peek().is("*") || peek().is("/") || peek().is("\\")) {
      Token op = next();
      AST.BinaryOperation.Operator operator = op.is("*") ? AST.BinaryOperation.Operator.TIMES
          : op.is("/") ? AST.BinaryOperation.Operator.DIVISION : AST.BinaryOperation.Operator.MODULO;
      left = new AST.BinaryOperation(op.location, operator, left, unary());
    }
    return left;
  }

  private AST unary() {
    if (peek().is("-")) {
      Token minus = next();
      AST argument = unary();
      if (argument instanceof AST.SymbolicTerm && ((AST.SymbolicTerm) argument).symbol.isNumber()) {
        return new AST.SymbolicTerm(minus.location, Symbol.number(-((AST.SymbolicTerm) argument).symbol.getNumber()));
      }
      return new AST.UnaryOperation(minus.location, argument);
    }
    return primary();
  }

  private AST primary() {
    Token token = next();
    switch (token.type) {
      case NUMBER:
        try {
          return new AST.SymbolicTerm(token.location, Symbol.number(Long.parseLong(token.text)));
        } catch (NumberFormatException e) {
          throw syntaxError(token.location, "number out of range: " + token.text);
        }
      case DECIMAL:
        if (!inTheoryAtom) {
          throw syntaxError(token.location, "decimal numbers are only allowed in weights: " + token.text);
        }
        return new AST.SymbolicTerm(token.location, Symbol.string(token.text));
      case STRING:
        return new AST.SymbolicTerm(token.location, Symbol.string(token.text));
      case VARIABLE:
        return new AST.Variable(token.location, token.text);
      case IDENTIFIER:
        List<AST> arguments = Collections.emptyList();
        if (accept("(")) {
          arguments = terms(")");
          expect(")");
        }
        return new AST.Function(token.location, token.text, arguments);
      case PUNCTUATION:
        if (token.is("(")) {
          List<AST> elements = new ArrayList<>();
          boolean trailingComma = false;
          if (!peek().is(")")) {
            elements.add(term());
            while (accept(",")) {
              if (peek().is(")")) {
                trailingComma = true;
                break;
              }
              elements.add(term());
            }
          }
          expect(")");
          if (elements.size() == 1 && !trailingComma) {
            return elements.get(0);
          }
          return new AST.Function(token.location, "", elements);
        }
        break;
      default:
        break;
    }
    throw syntaxError(token.location, "expected a term but found " + token);
  }
}
