package edu.stanford.nlp.lpmln.translate;

import edu.stanford.nlp.lpmln.ast.AST;

import java.util.List;

/**
 * Converts the P-log annotations {@code &random}, {@code &pr}, {@code &obs} and {@code &do} into
 * plain rules. Every method returns at least one rule; the last one takes the place of the
 * annotated rule in the program.
 */
public interface PlogConverter {

  List<AST> convertRandom(AST head, List<AST> body);

  List<AST> convertPr(AST head, List<AST> body);

  List<AST> convertObsDo(AST head);

  /** A converter for programs without P-log annotations; rejects every annotation it is given. */
  PlogConverter UNSUPPORTED = new PlogConverter() {
    @Override
    public List<AST> convertRandom(AST head, List<AST> body) { throw reject("random", head); }

    @Override
    public List<AST> convertPr(AST head, List<AST> body) { throw reject("pr", head); }

    @Override
    public List<AST> convertObsDo(AST head) { throw reject("obs/do", head); }

    private TranslationException reject(String annotation, AST head) {
      return new TranslationException(TranslationException.Kind.UNSUPPORTED_THEORY_ANNOTATION, head.location,
          "no P-log converter is configured for &" + annotation + " in " + head);
    }
  };
}
