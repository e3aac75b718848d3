package opulse;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import opulse.Definition.Branch;
import opulse.Definition.Condition;
import opulse.Definition.Term;

/**
 * Parser for definition text. Expressions inside must be bracketed so that every group holds one
 * of {@code x}, {@code <sym> x}, {@code x <sym>} or {@code x <sym> y}.
 */
public final class DefinitionParser {
  private static final ImmutableSet<String> KEYWORDS = ImmutableSet.of("if", "else", "and", "or");
  private static final CharMatcher LETTER = CharMatcher.inRange('a', 'z')
      .or(CharMatcher.inRange('A', 'Z'))
      .or(CharMatcher.is('_'));
  private static final CharMatcher DIGIT = CharMatcher.inRange('0', '9');
  private static final CharMatcher PUNCTUATION = CharMatcher.anyOf("(){},;");
  private static final CharMatcher SYMBOL =
      LETTER.or(DIGIT).or(PUNCTUATION).or(CharMatcher.whitespace()).negate();

  private enum Kind {
    NAME,
    NUMBER,
    SYMBOL,
    LPAREN,
    RPAREN,
    COMMA,
    SEMICOLON;
  }

  private static final class Token {
    final Kind kind;
    final String text;

    Token(Kind kind, String text) {
      this.kind = kind;
      this.text = text;
    }

    boolean isKeyword(String keyword) {
      return kind == Kind.NAME && text.equals(keyword);
    }

    @Override
    public String toString() {
      return text;
    }
  }

  private final String text;

  private DefinitionParser(String text) {
    this.text = text;
  }

  public static Definition parse(String text) throws SynthesisException {
    return new DefinitionParser(text).parse();
  }

  private Definition parse() throws SynthesisException {
    int open = text.indexOf('{');
    int close = text.lastIndexOf('}');
    if (open < 0 || close < open || !text.substring(close + 1).trim().isEmpty()) {
      throw error("expected 'lhs = { body }'");
    }
    String head = text.substring(0, open).trim();
    if (!head.endsWith("=")) {
      throw error("missing '=' before the body");
    }
    String lhs = head.substring(0, head.length() - 1).trim();
    List<Token> lhsTokens = tokenize(lhs);
    List<Token> body = tokenize(text.substring(open + 1, close));

    Term pattern = parseTerm(lhsTokens);
    String symbol;
    Fixity fixity;
    ImmutableList<String> operands;
    switch (pattern.type()) {
      case UNARY:
        {
          Definition.Unary unary = (Definition.Unary) pattern;
          symbol = unary.symbol();
          fixity = unary.fixity();
          operands = ImmutableList.of(operandName(unary.operand()));
          break;
        }
      case BINARY:
        {
          Definition.Binary binary = (Definition.Binary) pattern;
          symbol = binary.symbol();
          fixity = Fixity.INFIX;
          operands = ImmutableList.of(operandName(binary.left()), operandName(binary.right()));
          if (operands.get(0).equals(operands.get(1))) {
            throw error("operands must be distinct");
          }
          break;
        }
      default:
        throw error("left-hand side must apply a symbol to operands");
    }

    ImmutableList.Builder<Branch> branches = ImmutableList.builder();
    List<List<Token>> parts = splitTopLevel(body, Kind.SEMICOLON);
    for (int i = 0; i < parts.size(); i++) {
      branches.add(parseBranch(parts.get(i), parts.size() == 1, i == parts.size() - 1));
    }
    return new Definition(symbol, fixity, operands, branches.build());
  }

  private String operandName(Term term) throws SynthesisException {
    if (term.type() != Term.Type.NAME) {
      throw error("left-hand side operands must be names");
    }
    return ((Definition.Name) term).name();
  }

  private Branch parseBranch(List<Token> tokens, boolean only, boolean last)
      throws SynthesisException {
    int comma = -1;
    int depth = 0;
    for (int i = 0; i < tokens.size(); i++) {
      Kind kind = tokens.get(i).kind;
      if (kind == Kind.LPAREN) {
        depth++;
      } else if (kind == Kind.RPAREN) {
        depth--;
      } else if (kind == Kind.COMMA && depth == 0) {
        comma = i;
      }
    }
    if (comma < 0) {
      if (!only) {
        throw error("every branch needs ', if <condition>' or ', else'");
      }
      return new Branch(parseTerm(tokens), Optional.empty());
    }

    Term expression = parseTerm(tokens.subList(0, comma));
    List<Token> tail = tokens.subList(comma + 1, tokens.size());
    if (tail.size() == 1 && tail.get(0).isKeyword("else")) {
      if (!last) {
        throw error("'else' must be the last branch");
      }
      return new Branch(expression, Optional.empty());
    } else if (!tail.isEmpty() && tail.get(0).isKeyword("if")) {
      if (last) {
        throw error("the last branch must be 'else'");
      }
      return new Branch(expression, Optional.of(parseCondition(tail.subList(1, tail.size()))));
    }
    throw error("expected 'if' or 'else' after ','");
  }

  // `or` binds looser than `and`.
  private Condition parseCondition(List<Token> tokens) throws SynthesisException {
    List<List<Token>> disjuncts = splitKeyword(tokens, "or");
    Condition result = null;
    for (List<Token> disjunct : disjuncts) {
      Condition conjunction = null;
      for (List<Token> comparison : splitKeyword(disjunct, "and")) {
        Condition parsed = parseComparison(comparison);
        conjunction =
            conjunction == null ? parsed : new Definition.Connective(true, conjunction, parsed);
      }
      result = result == null ? conjunction : new Definition.Connective(false, result, conjunction);
    }
    return result;
  }

  private Condition parseComparison(List<Token> tokens) throws SynthesisException {
    int depth = 0;
    for (int i = 0; i < tokens.size(); i++) {
      Token token = tokens.get(i);
      if (token.kind == Kind.LPAREN) {
        depth++;
      } else if (token.kind == Kind.RPAREN) {
        depth--;
      } else if (token.kind == Kind.SYMBOL && depth == 0) {
        Optional<Value.Comparison> comparison = Value.Comparison.forSymbol(token.text);
        if (comparison.isPresent()) {
          return new Definition.Comparison(
              comparison.get(),
              parseTerm(tokens.subList(0, i)),
              parseTerm(tokens.subList(i + 1, tokens.size())));
        }
      }
    }
    throw error("expected a comparison in condition '" + join(tokens) + "'");
  }

  private Term parseTerm(List<Token> tokens) throws SynthesisException {
    if (tokens.isEmpty()) {
      throw error("empty expression");
    }
    // Each frame holds Terms and symbol Strings of one bracket level.
    Deque<List<Object>> stack = new ArrayDeque<>();
    stack.push(new ArrayList<>());
    for (Token token : tokens) {
      switch (token.kind) {
        case LPAREN:
          stack.push(new ArrayList<>());
          break;
        case RPAREN:
          if (stack.size() == 1) {
            throw error("unbalanced ')'");
          }
          {
            List<Object> group = stack.pop();
            stack.peek().add(reduce(group));
          }
          break;
        case NAME:
          if (KEYWORDS.contains(token.text)) {
            throw error("unexpected keyword '" + token.text + "'");
          }
          stack.peek().add(new Definition.Name(token.text));
          break;
        case NUMBER:
          try {
            stack.peek().add(new Definition.Literal(Long.parseLong(token.text)));
          } catch (NumberFormatException e) {
            throw error("number out of range: " + token.text);
          }
          break;
        case SYMBOL:
          stack.peek().add(token.text);
          break;
        default:
          throw error("unexpected '" + token.text + "' in expression");
      }
    }
    if (stack.size() != 1) {
      throw error("unbalanced '('");
    }
    return reduce(stack.pop());
  }

  private Term reduce(List<Object> items) throws SynthesisException {
    if (items.size() == 1 && items.get(0) instanceof Term) {
      return (Term) items.get(0);
    } else if (items.size() == 2
        && items.get(0) instanceof String
        && items.get(1) instanceof Term) {
      return new Definition.Unary((String) items.get(0), Fixity.PREFIX, (Term) items.get(1));
    } else if (items.size() == 2
        && items.get(0) instanceof Term
        && items.get(1) instanceof String) {
      return new Definition.Unary((String) items.get(1), Fixity.POSTFIX, (Term) items.get(0));
    } else if (items.size() == 3
        && items.get(0) instanceof Term
        && items.get(1) instanceof String
        && items.get(2) instanceof Term) {
      return new Definition.Binary(
          (String) items.get(1), (Term) items.get(0), (Term) items.get(2));
    }
    throw error("cannot group " + items.size() + " items without brackets");
  }

  private List<Token> tokenize(String source) throws SynthesisException {
    List<Token> tokens = new ArrayList<>();
    int i = 0;
    while (i < source.length()) {
      char c = source.charAt(i);
      if (CharMatcher.whitespace().matches(c)) {
        i++;
      } else if (PUNCTUATION.matches(c)) {
        if (c == '{' || c == '}') {
          throw error("nested braces");
        }
        tokens.add(new Token(punctuation(c), String.valueOf(c)));
        i++;
      } else {
        CharMatcher run = LETTER.matches(c) ? LETTER.or(DIGIT) : DIGIT.matches(c) ? DIGIT : SYMBOL;
        Kind kind = LETTER.matches(c) ? Kind.NAME : DIGIT.matches(c) ? Kind.NUMBER : Kind.SYMBOL;
        int end = run.negate().indexIn(source, i);
        if (end < 0) {
          end = source.length();
        }
        tokens.add(new Token(kind, source.substring(i, end)));
        i = end;
      }
    }
    return tokens;
  }

  private static Kind punctuation(char c) {
    switch (c) {
      case '(':
        return Kind.LPAREN;
      case ')':
        return Kind.RPAREN;
      case ',':
        return Kind.COMMA;
      default:
        return Kind.SEMICOLON;
    }
  }

  private static List<List<Token>> splitTopLevel(List<Token> tokens, Kind separator) {
    List<List<Token>> parts = new ArrayList<>();
    int depth = 0;
    int start = 0;
    for (int i = 0; i < tokens.size(); i++) {
      Kind kind = tokens.get(i).kind;
      if (kind == Kind.LPAREN) {
        depth++;
      } else if (kind == Kind.RPAREN) {
        depth--;
      } else if (kind == separator && depth == 0) {
        parts.add(tokens.subList(start, i));
        start = i + 1;
      }
    }
    parts.add(tokens.subList(start, tokens.size()));
    return parts;
  }

  private static List<List<Token>> splitKeyword(List<Token> tokens, String keyword) {
    List<List<Token>> parts = new ArrayList<>();
    int depth = 0;
    int start = 0;
    for (int i = 0; i < tokens.size(); i++) {
      Token token = tokens.get(i);
      if (token.kind == Kind.LPAREN) {
        depth++;
      } else if (token.kind == Kind.RPAREN) {
        depth--;
      } else if (token.isKeyword(keyword) && depth == 0) {
        parts.add(tokens.subList(start, i));
        start = i + 1;
      }
    }
    parts.add(tokens.subList(start, tokens.size()));
    return parts;
  }

  private static String join(List<Token> tokens) {
    StringBuilder sb = new StringBuilder();
    for (Token token : tokens) {
      sb.append(token.text);
    }
    return sb.toString();
  }

  private SynthesisException error(String msg) {
    return new SynthesisException(SynthesisException.Reason.SYNTAX_ERROR, msg + " in: " + text);
  }
}
