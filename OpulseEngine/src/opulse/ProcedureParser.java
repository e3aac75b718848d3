package opulse;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableList;

import opulse.Instruction.Primitive;

/** Parses the persisted s-expression form of a procedure. */
public final class ProcedureParser {

  public interface HandleResolver {
    Optional<OperatorHandle> handleFor(int id);
  }

  private static final CharMatcher DELIMITERS =
      CharMatcher.whitespace().or(CharMatcher.anyOf("()"));

  private final HandleResolver handles;
  private final String source;
  private final List<String> tokens = new ArrayList<>();
  private int next = 0;
  private ImmutableList<String> params = ImmutableList.of();

  private ProcedureParser(String source, HandleResolver handles) {
    this.source = source;
    this.handles = handles;
  }

  public static Procedure parse(String source, HandleResolver handles) throws SynthesisException {
    return new ProcedureParser(source, handles).parse();
  }

  private Procedure parse() throws SynthesisException {
    tokenize();
    expect("(");
    expect("proc");
    expect("(");
    ImmutableList.Builder<String> builder = ImmutableList.builder();
    while (!peek().equals(")")) {
      String param = advance();
      if (param.equals("(") || param.equals(Instruction.Accumulator.NAME) || isInteger(param)) {
        throw error("Invalid parameter name '" + param + "'");
      }
      builder.add(param);
    }
    expect(")");
    params = builder.build();
    if (params.isEmpty() || params.size() > 2) {
      throw error("Procedures take 1 or 2 parameters, got " + params.size());
    }
    if (params.stream().distinct().count() != params.size()) {
      throw error("Duplicate parameter names " + params);
    }
    Instruction body = parseInstruction();
    expect(")");
    if (next != tokens.size()) {
      throw error("Trailing input after procedure");
    }
    return new Procedure(params, body);
  }

  private void tokenize() {
    int i = 0;
    while (i < source.length()) {
      char c = source.charAt(i);
      if (CharMatcher.whitespace().matches(c)) {
        i++;
      } else if (c == '(' || c == ')') {
        tokens.add(String.valueOf(c));
        i++;
      } else {
        int end = DELIMITERS.indexIn(source, i);
        if (end < 0) {
          end = source.length();
        }
        tokens.add(source.substring(i, end));
        i = end;
      }
    }
  }

  private Instruction parseInstruction() throws SynthesisException {
    String token = advance();
    if (token.equals("(")) {
      Instruction compound = parseCompound(advance());
      expect(")");
      return compound;
    } else if (token.equals(")")) {
      throw error("Unexpected ')'");
    } else if (token.equals("nan")) {
      return Instruction.nan();
    } else if (token.equals(Instruction.Accumulator.NAME)) {
      return Instruction.accumulator();
    } else if (isInteger(token)) {
      try {
        return Instruction.constant(Long.parseLong(token));
      } catch (NumberFormatException e) {
        throw error("Integer literal out of range: " + token);
      }
    }
    int index = params.indexOf(token);
    if (index < 0) {
      throw error("Unknown name '" + token + "'");
    }
    return Instruction.parameter(index, token);
  }

  private Instruction parseCompound(String head) throws SynthesisException {
    Optional<Primitive> primitive = Primitive.forKeyword(head);
    if (primitive.isPresent()) {
      Primitive p = primitive.get();
      if (p.arity() == 1) {
        return Instruction.apply(p, parseInstruction());
      }
      return Instruction.apply(p, parseInstruction(), parseInstruction());
    }

    switch (head) {
      case "if":
        return Instruction.conditional(parseInstruction(), parseInstruction(), parseInstruction());
      case "repeat":
        return Instruction.repeat(parseInstruction(), parseInstruction(), parseInstruction());
      case "repeat-cost":
        return Instruction.repeatCost(
            parseInstruction(), parseInstruction(), parseInstruction(), parseInstruction());
      case "op":
        return parseCall(Slot.COMPUTE);
      case "cost":
        return parseCall(Slot.COST);
      default:
        throw error("Unknown form '" + head + "'");
    }
  }

  private Instruction parseCall(Slot slot) throws SynthesisException {
    String idToken = advance();
    if (!isInteger(idToken)) {
      throw error("Expected operator id, got '" + idToken + "'");
    }
    int id;
    try {
      id = Integer.parseInt(idToken);
    } catch (NumberFormatException e) {
      throw error("Operator id out of range: " + idToken);
    }
    int calleeId = id;
    OperatorHandle callee =
        handles
            .handleFor(calleeId)
            .orElseThrow(() -> error("Reference to unknown operator " + calleeId));
    List<Instruction> args = new ArrayList<>();
    while (!peek().equals(")")) {
      args.add(parseInstruction());
    }
    if (args.isEmpty() || args.size() > 2) {
      throw error("Calls take 1 or 2 arguments, got " + args.size());
    }
    return Instruction.call(slot, callee, args);
  }

  private static boolean isInteger(String token) {
    int start = token.startsWith("-") && token.length() > 1 ? 1 : 0;
    return !token.isEmpty() && CharMatcher.inRange('0', '9').matchesAllOf(token.substring(start));
  }

  private String peek() throws SynthesisException {
    if (next >= tokens.size()) {
      throw error("Unexpected end of input");
    }
    return tokens.get(next);
  }

  private String advance() throws SynthesisException {
    String token = peek();
    next++;
    return token;
  }

  private void expect(String expected) throws SynthesisException {
    String token = advance();
    if (!token.equals(expected)) {
      throw error("Expected '" + expected + "' but got '" + token + "'");
    }
  }

  private SynthesisException error(String msg) {
    return new SynthesisException(
        SynthesisException.Reason.COMPILE_FAILURE, msg + " in: " + source);
  }
}
