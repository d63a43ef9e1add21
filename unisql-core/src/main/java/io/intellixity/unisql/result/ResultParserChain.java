package io.intellixity.unisql.result;

import io.intellixity.unisql.driver.Operation;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Ordered composition of parsers. Each parser's {@code next} invokes the following parser; the
 * caller-supplied {@code next} (identity by default) terminates the chain.
 */
public final class ResultParserChain implements ResultParser {
  private final List<ResultParser> parsers;

  public ResultParserChain(List<? extends ResultParser> parsers) {
    Objects.requireNonNull(parsers, "parsers");
    this.parsers = List.copyOf(parsers);
  }

  public static ResultParser of(ResultParser... parsers) {
    if (parsers == null || parsers.length == 0) return NONE;
    if (parsers.length == 1) return Objects.requireNonNull(parsers[0], "parsers[0]");
    return new ResultParserChain(List.of(parsers));
  }

  public List<ResultParser> parsers() { return parsers; }

  public ResultParserChain then(ResultParser next) {
    List<ResultParser> out = new ArrayList<>(parsers);
    out.add(Objects.requireNonNull(next, "next"));
    return new ResultParserChain(out);
  }

  @Override
  public Object parseResult(Object raw, Operation operation, ParseStep<Operation> terminal) {
    return resultStep(0, terminal).apply(raw, operation);
  }

  @Override
  public Object parseRelation(Object value, RelationType type, ParseStep<RelationType> terminal) {
    return relationStep(0, terminal).apply(value, type);
  }

  @Override
  public Object parseField(Object value, String fieldType, ParseStep<String> terminal) {
    return fieldStep(0, terminal).apply(value, fieldType);
  }

  private ParseStep<Operation> resultStep(int index, ParseStep<Operation> terminal) {
    if (index >= parsers.size()) return terminal;
    ResultParser p = parsers.get(index);
    return (v, k) -> p.parseResult(v, k, resultStep(index + 1, terminal));
  }

  private ParseStep<RelationType> relationStep(int index, ParseStep<RelationType> terminal) {
    if (index >= parsers.size()) return terminal;
    ResultParser p = parsers.get(index);
    return (v, k) -> p.parseRelation(v, k, relationStep(index + 1, terminal));
  }

  private ParseStep<String> fieldStep(int index, ParseStep<String> terminal) {
    if (index >= parsers.size()) return terminal;
    ResultParser p = parsers.get(index);
    return (v, k) -> p.parseField(v, k, fieldStep(index + 1, terminal));
  }
}
