package io.intellixity.unisql.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Parameter values as D1 accepts them: JSON scalars only. Booleans become 1/0, temporal and UUID
 * values their ISO/text form, and maps or collections JSON text.
 */
final class D1Parameters {
  private D1Parameters() {}

  static List<Object> convert(List<Object> params, ObjectMapper mapper) throws JsonProcessingException {
    if (params == null || params.isEmpty()) return List.of();
    List<Object> out = new ArrayList<>(params.size());
    for (Object v : params) out.add(convert(v, mapper));
    return out;
  }

  static Object convert(Object v, ObjectMapper mapper) throws JsonProcessingException {
    if (v instanceof Boolean b) return b ? 1 : 0;
    if (v instanceof UUID || v instanceof TemporalAccessor || v instanceof Enum<?>) return v.toString();
    if (v instanceof Map<?, ?> || v instanceof Collection<?>) return mapper.writeValueAsString(v);
    return v;
  }
}
