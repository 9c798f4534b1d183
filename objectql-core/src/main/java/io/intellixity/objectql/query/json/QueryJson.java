package io.intellixity.objectql.query.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamWriteFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import io.intellixity.objectql.query.FilterExpression;
import io.intellixity.objectql.query.NodePath;
import io.intellixity.objectql.query.QueryEnvelope;
import io.intellixity.objectql.query.QueryErrorCode;
import io.intellixity.objectql.query.QueryValidationException;

import java.io.UncheckedIOException;
import java.util.Map;

/**
 * Entry points for the query wire format: JSON text, plain nested {@code Map}/{@code List} values, or Jackson trees.
 * Boundary errors surface as {@link QueryValidationException} rather than Jackson exceptions.
 */
public final class QueryJson {
  private static final ObjectMapper MAPPER = JsonMapper.builder()
      .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
      .enable(StreamWriteFeature.WRITE_BIGDECIMAL_AS_PLAIN)
      .build();

  private static final QueryEnvelopeReader READER = new QueryEnvelopeReader();
  private static final QueryEnvelopeWriter WRITER = new QueryEnvelopeWriter();

  private QueryJson() {}

  public static ObjectMapper mapper() { return MAPPER; }

  public static QueryEnvelope parse(String json) {
    JsonNode root;
    try {
      root = MAPPER.readTree(json);
    } catch (JsonProcessingException e) {
      throw new QueryValidationException(QueryErrorCode.MALFORMED_NODE, NodePath.root(),
          "not valid JSON: " + e.getOriginalMessage(), e);
    }
    return READER.read(root);
  }

  /** Reads a query from a plain nested value structure (maps, lists, strings, numbers, booleans, nulls). */
  public static QueryEnvelope fromValue(Object value) {
    JsonNode root;
    try {
      root = MAPPER.valueToTree(value);
    } catch (IllegalArgumentException e) {
      throw new QueryValidationException(QueryErrorCode.MALFORMED_NODE, NodePath.root(),
          "not a JSON-compatible value: " + e.getMessage(), e);
    }
    return READER.read(root);
  }

  public static QueryEnvelope fromTree(JsonNode root) {
    return READER.read(root);
  }

  /** Reads a standalone filter (array or operator-object form, legacy infix accepted). */
  public static FilterExpression parseFilter(String json) {
    JsonNode root;
    try {
      root = MAPPER.readTree(json);
    } catch (JsonProcessingException e) {
      throw new QueryValidationException(QueryErrorCode.MALFORMED_NODE, NodePath.root(),
          "not valid JSON: " + e.getOriginalMessage(), e);
    }
    return FilterReader.readRequired(LegacyQueryTranslator.filter(root, NodePath.root()), NodePath.root());
  }

  public static JsonNode toTree(QueryEnvelope q) {
    return WRITER.write(q);
  }

  public static JsonNode toTree(FilterExpression e) {
    return WRITER.filter(e);
  }

  public static String toJson(QueryEnvelope q) {
    return write(WRITER.write(q));
  }

  public static String toJson(FilterExpression e) {
    return write(WRITER.filter(e));
  }

  /** Plain nested value rendition, the inverse of {@link #fromValue(Object)}. */
  @SuppressWarnings("unchecked")
  public static Map<String, Object> toValue(QueryEnvelope q) {
    return MAPPER.convertValue(WRITER.write(q), Map.class);
  }

  private static String write(JsonNode n) {
    try {
      return MAPPER.writeValueAsString(n);
    } catch (JsonProcessingException e) {
      throw new UncheckedIOException(e);
    }
  }
}
