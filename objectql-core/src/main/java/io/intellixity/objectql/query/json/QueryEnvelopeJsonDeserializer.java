package io.intellixity.objectql.query.json;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;
import io.intellixity.objectql.query.QueryEnvelope;

import java.io.IOException;

/**
 * Canonical JSON deserializer for {@link QueryEnvelope}. Also accepts operator-object filters and the legacy
 * tuple shape, see {@link QueryEnvelopeReader}.
 */
public final class QueryEnvelopeJsonDeserializer extends JsonDeserializer<QueryEnvelope> {
  private final QueryEnvelopeReader reader = new QueryEnvelopeReader();

  @Override
  public QueryEnvelope deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
    JsonNode root = p.getCodec().readTree(p);
    if (root == null || root.isNull()) return null;
    return reader.read(root);
  }
}
