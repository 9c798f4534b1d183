package io.intellixity.objectql.query.json;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import io.intellixity.objectql.query.QueryEnvelope;

import java.io.IOException;

/** Canonical JSON serializer for {@link QueryEnvelope}. */
public final class QueryEnvelopeJsonSerializer extends JsonSerializer<QueryEnvelope> {
  private final QueryEnvelopeWriter writer = new QueryEnvelopeWriter();

  @Override
  public void serialize(QueryEnvelope q, JsonGenerator g, SerializerProvider serializers) throws IOException {
    if (q == null) {
      g.writeNull();
      return;
    }
    g.writeTree(writer.write(q));
  }
}
