package io.intellixity.objectql.validation.metadata;

/**
 * SPI to the schema/metadata service. Implementations answer existence questions only; the query IR never loads
 * metadata itself.
 */
public interface MetadataResolver {
  boolean hasObject(String object);

  /**
   * @param fieldPath a column of {@code object}, or a dotted path through its relations ({@code owner.email})
   */
  boolean hasField(String object, String fieldPath);
}
