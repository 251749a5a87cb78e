package com.flamingo.ai.deepresearch.domain.converter;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/** Stores an embedding vector as a little-endian float32 BLOB. */
@Converter
public class EmbeddingVectorConverter implements AttributeConverter<float[], byte[]> {

  @Override
  public byte[] convertToDatabaseColumn(float[] attribute) {
    if (attribute == null) {
      return null;
    }
    ByteBuffer buffer =
        ByteBuffer.allocate(attribute.length * Float.BYTES).order(ByteOrder.LITTLE_ENDIAN);
    buffer.asFloatBuffer().put(attribute);
    return buffer.array();
  }

  @Override
  public float[] convertToEntityAttribute(byte[] dbData) {
    if (dbData == null) {
      return null;
    }
    if (dbData.length % Float.BYTES != 0) {
      throw new IllegalArgumentException(
          "Embedding blob length " + dbData.length + " is not a multiple of " + Float.BYTES);
    }
    float[] vector = new float[dbData.length / Float.BYTES];
    ByteBuffer.wrap(dbData).order(ByteOrder.LITTLE_ENDIAN).asFloatBuffer().get(vector);
    return vector;
  }
}
