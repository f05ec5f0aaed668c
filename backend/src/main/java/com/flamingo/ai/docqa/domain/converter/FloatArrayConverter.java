package com.flamingo.ai.docqa.domain.converter;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Base64;

/** JPA converter storing a {@code float[]} embedding as Base64 of little-endian IEEE 754 floats. */
@Converter
public class FloatArrayConverter implements AttributeConverter<float[], String> {

  @Override
  public String convertToDatabaseColumn(float[] attribute) {
    if (attribute == null) {
      return null;
    }
    ByteBuffer buffer =
        ByteBuffer.allocate(attribute.length * Float.BYTES).order(ByteOrder.LITTLE_ENDIAN);
    buffer.asFloatBuffer().put(attribute);
    return Base64.getEncoder().encodeToString(buffer.array());
  }

  @Override
  public float[] convertToEntityAttribute(String dbData) {
    if (dbData == null || dbData.isBlank()) {
      return null;
    }
    byte[] bytes = Base64.getDecoder().decode(dbData);
    if (bytes.length % Float.BYTES != 0) {
      throw new IllegalArgumentException(
          "Stored embedding has " + bytes.length + " bytes, not a multiple of " + Float.BYTES);
    }
    float[] vector = new float[bytes.length / Float.BYTES];
    ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN).asFloatBuffer().get(vector);
    return vector;
  }
}
