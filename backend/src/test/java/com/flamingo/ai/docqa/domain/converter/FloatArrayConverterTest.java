package com.flamingo.ai.docqa.domain.converter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Base64;
import org.junit.jupiter.api.Test;

class FloatArrayConverterTest {

  private final FloatArrayConverter converter = new FloatArrayConverter();

  @Test
  void shouldPreserveExactFloatValues() {
    float[] vector = {0.1f, -3.5e-8f, Float.MAX_VALUE, 0f};

    String stored = converter.convertToDatabaseColumn(vector);

    float[] restored = converter.convertToEntityAttribute(stored);

    assertThat(restored).containsExactly(vector);
  }

  @Test
  void shouldMapNullBothWays() {
    assertThat(converter.convertToDatabaseColumn(null)).isNull();
    assertThat(converter.convertToEntityAttribute(null)).isNull();
    assertThat(converter.convertToEntityAttribute(" ")).isNull();
  }

  @Test
  void shouldStoreLittleEndianBytes() {
    String encoded = converter.convertToDatabaseColumn(new float[] {1.0f});

    // 1.0f is 0x3F800000
    assertThat(Base64.getDecoder().decode(encoded)).containsExactly(0, 0, (byte) 0x80, 0x3F);
  }

  @Test
  void shouldRejectTruncatedData() {
    String threeBytes = Base64.getEncoder().encodeToString(new byte[] {1, 2, 3});

    assertThatThrownBy(() -> converter.convertToEntityAttribute(threeBytes))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
