package com.consullo.mirror.capture;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for encode size alignment.
 *
 * @since 1.0
 */
public class DisplayGeometryTest {

  @Test
  @DisplayName("Should round each axis down to a multiple of 8")
  void aligned_OddHeight_RoundsDown() {
    final DisplayGeometry geometry = DisplayGeometry.aligned(1080, 2317);

    assertThat(geometry.width()).isEqualTo(1080);
    assertThat(geometry.height()).isEqualTo(2312);
  }

  @Test
  @DisplayName("Should keep already aligned sizes")
  void aligned_AlignedSize_Unchanged() {
    assertThat(DisplayGeometry.aligned(720, 1280)).isEqualTo(new DisplayGeometry(720, 1280));
  }

  @Test
  @DisplayName("Should floor tiny and non-positive sizes at 2")
  void aligned_TinySizes_FlooredAtTwo() {
    assertThat(DisplayGeometry.aligned(7, 5)).isEqualTo(new DisplayGeometry(2, 2));
    assertThat(DisplayGeometry.aligned(0, -16)).isEqualTo(new DisplayGeometry(2, 2));
    assertThat(DisplayGeometry.aligned(8, 15)).isEqualTo(new DisplayGeometry(8, 8));
  }
}
