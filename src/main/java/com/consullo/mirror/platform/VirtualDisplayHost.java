package com.consullo.mirror.platform;

/**
 * Host display manager able to create off-screen displays bound to a surface.
 *
 * @since 1.0
 */
public interface VirtualDisplayHost {

  /**
   * Creates a virtual display rendering into the given surface.
   *
   * @param name display name
   * @param width width in pixels
   * @param height height in pixels
   * @param dpi density
   * @param surface surface receiving the display contents
   * @param flags combination of {@link VirtualDisplayFlags}
   * @return display handle
   * @throws HostException if the display cannot be created
   */
  VirtualDisplayHandle createVirtualDisplay(
      final String name,
      final int width,
      final int height,
      final int dpi,
      final EncoderSurface surface,
      final int flags) throws HostException;
}
