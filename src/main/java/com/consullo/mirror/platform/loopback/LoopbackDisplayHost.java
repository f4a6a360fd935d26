package com.consullo.mirror.platform.loopback;

import com.consullo.mirror.platform.EncoderSurface;
import com.consullo.mirror.platform.HostException;
import com.consullo.mirror.platform.VirtualDisplayHandle;
import com.consullo.mirror.platform.VirtualDisplayHost;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Display manager that hands out increasing display ids and remembers what it created.
 *
 * @since 1.0
 */
public final class LoopbackDisplayHost implements VirtualDisplayHost {

  private static final Logger LOGGER = LoggerFactory.getLogger(LoopbackDisplayHost.class);

  // display 0 is the built-in panel
  private final AtomicInteger nextDisplayId = new AtomicInteger(2);
  private final List<LoopbackDisplay> created = new CopyOnWriteArrayList<>();

  @Override
  public VirtualDisplayHandle createVirtualDisplay(
      String name, int width, int height, int dpi, EncoderSurface surface, int flags) throws HostException {
    if (surface == null) {
      throw new HostException("surface must not be null");
    }
    if (width <= 0 || height <= 0 || dpi <= 0) {
      throw new HostException("Invalid display geometry " + width + "x" + height + " dpi=" + dpi);
    }
    LoopbackDisplay display = new LoopbackDisplay(nextDisplayId.getAndIncrement(), name, width, height, dpi, flags);
    created.add(display);
    LOGGER.debug("Created loopback display {} ({}x{} dpi={} flags=0x{})",
        display.displayId(), width, height, dpi, Integer.toHexString(flags));
    return display;
  }

  public List<LoopbackDisplay> createdDisplays() {
    return List.copyOf(created);
  }

  public long activeDisplayCount() {
    return created.stream().filter(d -> !d.isReleased()).count();
  }

  /**
   * Display created by {@link LoopbackDisplayHost}.
   */
  public static final class LoopbackDisplay implements VirtualDisplayHandle {

    private final int displayId;
    private final String name;
    private final int width;
    private final int height;
    private final int dpi;
    private final int flags;
    private volatile boolean released;

    LoopbackDisplay(int displayId, String name, int width, int height, int dpi, int flags) {
      this.displayId = displayId;
      this.name = name;
      this.width = width;
      this.height = height;
      this.dpi = dpi;
      this.flags = flags;
    }

    @Override
    public int displayId() {
      return displayId;
    }

    @Override
    public void release() {
      released = true;
    }

    public boolean isReleased() {
      return released;
    }

    public String name() {
      return name;
    }

    public int width() {
      return width;
    }

    public int height() {
      return height;
    }

    public int dpi() {
      return dpi;
    }

    public int flags() {
      return flags;
    }
  }
}
