package com.consullo.mirror.ipc;

/**
 * A capability reachable through a {@link RemoteEndpoint}.
 *
 * @since 1.0
 */
public interface RemoteInterface {

  RemoteEndpoint asEndpoint();
}
