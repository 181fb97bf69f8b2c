package com.dronetrack.tracker.cot;

import java.io.Closeable;

/** Outbound channel for encoded CoT events. Implementations do not retry. */
public interface CotTransport extends Closeable {

  /**
   * Sends one encoded event.
   *
   * @throws java.io.UncheckedIOException when the event could not be handed to the network
   */
  void sendEvent(byte[] event);

  @Override
  void close();
}
