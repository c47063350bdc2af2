package com.worksync.collaboration.realtime;

import java.io.IOException;

/** Transport handle of one live connection. Implementations must be safe for concurrent sends. */
public interface ConnectionChannel {

  String id();

  boolean isOpen();

  void send(OutboundEvent event) throws IOException;
}
