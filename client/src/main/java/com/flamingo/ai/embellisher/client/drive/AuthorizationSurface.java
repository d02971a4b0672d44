package com.flamingo.ai.embellisher.client.drive;

import java.net.URI;

/** Somewhere the user can complete the provider's consent screen, such as a browser window. */
public interface AuthorizationSurface {

  void open(URI authorizationUrl);

  /** Closes the surface. Called once per {@link #open}, also when the flow gives up. */
  void close();
}
