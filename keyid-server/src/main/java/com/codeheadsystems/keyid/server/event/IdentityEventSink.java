package com.codeheadsystems.keyid.server.event;

/**
 * Receives {@link IdentityEvent}s. Implementations usually forward to the application's
 * event dispatcher or audit log.
 */
@FunctionalInterface
public interface IdentityEventSink {

  void publish(IdentityEvent event);

  /**
   * A sink that drops every event.
   */
  static IdentityEventSink discarding() {
    return event -> {
    };
  }
}
