package io.trading.rofex.client.dispatch;

import io.trading.rofex.protocol.error.RofexException;

/**
 * Receives faults raised while the session runs: handler failures, undecodable frames
 * and transport errors the session recovers from. Only one can be set per session.
 */
@FunctionalInterface
public interface ExceptionHandler {

    void onException(RofexException exception);
}
