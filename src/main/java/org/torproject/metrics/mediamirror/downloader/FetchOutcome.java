/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.mediamirror.downloader;

import com.fasterxml.jackson.databind.JsonNode;

/** Result of one logical Graph API request including all of its retries. */
public final class FetchOutcome {

  /** Terminal state of a logical request. */
  public enum State {

    /** A 2xx response without error envelope was received. */
    SUCCESS,

    /** A non-retryable response or error was received. */
    FATAL,

    /** The retry budget ran out. */
    EXHAUSTED
  }

  private final State state;

  private final int retries;

  private final JsonNode body;

  FetchOutcome(State state, int retries, JsonNode body) {
    this.state = state;
    this.retries = retries;
    this.body = body;
  }

  static FetchOutcome success(int retries, JsonNode body) {
    return new FetchOutcome(State.SUCCESS, retries, body);
  }

  static FetchOutcome fatal(int retries) {
    return new FetchOutcome(State.FATAL, retries, null);
  }

  static FetchOutcome exhausted(int retries) {
    return new FetchOutcome(State.EXHAUSTED, retries, null);
  }

  public State getState() {
    return this.state;
  }

  public boolean isSuccess() {
    return State.SUCCESS == this.state;
  }

  /** Returns how many attempts were repeated before reaching the state. */
  public int getRetries() {
    return this.retries;
  }

  /** Returns the parsed response, or {@code null} unless successful. */
  public JsonNode getBody() {
    return this.body;
  }

  @Override
  public String toString() {
    return this.state + " after " + this.retries + " retries";
  }
}
