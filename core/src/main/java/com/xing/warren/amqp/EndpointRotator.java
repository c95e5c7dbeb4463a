package com.xing.warren.amqp;

import static java.util.Objects.requireNonNull;

import com.xing.warren.Endpoint;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.IntSupplier;

/**
 * Picks the broker for a connection attempt. Selection is keyed by the retry counter of the owning
 * {@link ConnectionManager}: counter {@code 1} maps to the first endpoint, {@code 2} to the second,
 * wrapping around after the last one.
 */
public class EndpointRotator {

  private final List<Endpoint> endpoints;
  private final IntSupplier retryCounter;

  public EndpointRotator(List<Endpoint> endpoints, IntSupplier retryCounter) {
    requireNonNull(endpoints, "endpoints");
    if (endpoints.isEmpty()) {
      throw new IllegalArgumentException("At least one broker endpoint must be configured.");
    }
    this.endpoints = Collections.unmodifiableList(new ArrayList<>(endpoints));
    this.retryCounter = requireNonNull(retryCounter, "retryCounter");
  }

  public Endpoint next() {
    return endpointFor(retryCounter.getAsInt());
  }

  public Endpoint endpointFor(int attempt) {
    return endpoints.get(Math.floorMod(attempt - 1, endpoints.size()));
  }

  public List<Endpoint> getEndpoints() {
    return endpoints;
  }
}
