package com.xing.warren;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Objects;

/** A broker address. Only {@code amqp} and {@code amqps} URIs are accepted. */
public final class Endpoint {

  private final URI uri;

  private Endpoint(URI uri) {
    this.uri = uri;
  }

  public static Endpoint of(String url) {
    Objects.requireNonNull(url, "url");
    try {
      return of(new URI(url.trim()));
    } catch (URISyntaxException e) {
      throw new IllegalArgumentException("Invalid broker url " + url, e);
    }
  }

  public static Endpoint of(URI uri) {
    Objects.requireNonNull(uri, "uri");
    String scheme = uri.getScheme();
    if (!"amqp".equalsIgnoreCase(scheme) && !"amqps".equalsIgnoreCase(scheme)) {
      throw new IllegalArgumentException("Broker url must use amqp or amqps scheme: " + uri);
    }
    if (uri.getHost() == null) {
      throw new IllegalArgumentException("Broker url has no host: " + uri);
    }
    return new Endpoint(uri);
  }

  public URI getUri() {
    return uri;
  }

  public String getUrl() {
    return uri.toString();
  }

  /** The url without user info, safe to log. */
  public String getDisplayName() {
    int port = uri.getPort();
    return uri.getScheme() + "://" + uri.getHost() + (port > 0 ? ":" + port : "");
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    return uri.equals(((Endpoint) obj).uri);
  }

  @Override
  public int hashCode() {
    return uri.hashCode();
  }

  @Override
  public String toString() {
    return getDisplayName();
  }
}
