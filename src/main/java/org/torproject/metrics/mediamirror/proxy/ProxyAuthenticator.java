/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.mediamirror.proxy;

import java.net.Authenticator;
import java.net.PasswordAuthentication;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Answers the JDK's credential requests for proxies whose pool entries carry
 * a user name and password.
 *
 * <p>SOCKS handshakes ask for credentials as a server request, so requests
 * are matched by host and port only.</p>
 */
public class ProxyAuthenticator extends Authenticator {

  private final Map<String, PasswordAuthentication> credentials
      = new HashMap<>();

  /** Collects credentials from all endpoints that have any. */
  public ProxyAuthenticator(List<ProxyEndpoint> endpoints) {
    for (ProxyEndpoint endpoint : endpoints) {
      if (endpoint.hasCredentials()) {
        this.credentials.put(key(endpoint.getHost(), endpoint.getPort()),
            new PasswordAuthentication(endpoint.getUsername(),
                endpoint.getPassword().toCharArray()));
      }
    }
  }

  /** Returns whether any endpoint carried credentials. */
  public boolean hasCredentials() {
    return !this.credentials.isEmpty();
  }

  @Override
  protected PasswordAuthentication getPasswordAuthentication() {
    if (null == getRequestingHost()) {
      return null;
    }
    return this.credentials.get(key(getRequestingHost(),
        getRequestingPort()));
  }

  PasswordAuthentication lookup(String host, int port) {
    return this.credentials.get(key(host, port));
  }

  private static String key(String host, int port) {
    return host.toLowerCase(Locale.US) + ":" + port;
  }
}
