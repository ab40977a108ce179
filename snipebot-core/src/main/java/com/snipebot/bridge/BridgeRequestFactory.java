package com.snipebot.bridge;

import lombok.NonNull;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpRequest;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;

public final class BridgeRequestFactory {

  private final URI baseUri;

  public BridgeRequestFactory(@NonNull URI baseUri) {
    this.baseUri = Objects.requireNonNull(baseUri, "baseUri");
  }

  public HttpRequest.Builder request(String path, Map<String, String> query) {
    return HttpRequest.newBuilder(uri(path, query));
  }

  URI uri(String path, Map<String, String> query) {
    String base = baseUri.toString();
    if (base.endsWith("/")) {
      base = base.substring(0, base.length() - 1);
    }
    String normalizedPath = path.startsWith("/") ? path : "/" + path;
    if (query == null || query.isEmpty()) {
      return URI.create(base + normalizedPath);
    }
    StringJoiner qs = new StringJoiner("&");
    query.forEach((k, v) -> {
      if (v != null) {
        qs.add(encode(k) + "=" + encode(v));
      }
    });
    return URI.create(base + normalizedPath + "?" + qs);
  }

  private static String encode(String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8);
  }
}
