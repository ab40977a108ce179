package com.snipebot.bridge;

import java.util.concurrent.CompletableFuture;

public interface SearchClient {

  /**
   * One page of a catalog search. The future completes off the calling thread.
   *
   * @param proxy proxy URL to route through, or {@code null} for a direct request
   */
  CompletableFuture<BridgeResult> search(String endpointUrl, int page, String proxy);
}
