package com.flamingo.ai.personachat.service.discovery;

import java.util.List;

/** One page of a channel catalog. {@code nextCursor} is null on the last page. */
public record CatalogPage(List<CatalogVideo> items, String nextCursor, boolean hasMore) {

  public CatalogPage {
    items = items == null ? List.of() : List.copyOf(items);
  }
}
