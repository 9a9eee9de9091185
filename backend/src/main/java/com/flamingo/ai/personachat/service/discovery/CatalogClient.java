package com.flamingo.ai.personachat.service.discovery;

/** Paginated listing of a channel's uploads, newest first. */
public interface CatalogClient {

  /**
   * Fetches one page of a channel's videos.
   *
   * @param channelId channel to list
   * @param cursor opaque cursor from the previous page, or null for the first page
   * @return the page with its continuation cursor
   */
  CatalogPage listVideos(String channelId, String cursor);
}
