package com.flamingo.ai.personachat.exception;

/** Exception thrown when a video is not found by its catalog id. */
public class VideoNotFoundException extends RuntimeException {

  private final String videoId;

  public VideoNotFoundException(String videoId) {
    super("Video not found: " + videoId);
    this.videoId = videoId;
  }

  public String getVideoId() {
    return videoId;
  }
}
