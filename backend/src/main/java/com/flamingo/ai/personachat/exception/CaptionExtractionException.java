package com.flamingo.ai.personachat.exception;

/** Exception thrown when captions of a video cannot be extracted. */
public class CaptionExtractionException extends RuntimeException {

  private final String videoId;

  public CaptionExtractionException(String videoId, String message) {
    super(message);
    this.videoId = videoId;
  }

  public CaptionExtractionException(String videoId, String message, Throwable cause) {
    super(message, cause);
    this.videoId = videoId;
  }

  public String getVideoId() {
    return videoId;
  }
}
