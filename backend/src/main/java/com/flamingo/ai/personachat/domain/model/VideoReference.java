package com.flamingo.ai.personachat.domain.model;

/**
 * A validated citation of a video moment attached to an assistant message.
 *
 * @param videoId catalog id of the cited video
 * @param timestamp start of the cited caption window, in seconds
 * @param confidence how strongly the answer relies on the excerpt, between 0 and 1
 * @param title video title shown to the user
 */
public record VideoReference(String videoId, double timestamp, double confidence, String title) {}
