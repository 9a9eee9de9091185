package com.flamingo.ai.personachat.service.chat;

/**
 * A caption chunk that survived the similarity threshold for one question.
 *
 * @param videoId catalog id of the source video
 * @param title video title, or the placeholder when unknown
 * @param startTime chunk start in seconds
 * @param text transcript text
 * @param score cosine similarity to the question
 */
public record RetrievedExcerpt(
    String videoId, String title, double startTime, String text, double score) {}
