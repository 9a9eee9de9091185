package com.flamingo.ai.personachat.job.payload;

/**
 * @param captionsExtracted number of caption chunks stored for the video
 * @param alreadyProcessed true when stored chunks matched the fetched ones and nothing was written
 */
public record ExtractionResult(int captionsExtracted, boolean alreadyProcessed)
    implements JobResult {}
