package com.flamingo.ai.personachat.job.payload;

public record DiscoveryResult(
    int videosProcessed, int videosInserted, boolean hasMore, String continuationToken)
    implements JobResult {}
