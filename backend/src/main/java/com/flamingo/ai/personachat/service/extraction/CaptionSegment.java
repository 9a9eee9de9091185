package com.flamingo.ai.personachat.service.extraction;

/** A timed transcript window; times in seconds. */
public record CaptionSegment(double start, double duration, String text) {}
