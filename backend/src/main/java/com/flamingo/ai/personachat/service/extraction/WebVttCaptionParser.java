package com.flamingo.ai.personachat.service.extraction;

import com.flamingo.ai.personachat.config.PipelineConfig;
import com.google.common.annotations.VisibleForTesting;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Turns WebVTT subtitles into overlapping fixed-length transcript windows.
 *
 * <p>Cues are placed on a timeline by start time. Windows of {@code chunkSeconds} advance by
 * {@code chunkSeconds * (1 - overlap)}; each window after the first is prefixed with the cues of
 * the overlap region before it. Windows without cues are skipped.
 */
@Component
public class WebVttCaptionParser {

  private static final Pattern CUE_TIMING =
      Pattern.compile(
          "((?:\\d{1,2}:)?\\d{2}:\\d{2}[.,]\\d{3})\\s*-->\\s*"
              + "((?:\\d{1,2}:)?\\d{2}:\\d{2}[.,]\\d{3})");
  private static final Pattern INLINE_TIMESTAMP = Pattern.compile("<[\\d:.]+>");
  private static final Pattern STYLE_TAG = Pattern.compile("</?c(\\.[^>]*)?>");
  private static final Pattern CUE_NUMBER = Pattern.compile("^\\d+$");

  /** Seconds past the last cue still covered by a window. */
  private static final double TAIL_SECONDS = 10;

  private final double chunkSeconds;
  private final double overlap;

  @Autowired
  public WebVttCaptionParser(PipelineConfig pipelineConfig) {
    this(
        pipelineConfig.getExtraction().getChunkSeconds(),
        pipelineConfig.getExtraction().getChunkOverlap());
  }

  @VisibleForTesting
  public WebVttCaptionParser(double chunkSeconds, double overlap) {
    if (chunkSeconds <= 0) {
      throw new IllegalArgumentException("chunkSeconds must be positive");
    }
    if (overlap < 0 || overlap >= 1) {
      throw new IllegalArgumentException("overlap must be in [0, 1)");
    }
    this.chunkSeconds = chunkSeconds;
    this.overlap = overlap;
  }

  public List<CaptionSegment> parse(String webVtt) {
    List<Cue> cues = parseCues(webVtt);
    if (cues.isEmpty()) {
      return List.of();
    }
    cues.sort(Comparator.comparingDouble(Cue::start));

    double overlapSeconds = chunkSeconds * overlap;
    double step = chunkSeconds - overlapSeconds;
    double lastStart = cues.get(cues.size() - 1).start();

    List<CaptionSegment> segments = new ArrayList<>();
    for (double windowStart = 0; windowStart < lastStart + TAIL_SECONDS; windowStart += step) {
      String body = textBetween(cues, windowStart, windowStart + chunkSeconds);
      if (body.isEmpty()) {
        continue;
      }
      String text = body;
      if (!segments.isEmpty()) {
        String carried = textBetween(cues, windowStart - overlapSeconds, windowStart);
        if (!carried.isEmpty()) {
          text = carried + " " + body;
        }
      }
      segments.add(new CaptionSegment(Math.round(windowStart), chunkSeconds, text));
    }
    return segments;
  }

  private static String textBetween(List<Cue> cues, double from, double to) {
    StringBuilder text = new StringBuilder();
    for (Cue cue : cues) {
      if (cue.start() >= from && cue.start() < to) {
        if (text.length() > 0) {
          text.append(' ');
        }
        text.append(cue.text());
      }
    }
    return text.toString().trim();
  }

  private static List<Cue> parseCues(String webVtt) {
    List<Cue> cues = new ArrayList<>();
    if (webVtt == null || webVtt.isBlank()) {
      return cues;
    }
    String[] lines = webVtt.split("\\r?\\n");
    Double start = null;
    StringBuilder text = new StringBuilder();

    for (String raw : lines) {
      String line = raw.trim();
      Matcher timing = CUE_TIMING.matcher(line);
      if (timing.find()) {
        addCue(cues, start, text);
        start = toSeconds(timing.group(1));
        text.setLength(0);
      } else if (line.isEmpty()) {
        addCue(cues, start, text);
        start = null;
        text.setLength(0);
      } else if (start != null && !CUE_NUMBER.matcher(line).matches()) {
        String clean =
            STYLE_TAG.matcher(INLINE_TIMESTAMP.matcher(line).replaceAll("")).replaceAll("").trim();
        if (!clean.isEmpty()) {
          if (text.length() > 0) {
            text.append(' ');
          }
          text.append(clean);
        }
      }
    }
    addCue(cues, start, text);
    return cues;
  }

  private static void addCue(List<Cue> cues, Double start, StringBuilder text) {
    if (start != null && !text.toString().isBlank()) {
      cues.add(new Cue(start, text.toString().trim()));
    }
  }

  /** Parses {@code hh:mm:ss.mmm} or {@code mm:ss.mmm}. */
  static double toSeconds(String timestamp) {
    String[] parts = timestamp.replace(',', '.').split(":");
    double seconds = Double.parseDouble(parts[parts.length - 1]);
    int minutes = Integer.parseInt(parts[parts.length - 2]);
    int hours = parts.length > 2 ? Integer.parseInt(parts[0]) : 0;
    return hours * 3600 + minutes * 60 + seconds;
  }

  private record Cue(double start, String text) {}
}
