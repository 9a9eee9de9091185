package com.flamingo.ai.personachat.agent;

import com.flamingo.ai.personachat.agent.dto.CitationSelection;
import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/**
 * AI agent that picks which retrieved transcript excerpts a finished answer relied on. Runs
 * against the JSON-mode chat model.
 */
public interface CitationExtractionAgent {

  @SystemMessage(
      """
        You identify which video transcript excerpts an answer is based on.

        Rules:
        1. Only cite excerpts from the list you are given; copy videoId and timestamp exactly
        2. Cite at most 5 excerpts, most relevant first
        3. Skip excerpts the answer does not actually use
        4. confidence is a number between 0.0 and 1.0 describing how clearly the answer uses it
        5. If the answer uses none of the excerpts, return an empty list

        Return a JSON object with a "citations" array of objects with fields
        videoId (string), timestamp (number, seconds) and confidence (number).
        Example: {"citations": [{"videoId": "dQw4w9WgXcQ", "timestamp": 42.0, "confidence": 0.9}]}
        """)
  @UserMessage(
      """
        Answer:
        {{answer}}

        Excerpts:
        {{excerpts}}
        """)
  CitationSelection selectCitations(@V("answer") String answer, @V("excerpts") String excerpts);
}
