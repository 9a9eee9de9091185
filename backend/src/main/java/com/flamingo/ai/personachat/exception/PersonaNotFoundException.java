package com.flamingo.ai.personachat.exception;

import java.util.UUID;

/** Exception thrown when a persona is not found by id or username. */
public class PersonaNotFoundException extends RuntimeException {

  private final String reference;

  public PersonaNotFoundException(UUID personaId) {
    this(String.valueOf(personaId));
  }

  public PersonaNotFoundException(String reference) {
    super("Persona not found: " + reference);
    this.reference = reference;
  }

  /** Id or username the lookup was made with. */
  public String getReference() {
    return reference;
  }
}
