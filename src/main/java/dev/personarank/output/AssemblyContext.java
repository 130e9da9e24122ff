package dev.personarank.output;

import dev.personarank.persona.JobContext;
import dev.personarank.persona.PersonaProfile;
import dev.personarank.section.CandidateBatch;
import java.util.List;

/**
 * Run-level facts the assembler reports alongside the ranked sections.
 *
 * @param personaText the persona description as given
 * @param persona the resolved persona profile
 * @param job the analysed job-to-be-done
 * @param inputDocuments identifiers of the documents that took part in the run, in input order
 * @param batch validation statistics of the run's candidates
 */
public record AssemblyContext(
    String personaText,
    PersonaProfile persona,
    JobContext job,
    List<String> inputDocuments,
    CandidateBatch batch) {

  public AssemblyContext {
    personaText = personaText == null ? "" : personaText;
    inputDocuments = List.copyOf(inputDocuments);
  }
}
