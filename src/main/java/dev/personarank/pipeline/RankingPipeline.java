package dev.personarank.pipeline;

import dev.personarank.output.AssemblyContext;
import dev.personarank.output.OutputAssembler;
import dev.personarank.output.RankingResult;
import dev.personarank.persona.JobAnalyzer;
import dev.personarank.persona.JobContext;
import dev.personarank.persona.PersonaClassifier;
import dev.personarank.persona.PersonaProfile;
import dev.personarank.ranking.RankedOutput;
import dev.personarank.ranking.SectionRanker;
import dev.personarank.scoring.RelevanceScorer;
import dev.personarank.scoring.ScoredSection;
import dev.personarank.section.CandidateBatch;
import dev.personarank.section.DocumentSections;
import dev.personarank.section.SectionValidator;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs the ranking core for one collection: validate candidates -> classify the persona once ->
 * analyse the job once -> score every candidate -> rank and select -> assemble the result.
 *
 * <p>The pipeline keeps no state between calls; each call owns its persona profile, job context and
 * candidates, so different collections can be ranked concurrently on the same instance.
 */
@Service
public class RankingPipeline {

  private static final Logger log = LoggerFactory.getLogger(RankingPipeline.class);

  private final SectionValidator validator;
  private final PersonaClassifier personaClassifier;
  private final JobAnalyzer jobAnalyzer;
  private final RelevanceScorer scorer;
  private final SectionRanker ranker;
  private final OutputAssembler assembler;

  public RankingPipeline(
      SectionValidator validator,
      PersonaClassifier personaClassifier,
      JobAnalyzer jobAnalyzer,
      RelevanceScorer scorer,
      SectionRanker ranker,
      OutputAssembler assembler) {
    this.validator = validator;
    this.personaClassifier = personaClassifier;
    this.jobAnalyzer = jobAnalyzer;
    this.scorer = scorer;
    this.ranker = ranker;
    this.assembler = assembler;
  }

  /**
   * Ranks the sections of one collection for a persona and job.
   *
   * @param personaText the persona/role description (may be empty)
   * @param jobText the job-to-be-done description (may be empty)
   * @param documents the collection's documents with their detected sections
   * @return the assembled result; empty sections when no candidate survives validation
   */
  public RankingResult rank(
      @Nullable String personaText, @Nullable String jobText, List<DocumentSections> documents) {
    CandidateBatch batch = validator.validate(documents);
    PersonaProfile persona = personaClassifier.classify(personaText);
    JobContext job = jobAnalyzer.analyze(jobText);

    List<ScoredSection> scored = scorer.scoreAll(batch.accepted(), persona, job);
    RankedOutput ranked = ranker.rankAndSelect(scored);

    log.info(
        "Ranked {} candidates ({} rejected) for persona {}: {} sections retained",
        batch.accepted().size(),
        batch.rejected(),
        persona.category().value(),
        ranked.size());

    List<String> documentIds = documents.stream().map(DocumentSections::documentId).toList();
    AssemblyContext context =
        new AssemblyContext(personaText, persona, job, documentIds, batch);
    return assembler.assemble(ranked, context);
  }
}
