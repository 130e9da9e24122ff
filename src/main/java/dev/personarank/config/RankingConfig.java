package dev.personarank.config;

import dev.personarank.output.OutputAssembler;
import dev.personarank.output.OutputProperties;
import dev.personarank.persona.JobAnalyzer;
import dev.personarank.persona.PersonaCatalog;
import dev.personarank.persona.PersonaClassifier;
import dev.personarank.ranking.RankingProperties;
import dev.personarank.ranking.SectionRanker;
import dev.personarank.scoring.RelevanceScorer;
import dev.personarank.scoring.ScoringProperties;
import dev.personarank.section.SectionDetector;
import dev.personarank.section.SectionProperties;
import dev.personarank.section.SectionValidator;
import java.time.Clock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the framework-free ranking components from their externalised properties.
 *
 * <p>The persona table is built once here and handed to the classifier; no component reads it from
 * a global.
 */
@Configuration
public class RankingConfig {

  /** UTC clock for processing timestamps; tests replace it with a fixed clock. */
  @Bean
  @ConditionalOnMissingBean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public PersonaCatalog personaCatalog() {
    return PersonaCatalog.builtIn();
  }

  @Bean
  public PersonaClassifier personaClassifier(PersonaCatalog personaCatalog) {
    return new PersonaClassifier(personaCatalog);
  }

  @Bean
  public JobAnalyzer jobAnalyzer() {
    return new JobAnalyzer();
  }

  @Bean
  public SectionValidator sectionValidator(SectionProperties properties) {
    return new SectionValidator(properties.getMinBodyLength());
  }

  @Bean
  public SectionDetector sectionDetector() {
    return new SectionDetector();
  }

  @Bean
  public RelevanceScorer relevanceScorer(ScoringProperties properties) {
    return new RelevanceScorer(properties.toWeights());
  }

  @Bean
  public SectionRanker sectionRanker(RankingProperties properties) {
    return new SectionRanker(
        properties.getCap(),
        properties.getDiversificationWindow(),
        properties.getDiversificationTolerance());
  }

  @Bean
  public OutputAssembler outputAssembler(OutputProperties properties, Clock clock) {
    return new OutputAssembler(
        properties.getMaxBodyLength(),
        properties.getRefinedTextLength(),
        properties.getSubsectionCount(),
        clock);
  }
}
