package dev.personarank.api;

import dev.personarank.output.RankingResult;
import dev.personarank.pipeline.RankingPipeline;
import jakarta.validation.Valid;
import org.springframework.context.annotation.Profile;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Ranks already segmented documents over HTTP with the same pipeline as batch mode. */
@RestController
@RequestMapping("/api")
@Profile("web")
public class RankingController {

  private final RankingPipeline pipeline;

  public RankingController(RankingPipeline pipeline) {
    this.pipeline = pipeline;
  }

  /**
   * Ranks the sections of the request's documents.
   *
   * @param request persona, job and documents
   * @return the ranking result
   */
  @PostMapping(
      path = "/rankings",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  public RankingResult rank(@Valid @RequestBody RankingRequest request) {
    return pipeline.rank(request.persona(), request.jobToBeDone(), request.documents());
  }
}
