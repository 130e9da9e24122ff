package dev.personarank.collection;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * JSON descriptor of one collection ({@code challenge1b_input.json}): the documents to rank, the
 * persona and the job-to-be-done.
 *
 * @param challengeInfo free-form descriptor echoed into the output
 * @param documents the PDF files of the collection (must not be empty)
 * @param persona the persona object; its role may be empty
 * @param jobToBeDone the job object; its task may be empty
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CollectionInput(
    @JsonProperty("challenge_info") @Nullable Map<String, Object> challengeInfo,
    @NotEmpty @Valid @JsonProperty("documents") List<DocumentRef> documents,
    @NotNull @Valid @JsonProperty("persona") Persona persona,
    @NotNull @Valid @JsonProperty("job_to_be_done") Job jobToBeDone) {

  /** A document of the collection, located under the collection's PDF directory. */
  @JsonIgnoreProperties(ignoreUnknown = true)
  public record DocumentRef(
      @NotBlank @JsonProperty("filename") String filename,
      @JsonProperty("title") @Nullable String title) {}

  /** The persona whose role drives classification. */
  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Persona(@JsonProperty("role") @Nullable String role) {}

  /** The task the persona wants to accomplish. */
  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Job(@JsonProperty("task") @Nullable String task) {}
}
