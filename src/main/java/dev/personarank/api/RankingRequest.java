package dev.personarank.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import dev.personarank.section.DocumentSections;
import jakarta.validation.constraints.NotNull;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Body of {@code POST /api/rankings}: a persona, a job and pre-segmented documents.
 *
 * @param persona the persona/role description (may be absent or empty)
 * @param jobToBeDone the job-to-be-done description (may be absent or empty)
 * @param documents the documents with their sections (may be empty, not null)
 */
public record RankingRequest(
    @JsonProperty("persona") @Nullable String persona,
    @JsonProperty("job_to_be_done") @Nullable String jobToBeDone,
    @NotNull @JsonProperty("documents") List<@NotNull DocumentSections> documents) {}
