package dev.personarank.section;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.jspecify.annotations.Nullable;

/**
 * A section as proposed by the section detection collaborator, before quality validation.
 *
 * <p>No checks are applied here: empty bodies, short bodies, noisy titles and non-positive page
 * numbers are legitimate inputs that {@link SectionValidator} filters out.
 *
 * @param title the section heading (nullable or empty when the detector found none)
 * @param body the section text (nullable when the detector produced nothing)
 * @param pageNumber the 1-based page the section starts on
 */
public record RawSection(
    @Nullable String title,
    @Nullable String body,
    @JsonProperty("page_number") int pageNumber) {}
