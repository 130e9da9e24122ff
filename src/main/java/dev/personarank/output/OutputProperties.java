package dev.personarank.output;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised limits of the assembled result, bound from {@code personarank.output.*}.
 *
 * <ul>
 *   <li>{@code max-body-length} - characters of section content kept in {@code
 *       extracted_sections} (default 1000)
 *   <li>{@code refined-text-length} - characters kept in {@code subsection_analysis} (default 300)
 *   <li>{@code subsection-count} - number of top sections echoed in {@code subsection_analysis}
 *       (default 5)
 * </ul>
 */
@Configuration
@ConfigurationProperties(prefix = "personarank.output")
public class OutputProperties {

  private int maxBodyLength = OutputAssembler.DEFAULT_MAX_BODY_LENGTH;
  private int refinedTextLength = OutputAssembler.DEFAULT_REFINED_TEXT_LENGTH;
  private int subsectionCount = OutputAssembler.DEFAULT_SUBSECTION_COUNT;

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  void validate() {
    if (maxBodyLength < 1 || maxBodyLength > OutputAssembler.DEFAULT_MAX_BODY_LENGTH) {
      throw new IllegalStateException(
          "personarank.output.max-body-length must be in [1, 1000], got: " + maxBodyLength);
    }
    if (refinedTextLength < 1) {
      throw new IllegalStateException(
          "personarank.output.refined-text-length must be positive, got: " + refinedTextLength);
    }
    if (subsectionCount < 0) {
      throw new IllegalStateException(
          "personarank.output.subsection-count must not be negative, got: " + subsectionCount);
    }
  }

  public int getMaxBodyLength() {
    return maxBodyLength;
  }

  public void setMaxBodyLength(int maxBodyLength) {
    this.maxBodyLength = maxBodyLength;
  }

  public int getRefinedTextLength() {
    return refinedTextLength;
  }

  public void setRefinedTextLength(int refinedTextLength) {
    this.refinedTextLength = refinedTextLength;
  }

  public int getSubsectionCount() {
    return subsectionCount;
  }

  public void setSubsectionCount(int subsectionCount) {
    this.subsectionCount = subsectionCount;
  }
}
