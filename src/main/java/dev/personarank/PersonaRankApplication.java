package dev.personarank;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Entry point for the persona-aware section ranking application.
 *
 * <p>Supports two Spring profiles: {@code batch} (ranks every collection directory under the
 * input directory, then exits) and {@code web} (REST endpoint on port 8080).
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class PersonaRankApplication {
  public static void main(String[] args) {
    SpringApplication.run(PersonaRankApplication.class, args);
  }
}
