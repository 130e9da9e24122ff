package dev.personarank.collection;

/**
 * Hard failure of a single collection: its input could not be read, failed validation, or one of
 * its documents could not be extracted. Other collections of the same batch are unaffected.
 */
public class CollectionProcessingException extends RuntimeException {

  public CollectionProcessingException(String message) {
    super(message);
  }

  public CollectionProcessingException(String message, Throwable cause) {
    super(message, cause);
  }
}
