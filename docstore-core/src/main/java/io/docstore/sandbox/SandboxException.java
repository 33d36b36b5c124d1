package io.docstore.sandbox;

/**
 * Thrown when a sandbox fails before a maintenance procedure could report an outcome.
 */
public final class SandboxException extends RuntimeException {

  public SandboxException(String message) {
    super(message);
  }

  public SandboxException(String message, Throwable cause) {
    super(message, cause);
  }
}
