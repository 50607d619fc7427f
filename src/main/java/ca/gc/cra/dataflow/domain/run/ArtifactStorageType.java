package ca.gc.cra.dataflow.domain.run;

/**
 * Storage backend an artifact save request is addressed to.
 *
 * @since 0.1.0
 */
public enum ArtifactStorageType {
  /** Object store; default for artifact requests. */
  S3,
  DATABASE,
  FILE_SYSTEM,
  MEMORY
}
