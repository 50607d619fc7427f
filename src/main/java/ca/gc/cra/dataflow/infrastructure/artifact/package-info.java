/**
 * Artifact batching and file-system storage.
 * <p>Payloads are serialized with Jackson; see {@link ca.gc.cra.dataflow.infrastructure.artifact.ArtifactJson}.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.dataflow.infrastructure.artifact;
