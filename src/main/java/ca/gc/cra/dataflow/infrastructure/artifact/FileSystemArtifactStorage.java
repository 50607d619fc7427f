package ca.gc.cra.dataflow.infrastructure.artifact;

import ca.gc.cra.dataflow.application.port.ArtifactStoragePort;
import ca.gc.cra.dataflow.domain.run.ArtifactSaveRequest;
import ca.gc.cra.dataflow.domain.run.ArtifactSaveResult;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link ArtifactStoragePort} writing each artifact as a JSON file under
 * {@code <root>/<resourceRunId>/<step>/<artifact>.json}.
 * <p><strong>Thread-safety:</strong> Files are written to a temporary sibling and moved into place, so a reader
 * never sees a partial artifact. Concurrent saves of the same key keep the last writer.</p>
 *
 * @since 0.1.0
 */
public final class FileSystemArtifactStorage implements ArtifactStoragePort {
  private static final Logger log = LoggerFactory.getLogger(FileSystemArtifactStorage.class);
  private static final Pattern UNSAFE = Pattern.compile("[^A-Za-z0-9._-]");
  private static final String SUFFIX = ".json";

  private final Path root;

  /**
   * Creates storage rooted at {@code root}; the directory is created on first save.
   *
   * @param root artifact directory
   */
  public FileSystemArtifactStorage(Path root) {
    this.root = Objects.requireNonNull(root, "root").toAbsolutePath().normalize();
  }

  public Path root() {
    return root;
  }

  @Override
  public ArtifactSaveResult save(ArtifactSaveRequest request) throws IOException {
    Path target = resolve(request);
    Files.createDirectories(target.getParent());
    Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
    ArtifactJson.mapper().writeValue(tmp.toFile(), request.data());
    Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    log.debug("Artifact written to {}", target);
    return ArtifactSaveResult.stored(request, target.toUri().toString());
  }

  /**
   * Computes the file an artifact is stored in.
   *
   * @param request artifact request
   * @return absolute path of the artifact file
   */
  public Path resolve(ArtifactSaveRequest request) {
    return root
        .resolve(ArtifactJson.compact(request.resourceRunId()))
        .resolve(safe(request.stepName()))
        .resolve(safe(request.artifactName()) + SUFFIX);
  }

  static String safe(String segment) {
    String cleaned = UNSAFE.matcher(segment).replaceAll("_");
    if (cleaned.isEmpty() || cleaned.equals(".") || cleaned.equals("..")) {
      return "_" + cleaned;
    }
    return cleaned;
  }
}
