package com.flamingo.ai.talkpdf.service.storage;

import com.flamingo.ai.talkpdf.config.PipelineConfig;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Filesystem-backed {@link BlobStore}; references are paths relative to the base directory. */
@Service
@Slf4j
public class LocalBlobStore implements BlobStore {

  private final Path basePath;

  public LocalBlobStore(PipelineConfig pipelineConfig) {
    this.basePath = Paths.get(pipelineConfig.getStorage().getBasePath()).toAbsolutePath().normalize();
    log.info("Local blob store rooted at {}", basePath);
  }

  @Override
  public byte[] download(String ref) {
    Path path = resolve(ref);
    if (!Files.isRegularFile(path)) {
      throw new BlobStorageException("Blob not found: " + ref);
    }
    try {
      return Files.readAllBytes(path);
    } catch (IOException e) {
      throw new BlobStorageException("Failed to read blob " + ref, e);
    }
  }

  @Override
  public String upload(String ref, byte[] content, String contentType) {
    Path path = resolve(ref);
    try {
      Files.createDirectories(path.getParent());
      Files.write(path, content);
      log.debug("Stored blob {} ({} bytes, {})", ref, content.length, contentType);
      return ref;
    } catch (IOException e) {
      throw new BlobStorageException("Failed to write blob " + ref, e);
    }
  }

  private Path resolve(String ref) {
    if (ref == null || ref.isBlank()) {
      throw new BlobStorageException("Blob reference is empty");
    }
    Path path = basePath.resolve(ref).normalize();
    if (!path.startsWith(basePath)) {
      throw new BlobStorageException("Blob reference escapes storage root: " + ref);
    }
    return path;
  }
}
