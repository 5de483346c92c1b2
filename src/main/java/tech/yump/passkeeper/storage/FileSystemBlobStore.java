package tech.yump.passkeeper.storage;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;

/**
 * Keeps blobs as files below a base directory, one subdirectory per owner.
 * Intended for development and tests; production deployments use {@link S3BlobStore}.
 */
@Slf4j
public class FileSystemBlobStore implements BlobStore {

  private final Path basePath;

  public FileSystemBlobStore(String basePath) {
    this.basePath = Paths.get(basePath)
            .toAbsolutePath()
            .normalize();
    log.info("FileSystemBlobStore initialized with base path: {}", this.basePath);
  }

  /**
   * Validates the base path after bean creation.
   */
  @PostConstruct
  public void validateBasePath() {
    try {
      if (Files.exists(basePath)) {
        if (!Files.isDirectory(basePath)) {
          throw new BlobStoreException("Configured base path exists but is not a directory: " + basePath);
        }
        if (!Files.isReadable(basePath) || !Files.isWritable(basePath)) {
          throw new BlobStoreException("Configured base path directory lacks read/write permissions: " + basePath);
        }
        log.debug("Base path validation successful: {}", basePath);
      } else {
        log.warn("Base path directory does not exist, attempting to create: {}", basePath);
        Files.createDirectories(basePath);
        log.info("Successfully created base path directory: {}", basePath);
      }
    } catch (IOException e) {
      log.error("Failed to validate or create base path: {}", basePath, e);
      throw new BlobStoreException("Failed to initialize blob store base path: " + basePath, e);
    }
  }

  @Override
  public void putObject(String key, byte[] content) throws BlobStoreException {
    if (content == null) {
      throw new IllegalArgumentException("Content cannot be null for put operation.");
    }
    Path filePath = resolvePath(key);
    log.debug("Putting {} bytes for key '{}' at path: {}", content.length, key, filePath);

    try {
      Files.createDirectories(filePath.getParent());
      Files.write(filePath, content, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
      log.info("Successfully stored blob for key '{}'", key);
    } catch (FileAlreadyExistsException e) {
      log.warn("Refusing to overwrite existing blob for key '{}' at path {}", key, filePath);
      throw new BlobAlreadyExistsException("Blob already exists for key: " + key, e);
    } catch (IOException e) {
      log.error("Failed to put blob for key '{}' at path {}: {}", key, filePath, e.getMessage(), e);
      throw new BlobStoreException("Failed to write blob for key: " + key, e);
    }
  }

  @Override
  public byte[] getObject(String key) throws BlobStoreException {
    Path filePath = resolvePath(key);
    log.debug("Getting blob for key '{}' from path: {}", key, filePath);

    if (!Files.isRegularFile(filePath, LinkOption.NOFOLLOW_LINKS)) {
      log.error("Blob not found for key '{}' (path {} does not exist or is not a file)", key, filePath);
      throw new BlobStoreException("Blob not found for key: " + key);
    }
    try {
      byte[] content = Files.readAllBytes(filePath);
      log.debug("Successfully read {} bytes for key '{}'", content.length, key);
      return content;
    } catch (NoSuchFileException e) {
      log.error("Blob disappeared for key '{}' during read attempt: {}", key, filePath);
      throw new BlobStoreException("Blob not found for key: " + key, e);
    } catch (IOException e) {
      log.error("Failed to get blob for key '{}' from path {}: {}", key, filePath, e.getMessage(), e);
      throw new BlobStoreException("Failed to read blob for key: " + key, e);
    }
  }

  @Override
  public void removeObject(String key) throws BlobStoreException {
    Path filePath = resolvePath(key);
    log.debug("Deleting blob for key '{}' at path: {}", key, filePath);

    try {
      boolean deleted = Files.deleteIfExists(filePath);
      if (deleted) {
        log.info("Successfully deleted blob for key '{}'", key);
      } else {
        log.debug("No blob found to delete for key '{}' (path {} did not exist)", key, filePath);
      }
    } catch (AccessDeniedException e) {
      log.error("Permission denied while trying to delete blob for key '{}' at path {}: {}", key, filePath, e.getMessage(), e);
      throw new BlobStoreException("Permission denied deleting blob for key: " + key, e);
    } catch (IOException e) {
      log.error("Failed to delete blob for key '{}' at path {}: {}", key, filePath, e.getMessage(), e);
      throw new BlobStoreException("Failed to delete blob for key: " + key, e);
    }
  }

  /**
   * Resolves a key against the base path, rejecting keys that would escape it.
   */
  private Path resolvePath(String key) throws BlobStoreException {
    if (!StringUtils.hasText(key)) {
      throw new IllegalArgumentException("Key cannot be null or empty.");
    }
    String sanitizedKey = key.replace('\\', '/').trim();
    if (sanitizedKey.startsWith("/") || sanitizedKey.endsWith("/") || sanitizedKey.contains("..")) {
      log.error("Invalid blob key provided: '{}'", key);
      throw new BlobStoreException("Invalid blob key format: " + key);
    }

    Path absolutePath = this.basePath.resolve(sanitizedKey).normalize();
    if (!absolutePath.startsWith(this.basePath)) {
      log.error("Path traversal attempt detected for key '{}', resolved path '{}' is outside base path '{}'", key, absolutePath, this.basePath);
      throw new BlobStoreException("Invalid key resulting in path traversal attempt: " + key);
    }
    return absolutePath;
  }
}
