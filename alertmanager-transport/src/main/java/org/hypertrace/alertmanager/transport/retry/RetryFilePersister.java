package org.hypertrace.alertmanager.transport.retry;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;
import org.hypertrace.alertmanager.transport.exception.PersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stages payloads that could not be delivered as files in a retry folder. Each file is named by a
 * random version-4 UUID and holds the request body verbatim. Files are never read or removed
 * here; an external consumer owns them.
 */
public class RetryFilePersister {
  private static final Logger LOGGER = LoggerFactory.getLogger(RetryFilePersister.class);
  static final Set<PosixFilePermission> RETRY_FILE_PERMISSIONS =
      PosixFilePermissions.fromString("rw-r-----");

  private final Supplier<UUID> idGenerator;
  private final PayloadWriter payloadWriter;
  private final boolean posixSupported;

  public RetryFilePersister() {
    this(UUID::randomUUID);
  }

  @VisibleForTesting
  RetryFilePersister(Supplier<UUID> idGenerator) {
    this(
        idGenerator,
        (file, payload) ->
            Files.write(
                file, payload, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING));
  }

  @VisibleForTesting
  RetryFilePersister(Supplier<UUID> idGenerator, PayloadWriter payloadWriter) {
    this.idGenerator = idGenerator;
    this.payloadWriter = payloadWriter;
    this.posixSupported =
        FileSystems.getDefault().supportedFileAttributeViews().contains("posix");
  }

  public Path persist(String retryFolder, byte[] payload) throws PersistenceException {
    Preconditions.checkArgument(payload != null, "payload cannot be null");
    if (retryFolder == null || retryFolder.isEmpty()) {
      // an empty folder would resolve against the working directory
      throw new PersistenceException("retry folder is not configured");
    }
    String fileId = newFileId();
    Path outFile;
    try {
      outFile = Paths.get(retryFolder).resolve(fileId);
    } catch (RuntimeException e) {
      throw new PersistenceException(
          String.format("invalid retry folder %s", retryFolder), e);
    }

    try {
      if (posixSupported) {
        Files.createFile(outFile, PosixFilePermissions.asFileAttribute(RETRY_FILE_PERMISSIONS));
      } else {
        Files.createFile(outFile);
      }
    } catch (IOException e) {
      throw new PersistenceException(
          String.format("unable to create retry file %s", outFile), e);
    }

    try {
      payloadWriter.write(outFile, payload);
      if (posixSupported) {
        // createFile is subject to the process umask
        Files.setPosixFilePermissions(outFile, RETRY_FILE_PERMISSIONS);
      }
    } catch (IOException e) {
      // a partial file would be picked up by the retry consumer as a payload
      deletePartialFile(outFile, e);
      throw new PersistenceException(
          String.format("unable to write retry file %s", outFile), e);
    }
    LOGGER.info("Saved undelivered alert for retry: {}", outFile);
    return outFile;
  }

  private static void deletePartialFile(Path outFile, IOException writeFailure) {
    try {
      Files.deleteIfExists(outFile);
    } catch (IOException e) {
      writeFailure.addSuppressed(e);
    }
  }

  private String newFileId() throws PersistenceException {
    try {
      return idGenerator.get().toString();
    } catch (RuntimeException e) {
      throw new PersistenceException("unable to generate retry file identifier", e);
    }
  }

  @VisibleForTesting
  @FunctionalInterface
  interface PayloadWriter {
    void write(Path file, byte[] payload) throws IOException;
  }
}
