package com.contenthub.tasks.jobs.store;

import com.contenthub.tasks.exception.ConfigException;
import com.contenthub.tasks.logging.LoggingService;
import java.nio.file.Path;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.Logger;

/** Builds the configured {@link JobStore} from {@code jobs.storage.*} keys. */
public final class JobStoreFactory {
  private static final Logger log = LoggingService.getLogger(JobStoreFactory.class);

  public static final String TYPE_KEY = "jobs.storage.type";
  public static final String PATH_KEY = "jobs.storage.path";

  private JobStoreFactory() {}

  public static JobStore create(Configuration configuration) {
    String type = configuration.getString(TYPE_KEY, "file").trim().toLowerCase();
    switch (type) {
      case "memory":
      case "in-memory":
        log.warn("Using in-memory job store: job records will not survive a restart");
        return new InMemoryJobStore();
      case "file":
        Path path = resolvePath(configuration.getString(PATH_KEY, null));
        log.info("Using file job store at {}", path);
        return new FileJobStore(path);
      default:
        throw new ConfigException(
            "Unsupported " + TYPE_KEY + ": '" + type + "' (expected 'file' or 'memory')");
    }
  }

  static Path resolvePath(String configured) {
    if (configured != null && !configured.isBlank()) {
      return Path.of(configured.trim());
    }
    String userHome = System.getProperty("user.home");
    String base = userHome != null ? userHome : System.getProperty("java.io.tmpdir");
    return Path.of(base, ".contenthub", "jobs.json");
  }
}
