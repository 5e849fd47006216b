package com.contenthub.tasks.jobs.store;

import static org.junit.jupiter.api.Assertions.*;

import com.contenthub.tasks.exception.ConfigException;
import java.nio.file.Path;
import org.apache.commons.configuration2.BaseConfiguration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JobStoreFactoryTest {

  @TempDir Path tmp;

  @Test
  void createsInMemoryStore() {
    BaseConfiguration config = new BaseConfiguration();
    config.setProperty(JobStoreFactory.TYPE_KEY, "memory");
    assertInstanceOf(InMemoryJobStore.class, JobStoreFactory.create(config));
  }

  @Test
  void createsFileStoreAtConfiguredPath() {
    BaseConfiguration config = new BaseConfiguration();
    config.setProperty(JobStoreFactory.TYPE_KEY, "file");
    config.setProperty(JobStoreFactory.PATH_KEY, tmp.resolve("jobs.json").toString());

    JobStore store = JobStoreFactory.create(config);
    FileJobStore fileStore = assertInstanceOf(FileJobStore.class, store);
    assertEquals(tmp.resolve("jobs.json").toAbsolutePath(), fileStore.file());
  }

  @Test
  void defaultPathLivesUnderUserHome() {
    Path path = JobStoreFactory.resolvePath(null);
    assertEquals("jobs.json", path.getFileName().toString());
    assertEquals(".contenthub", path.getParent().getFileName().toString());
  }

  @Test
  void unknownTypeIsAConfigError() {
    BaseConfiguration config = new BaseConfiguration();
    config.setProperty(JobStoreFactory.TYPE_KEY, "redis");
    assertThrows(ConfigException.class, () -> JobStoreFactory.create(config));
  }
}
