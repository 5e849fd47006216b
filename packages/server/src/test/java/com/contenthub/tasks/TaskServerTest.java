package com.contenthub.tasks;

import static org.junit.jupiter.api.Assertions.*;

import com.contenthub.tasks.exception.ConfigException;
import com.contenthub.tasks.exception.StateException;
import com.contenthub.tasks.jobs.Job;
import com.contenthub.tasks.jobs.JobRequest;
import com.contenthub.tasks.jobs.JobScheduler;
import com.contenthub.tasks.jobs.JobState;
import com.contenthub.tasks.jobs.SampleJobHandlerProvider;
import com.contenthub.tasks.utility.JacksonUtility;
import com.fasterxml.jackson.databind.JsonNode;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TaskServerTest {

  @TempDir Path tmp;

  private TaskServer server;

  @AfterEach
  void tearDown() {
    if (server != null) server.shutdown();
  }

  private Path writeConfig(String storageType, int workers) throws Exception {
    Path file = tmp.resolve("tasks.yaml");
    Files.writeString(
        file,
        String.join(
            "\n",
            "http:",
            "  hostname: 127.0.0.1",
            "  port: 0",
            "jobs:",
            "  workers: " + workers,
            "  storage:",
            "    type: " + storageType,
            "    path: " + tmp.resolve("jobs.json"),
            "  shutdown:",
            "    grace-seconds: 1",
            ""));
    return file;
  }

  @Test
  void servesTasksOverHttp() throws Exception {
    server = new TaskServer(new String[] {"--config", writeConfig("file", 2).toString()});
    server.initialize();

    assertTrue(server.httpServer().isRunning());
    assertTrue(server.registry().contains(SampleJobHandlerProvider.ECHO));

    JobScheduler scheduler = server.scheduler();
    String id =
        scheduler.enqueue(
            JobRequest.builder(SampleJobHandlerProvider.ECHO)
                .trackProgress(true)
                .metadata("type", "ECHO")
                .build());
    awaitState(scheduler, id, JobState.COMPLETED);

    HttpClient client = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5)).build();
    URI base = URI.create("http://127.0.0.1:" + server.httpServer().getPort() + "/api/tasks");

    HttpResponse<String> list =
        client.send(
            HttpRequest.newBuilder(base).GET().build(), HttpResponse.BodyHandlers.ofString());
    assertEquals(200, list.statusCode());
    JsonNode tasks = JacksonUtility.getJsonMapper().readTree(list.body());
    assertEquals(id, tasks.get(0).get("id").asText());
    assertEquals(1.0, tasks.get(0).get("percentage").asDouble());
    assertEquals("ECHO", tasks.get(0).get("type").asText());

    HttpResponse<String> delete =
        client.send(
            HttpRequest.newBuilder(URI.create(base + "/deletefinishedtasks"))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString("{}"))
                .build(),
            HttpResponse.BodyHandlers.ofString());
    assertEquals(200, delete.statusCode());
    assertTrue(scheduler.jobs().isEmpty());
  }

  @Test
  void unfinishedJobsAreFailedAfterRestart() throws Exception {
    Path config = writeConfig("file", 1);
    server = new TaskServer(new String[] {"--config", config.toString()});
    server.initialize();
    String id =
        server
            .scheduler()
            .enqueue(
                JobRequest.builder(SampleJobHandlerProvider.SLEEP)
                    .kwarg("millis", 60_000)
                    .build());
    awaitState(server.scheduler(), id, JobState.RUNNING);
    server.shutdown();

    server = new TaskServer(new String[] {"--config", config.toString()});
    server.initialize();
    Job recovered = server.scheduler().fetchJob(id);
    assertEquals(JobState.FAILED, recovered.state());
    assertEquals("Job interrupted: process restarted", recovered.exception());
  }

  @Test
  void rejectsInvalidWorkerCount() throws Exception {
    server = new TaskServer(new String[] {"--config", writeConfig("memory", 0).toString()});
    assertThrows(ConfigException.class, server::initialize);
  }

  @Test
  void commandLineOverridesConfigurationFile() throws Exception {
    String config = writeConfig("memory", 2).toString();
    server = new TaskServer(new String[] {"--config", config, "--jobs.workers=0"});
    ConfigException e = assertThrows(ConfigException.class, server::initialize);
    assertTrue(e.getMessage().contains("got 0"), e.getMessage());
    server = null;

    server = new TaskServer(new String[] {"--config", config, "--jobs.workers", "3"});
    server.initialize();
    assertEquals(3, server.configuration().getInt("jobs.workers"));
    assertEquals(3, server.scheduler().workers().size());
  }

  @Test
  void accessorsRequireInitialization() {
    server = new TaskServer(new String[0]);
    assertThrows(StateException.class, server::configuration);
    assertThrows(StateException.class, server::scheduler);
  }

  private static void awaitState(JobScheduler scheduler, String id, JobState desired)
      throws InterruptedException {
    long end = System.currentTimeMillis() + 5_000;
    while (System.currentTimeMillis() < end) {
      if (scheduler.fetchJob(id).state() == desired) return;
      Thread.sleep(10);
    }
    fail("Timeout waiting for " + desired + ", job is " + scheduler.fetchJob(id).state());
  }
}
