package com.contenthub.tasks;

import com.contenthub.tasks.logging.LoggingService;
import org.slf4j.Logger;

public class TaskServerApp {

  private static final Logger log = LoggingService.getLogger(TaskServerApp.class);

  public static void main(String[] args) {
    try {
      TaskServer app = new TaskServer(args);
      app.initialize();
      app.waitShutdownSignal();
    } catch (Exception e) {
      log.error("Application failed to start", e);
      System.exit(1);
    }
  }
}
