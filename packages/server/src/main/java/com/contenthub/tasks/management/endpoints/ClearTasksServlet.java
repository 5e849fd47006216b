package com.contenthub.tasks.management.endpoints;

import com.contenthub.tasks.jobs.JobScheduler;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Map;

/** POST /api/tasks/cleartasks cancels every unfinished task. */
public final class ClearTasksServlet extends TaskApiServlet {

  public ClearTasksServlet(JobScheduler scheduler) {
    super(scheduler);
  }

  @Override
  protected void doPost(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    scheduler.empty();
    writeJson(resp, 200, Map.of());
  }
}
