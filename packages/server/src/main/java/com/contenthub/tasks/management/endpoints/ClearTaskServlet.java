package com.contenthub.tasks.management.endpoints;

import com.contenthub.tasks.jobs.JobScheduler;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Map;
import java.util.Optional;

/**
 * POST /api/tasks/cleartask {"task_id": "..."} removes one finished task and echoes its id. A task
 * that has not finished is left in place. Without a task id nothing happens.
 */
public final class ClearTaskServlet extends TaskApiServlet {

  public ClearTaskServlet(JobScheduler scheduler) {
    super(scheduler);
  }

  @Override
  protected void doPost(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    Optional<String> jobId = taskId(readBody(req));
    if (jobId.isEmpty()) {
      writeJson(resp, 200, Map.of());
      return;
    }
    scheduler.clearJob(jobId.get());
    writeJson(resp, 200, Map.of(TASK_ID, jobId.get()));
  }
}
