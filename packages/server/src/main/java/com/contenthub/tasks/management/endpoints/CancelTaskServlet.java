package com.contenthub.tasks.management.endpoints;

import com.contenthub.tasks.exception.ValidationException;
import com.contenthub.tasks.jobs.JobScheduler;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Map;

/** POST /api/tasks/canceltask {"task_id": "..."} requests cancellation of one task. */
public final class CancelTaskServlet extends TaskApiServlet {

  public CancelTaskServlet(JobScheduler scheduler) {
    super(scheduler);
  }

  @Override
  protected void doPost(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    JsonNode body = readBody(req);
    if (!body.has(TASK_ID)) {
      throw new ValidationException("The 'task_id' field is required.");
    }
    String jobId =
        taskId(body).orElseThrow(() -> new ValidationException("The 'task_id' must not be empty."));
    scheduler.cancel(jobId);
    writeJson(resp, 200, Map.of());
  }
}
