package com.contenthub.tasks.management.endpoints;

import com.contenthub.tasks.jobs.JobScheduler;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Map;
import java.util.Optional;

/**
 * POST /api/tasks/deletefinishedtasks removes the given finished task, or every finished task when
 * no {@code task_id} is sent.
 */
public final class DeleteFinishedTasksServlet extends TaskApiServlet {

  public DeleteFinishedTasksServlet(JobScheduler scheduler) {
    super(scheduler);
  }

  @Override
  protected void doPost(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    Optional<String> jobId = taskId(readBody(req));
    if (jobId.isPresent()) {
      scheduler.clearJob(jobId.get());
    } else {
      scheduler.clear();
    }
    writeJson(resp, 200, Map.of());
  }
}
