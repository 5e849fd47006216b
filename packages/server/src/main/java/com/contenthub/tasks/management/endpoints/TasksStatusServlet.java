package com.contenthub.tasks.management.endpoints;

import com.contenthub.tasks.jobs.JobScheduler;
import com.contenthub.tasks.jobs.JobSummary;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.List;
import java.util.stream.Collectors;

/** GET /api/tasks lists every task; GET /api/tasks/{id} returns one. */
public final class TasksStatusServlet extends TaskApiServlet {

  public TasksStatusServlet(JobScheduler scheduler) {
    super(scheduler);
  }

  @Override
  protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    String path = req.getPathInfo();
    if (path == null || path.length() <= 1) {
      List<JobSummary> all =
          scheduler.jobs().stream().map(JobSummary::from).collect(Collectors.toList());
      writeJson(resp, 200, all);
      return;
    }
    String jobId = path.substring(1);
    writeJson(resp, 200, JobSummary.from(scheduler.fetchJob(jobId)));
  }
}
