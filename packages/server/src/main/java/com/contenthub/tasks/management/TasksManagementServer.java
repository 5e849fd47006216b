package com.contenthub.tasks.management;

import com.contenthub.tasks.jobs.JobScheduler;
import com.contenthub.tasks.management.endpoints.CancelTaskServlet;
import com.contenthub.tasks.management.endpoints.ClearTaskServlet;
import com.contenthub.tasks.management.endpoints.ClearTasksServlet;
import com.contenthub.tasks.management.endpoints.DeleteFinishedTasksServlet;
import com.contenthub.tasks.management.endpoints.TasksStatusServlet;
import java.util.Objects;
import org.eclipse.jetty.ee10.servlet.ServletContextHandler;
import org.eclipse.jetty.ee10.servlet.ServletHolder;

/**
 * Registers the task observer endpoints under {@code /api/tasks}.
 *
 * <p>The action endpoints are exact mappings and take precedence over the {@code /api/tasks/*}
 * status mapping.
 */
public final class TasksManagementServer {
  public static final String CONTEXT_PATH = "/api/tasks";

  private final JobScheduler scheduler;

  public TasksManagementServer(JobScheduler scheduler) {
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
  }

  public void register(ServletContextHandler ctx) {
    ServletHolder status = new ServletHolder(new TasksStatusServlet(scheduler));
    ctx.addServlet(status, CONTEXT_PATH);
    ctx.addServlet(status, "%s/*".formatted(CONTEXT_PATH));

    ctx.addServlet(
        new ServletHolder(new CancelTaskServlet(scheduler)),
        "%s/canceltask".formatted(CONTEXT_PATH));
    ctx.addServlet(
        new ServletHolder(new ClearTaskServlet(scheduler)), "%s/cleartask".formatted(CONTEXT_PATH));
    ctx.addServlet(
        new ServletHolder(new ClearTasksServlet(scheduler)),
        "%s/cleartasks".formatted(CONTEXT_PATH));
    ctx.addServlet(
        new ServletHolder(new DeleteFinishedTasksServlet(scheduler)),
        "%s/deletefinishedtasks".formatted(CONTEXT_PATH));
  }
}
