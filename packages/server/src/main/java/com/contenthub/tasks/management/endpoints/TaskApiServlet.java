package com.contenthub.tasks.management.endpoints;

import com.contenthub.tasks.exception.ExceptionUtil;
import com.contenthub.tasks.exception.JobNotFoundException;
import com.contenthub.tasks.exception.TaskServerException;
import com.contenthub.tasks.exception.ValidationException;
import com.contenthub.tasks.jobs.JobScheduler;
import com.contenthub.tasks.logging.LoggingService;
import com.contenthub.tasks.utility.JacksonUtility;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;

/**
 * Base class for the {@code /api/tasks} endpoints: JSON bodies in and out, and translation of
 * scheduler exceptions into HTTP status codes ({@link JobNotFoundException} to 404, {@link
 * ValidationException} to 400, anything else to 500) with an {@code ErrorDetails} JSON body.
 */
abstract class TaskApiServlet extends HttpServlet {
  private static final Logger log = LoggingService.getLogger(TaskApiServlet.class);

  static final String TASK_ID = "task_id";

  protected final JobScheduler scheduler;
  protected final ObjectMapper mapper = JacksonUtility.getJsonMapper();

  TaskApiServlet(JobScheduler scheduler) {
    this.scheduler = scheduler;
  }

  @Override
  protected void service(HttpServletRequest req, HttpServletResponse resp)
      throws ServletException, IOException {
    try {
      super.service(req, resp);
    } catch (JobNotFoundException e) {
      writeError(resp, 404, e);
    } catch (ValidationException e) {
      writeError(resp, 400, e);
    } catch (TaskServerException e) {
      log.error(
          "{} {} failed: {} at {}",
          req.getMethod(),
          req.getRequestURI(),
          ExceptionUtil.describe(e),
          ExceptionUtil.formatCompactStackTrace(e));
      writeError(resp, 500, e);
    }
  }

  /** Request body as JSON; an empty body reads as an empty object. */
  protected JsonNode readBody(HttpServletRequest req) throws IOException {
    byte[] body = req.getInputStream().readAllBytes();
    String text = new String(body, StandardCharsets.UTF_8);
    if (text.isBlank()) return mapper.createObjectNode();
    try {
      return mapper.readTree(text);
    } catch (JsonProcessingException e) {
      throw new ValidationException("Request body is not valid JSON", e);
    }
  }

  /**
   * The {@code task_id} field of a request body, if present and non-empty.
   *
   * @throws ValidationException if the field is present but not a string
   */
  protected Optional<String> taskId(JsonNode body) {
    JsonNode node = body == null ? null : body.get(TASK_ID);
    if (node == null || node.isNull()) return Optional.empty();
    if (!node.isTextual()) {
      throw new ValidationException("The 'task_id' should be a string.");
    }
    String value = node.asText();
    return value.isEmpty() ? Optional.empty() : Optional.of(value);
  }

  protected void writeJson(HttpServletResponse resp, int status, Object value) throws IOException {
    resp.setStatus(status);
    resp.setContentType("application/json");
    resp.setCharacterEncoding("UTF-8");
    resp.getWriter().write(mapper.writeValueAsString(value));
  }

  /** Error body: {@code {"error": ErrorDetails}} with the exception's code and context. */
  private void writeError(HttpServletResponse resp, int status, TaskServerException e)
      throws IOException {
    if (resp.isCommitted()) {
      log.warn("Response already committed, dropping error {}", ExceptionUtil.describe(e));
      return;
    }
    resp.reset();
    writeJson(resp, status, Map.of("error", ExceptionUtil.toErrorDetails(e)));
  }
}
