package com.contenthub.tasks.jobs;

import com.contenthub.tasks.exception.ValidationException;
import com.contenthub.tasks.utility.JacksonUtility;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Typed access to the positional and keyword arguments stored with a job. Values are held in their
 * JSON-normalised form and converted on access with Jackson, so a handler sees the same values
 * whether the job was just enqueued or reloaded from storage.
 */
public final class JobArguments {
  private final List<Object> positional;
  private final Map<String, Object> keyword;

  public JobArguments(List<Object> positional, Map<String, Object> keyword) {
    this.positional = positional == null ? List.of() : positional;
    this.keyword = keyword == null ? Map.of() : keyword;
  }

  public static JobArguments of(Job job) {
    return new JobArguments(job.args(), job.kwargs());
  }

  public int size() {
    return positional.size();
  }

  public List<Object> positional() {
    return positional;
  }

  public Map<String, Object> keyword() {
    return keyword;
  }

  public <T> T positional(int index, Class<T> type) {
    if (index < 0 || index >= positional.size()) {
      throw new ValidationException(
          "Missing positional argument #" + index + " (got " + positional.size() + ")");
    }
    return JacksonUtility.convert(positional.get(index), type);
  }

  public <T> T keyword(String name, Class<T> type) {
    if (!keyword.containsKey(name)) {
      throw new ValidationException("Missing keyword argument: " + name);
    }
    return JacksonUtility.convert(keyword.get(name), type);
  }

  public <T> Optional<T> optionalKeyword(String name, Class<T> type) {
    return Optional.ofNullable(keyword.get(name)).map(v -> JacksonUtility.convert(v, type));
  }

  @Override
  public String toString() {
    return "JobArguments{positional=" + positional + ", keyword=" + keyword + '}';
  }
}
