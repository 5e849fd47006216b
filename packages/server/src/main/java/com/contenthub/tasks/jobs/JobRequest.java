package com.contenthub.tasks.jobs;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Everything needed to enqueue a job: the function key, its arguments and the scheduling options.
 *
 * <pre>
 * JobRequest request =
 *     JobRequest.builder("importcontent")
 *         .args("network", channelId)
 *         .kwarg("baseurl", baseUrl)
 *         .cancellable(true)
 *         .trackProgress(true)
 *         .extraMetadata(Map.of("type", "REMOTECONTENTIMPORT"))
 *         .build();
 * </pre>
 */
public record JobRequest(
    String function,
    List<Object> args,
    Map<String, Object> kwargs,
    boolean cancellable,
    boolean trackProgress,
    Map<String, Object> extraMetadata) {

  public JobRequest {
    Objects.requireNonNull(function, "function");
    args = args == null ? List.of() : args;
    kwargs = kwargs == null ? Map.of() : kwargs;
    extraMetadata = extraMetadata == null ? Map.of() : extraMetadata;
  }

  public static Builder builder(String function) {
    return new Builder(function);
  }

  public static final class Builder {
    private final String function;
    private final List<Object> args = new ArrayList<>();
    private final Map<String, Object> kwargs = new LinkedHashMap<>();
    private final Map<String, Object> extraMetadata = new LinkedHashMap<>();
    private boolean cancellable;
    private boolean trackProgress;

    private Builder(String function) {
      this.function = function;
    }

    public Builder args(Object... values) {
      if (values != null) args.addAll(Arrays.asList(values));
      return this;
    }

    public Builder kwarg(String name, Object value) {
      kwargs.put(Objects.requireNonNull(name), value);
      return this;
    }

    public Builder kwargs(Map<String, ?> values) {
      if (values != null) kwargs.putAll(values);
      return this;
    }

    public Builder cancellable(boolean value) {
      this.cancellable = value;
      return this;
    }

    public Builder trackProgress(boolean value) {
      this.trackProgress = value;
      return this;
    }

    public Builder extraMetadata(Map<String, ?> values) {
      if (values != null) extraMetadata.putAll(values);
      return this;
    }

    public Builder metadata(String key, Object value) {
      extraMetadata.put(Objects.requireNonNull(key), value);
      return this;
    }

    public JobRequest build() {
      return new JobRequest(
          function,
          new ArrayList<>(args),
          new LinkedHashMap<>(kwargs),
          cancellable,
          trackProgress,
          new LinkedHashMap<>(extraMetadata));
    }
  }
}
