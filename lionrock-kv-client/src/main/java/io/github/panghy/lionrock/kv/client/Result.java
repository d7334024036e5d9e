package io.github.panghy.lionrock.kv.client;

import io.github.panghy.lionrock.kv.proto.ResumeReason;
import io.github.panghy.lionrock.kv.proto.Span;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of a single logical call of a {@link Batch} (e.g. a get, a put or a scan).
 * <p>
 * For get, put, conditional put, init put, increment and delete there is one row per key operated on. For scans the
 * rows are the matching key/values capped by the batch limits. Delete range returns {@link #getKeys()} instead (when
 * asked to).
 *
 * @author Clement Pang
 */
public class Result {

  /**
   * Number of wire requests that back this logical call.
   */
  final int calls;
  final List<KeyValue> rows;
  final List<byte[]> keys = new ArrayList<>();
  @Nullable
  Span resumeSpan;
  ResumeReason resumeReason = ResumeReason.RESUME_UNKNOWN;
  @Nullable
  RuntimeException err;

  Result(int calls, int numRows, @Nullable RuntimeException err) {
    this.calls = calls;
    this.rows = new ArrayList<>(numRows);
    this.err = err;
  }

  public List<KeyValue> getRows() {
    return Collections.unmodifiableList(rows);
  }

  public List<byte[]> getKeys() {
    return Collections.unmodifiableList(keys);
  }

  /**
   * @return The span that remains to be processed when a span request stopped early, null when it ran to completion.
   * Re-issue the same call over this span to continue.
   */
  @Nullable
  public Span getResumeSpan() {
    return resumeSpan;
  }

  public ResumeReason getResumeReason() {
    return resumeReason;
  }

  @Nullable
  public RuntimeException getErr() {
    return err;
  }

  @Override
  public String toString() {
    if (err != null) {
      return err.getMessage();
    }
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < rows.size(); i++) {
      if (i > 0) {
        sb.append("\n");
      }
      sb.append(i).append(": ").append(rows.get(i));
    }
    return sb.toString();
  }
}
