package llmcl;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

/**
 * Outcome of a compile. On success {@link #output()} is the canonical program; on failure it is
 * the newline-joined error list.
 */
@AutoValue
public abstract class CompileResult {
  public abstract boolean ok();

  public abstract String output();

  public abstract ImmutableList<String> warnings();

  public static CompileResult success(String output, Iterable<String> warnings) {
    return new AutoValue_CompileResult(true, output, ImmutableList.copyOf(warnings));
  }

  public static CompileResult failure(String errors, Iterable<String> warnings) {
    return new AutoValue_CompileResult(false, errors, ImmutableList.copyOf(warnings));
  }
}
