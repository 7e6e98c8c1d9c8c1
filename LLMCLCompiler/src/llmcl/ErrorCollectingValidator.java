package llmcl;

import java.util.ArrayList;
import java.util.List;

import com.google.common.collect.ImmutableList;

/** Base for tree passes that report problems in batch instead of stopping at the first one. */
abstract class ErrorCollectingValidator {
  private final List<String> errors = new ArrayList<>();
  private final List<String> warnings = new ArrayList<>();

  public ImmutableList<String> errors() {
    return ImmutableList.copyOf(errors);
  }

  public ImmutableList<String> warnings() {
    return ImmutableList.copyOf(warnings);
  }

  protected void logError(String msg) {
    errors.add(msg);
  }

  protected void logWarning(String msg) {
    warnings.add(msg);
  }

  public boolean hasErrors() {
    return !errors.isEmpty();
  }
}
