package ca.gc.cra.brandkit.application.template;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Result of {@link TemplateCatalog#validate(String)}.
 *
 * @param name template name
 * @param status overall status
 * @param issues every issue found
 */
public record TemplateValidationReport(String name, Status status, List<Issue> issues) {
  public TemplateValidationReport {
    Objects.requireNonNull(status, "status");
    issues = List.copyOf(issues);
  }

  /** Overall validation status. */
  public enum Status {
    VALID,
    WARNING,
    ERROR;

    public String value() {
      return name().toLowerCase(Locale.ROOT);
    }
  }

  /** Issue category. Structure and load issues make a template invalid; asset issues are warnings. */
  public enum IssueType {
    STRUCTURE,
    ASSET,
    LOAD;

    public String value() {
      return name().toLowerCase(Locale.ROOT);
    }
  }

  /**
   * One validation finding.
   *
   * @param type category
   * @param message human-readable description
   */
  public record Issue(IssueType type, String message) {}

  static Status statusOf(List<Issue> issues) {
    if (issues.isEmpty()) {
      return Status.VALID;
    }
    for (Issue issue : issues) {
      if (issue.type() != IssueType.ASSET) {
        return Status.ERROR;
      }
    }
    return Status.WARNING;
  }
}
