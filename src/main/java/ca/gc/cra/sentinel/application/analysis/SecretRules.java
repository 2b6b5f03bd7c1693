package ca.gc.cra.sentinel.application.analysis;

import ca.gc.cra.sentinel.domain.issue.Issue;
import ca.gc.cra.sentinel.domain.issue.Severity;
import ca.gc.cra.sentinel.domain.task.TaskPayload;
import ca.gc.cra.sentinel.domain.task.TaskResult;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Secrets analyzer: vendor-specific token formats, private keys and credential-bearing connection
 * strings. Matched values are masked in finding snippets.
 *
 * @since 0.1.0
 */
public final class SecretRules {
  static final List<LineRule> RULES = List.of(
      secret("aws-access-key", "AWS Access Key", "AKIA[0-9A-Z]{16}", 0, Severity.CRITICAL,
          "Rotate immediately and use IAM roles instead"),
      secret("aws-secret-key", "AWS Secret Key",
          "(?:aws_secret_access_key|aws_secret_key)\\s*[:=]\\s*['\"][A-Za-z0-9/+=]{40}['\"]",
          Pattern.CASE_INSENSITIVE, Severity.CRITICAL, "Rotate immediately"),
      secret("github-token", "GitHub Token", "gh[por]_[A-Za-z0-9_]{36,}", 0, Severity.CRITICAL,
          "Revoke and create a new token"),
      secret("gitlab-token", "GitLab Token", "glpat-[A-Za-z0-9\\-_]{20,}", 0, Severity.CRITICAL,
          "Revoke and create a new token"),
      secret("google-api-key", "Google API Key", "AIza[0-9A-Za-z\\-_]{35}", 0, Severity.HIGH,
          "Restrict API key and regenerate if compromised"),
      secret("slack-token", "Slack Token", "xox[baprs]-[0-9a-zA-Z]{10,48}", 0, Severity.HIGH,
          "Revoke and create a new token"),
      secret("stripe-key", "Stripe Key", "(sk|pk)_(test|live)_[0-9a-zA-Z]{24,}", 0, Severity.CRITICAL,
          "Revoke and rotate the key"),
      secret("sendgrid-api-key", "SendGrid API Key", "SG\\.[A-Za-z0-9\\-_]{22}\\.[A-Za-z0-9\\-_]{43}", 0,
          Severity.CRITICAL, "Regenerate API key"),
      secret("npm-token", "npm Token", "npm_[A-Za-z0-9]{36}", 0, Severity.CRITICAL,
          "Revoke the token in npm settings"),
      secret("private-key", "Private Key", "-----BEGIN (?:RSA |EC |DSA |OPENSSH |PGP )?PRIVATE KEY-----", 0,
          Severity.CRITICAL, "Remove from codebase immediately"),
      secret("jwt-token", "JWT Token", "eyJ[A-Za-z0-9_-]*\\.eyJ[A-Za-z0-9_-]*\\.[A-Za-z0-9_-]*", 0,
          Severity.HIGH, "Invalidate the token and review access logs"),
      secret("database-url", "Database URL",
          "(mongodb(\\+srv)?|postgres|postgresql|mysql|redis|mssql)://[^\\s\"'<>]+",
          Pattern.CASE_INSENSITIVE, Severity.CRITICAL, "Use environment variables or secrets manager"));

  private SecretRules() {
    // Utility
  }

  /**
   * Runs the secret patterns.
   *
   * @param analyzerName requested analyzer name
   * @param payload file to analyse
   * @return findings plus {@code linesAnalyzed} and {@code secretsFound}
   */
  public static TaskResult analyze(String analyzerName, TaskPayload payload) {
    String[] lines = LineRuleScanner.lines(payload.content());
    List<Issue> issues = LineRuleScanner.scan(analyzerName, payload.filePath(), lines, RULES);
    return new TaskResult(analyzerName, payload.filePath(), issues, Map.of(
        "linesAnalyzed", (long) lines.length,
        "secretsFound", (long) issues.size()));
  }

  private static LineRule secret(
      String type, String title, String regex, int flags, Severity severity, String remediation) {
    return new LineRule(type, title, Pattern.compile(regex, flags), severity,
        "Potential " + title + " exposed in source", remediation, true);
  }
}
