package ca.gc.cra.sentinel.infrastructure.filter;

import static org.junit.jupiter.api.Assertions.assertEquals;

import ca.gc.cra.sentinel.domain.issue.Issue;
import ca.gc.cra.sentinel.domain.issue.Severity;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import org.junit.jupiter.api.Test;

class SnippetPatternIssueFilterTest {

  @Test
  void dropsSecurityFindingsInSampleCode() {
    Issue sample = issue("security", "hardcoded-password", "const password = 'example-pass';");
    Issue real = issue("security", "hardcoded-password", "const password = 'hunter22';");

    List<Issue> kept = new SnippetPatternIssueFilter().process("app.js", List.of(sample, real));

    assertEquals(List.of(real), kept);
  }

  @Test
  void suppressionOnlyAppliesToItsAnalyzers() {
    Issue quality = issue("quality", "console-statement", "console.log('test');");
    Issue lint = issue("quality", "console-statement", "console.log(x); // eslint-disable-line");

    List<Issue> kept = new SnippetPatternIssueFilter().process("app.js", List.of(quality, lint));

    assertEquals(List.of(quality), kept);
  }

  @Test
  void customSuppressionsReplaceDefaults() {
    SnippetPatternIssueFilter filter = new SnippetPatternIssueFilter(List.of(
        new SnippetPatternIssueFilter.Suppression(Pattern.compile("legacy"), Set.of("bugs"), "legacy module")));
    Issue legacy = issue("bugs", "loose-equality", "if (legacy == 1) {}");
    Issue sample = issue("bugs", "loose-equality", "if (sample == 1) {}");

    assertEquals(List.of(sample), filter.process("old.js", List.of(legacy, sample)));
  }

  private static Issue issue(String analyzer, String type, String snippet) {
    return new Issue(Severity.HIGH, type, type, "finding", "app.js", 1, 1, snippet, "", analyzer);
  }
}
