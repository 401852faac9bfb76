package zedtex.errors;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Collects the issues of one generation run in the order they were raised.
 */
public class TopLevelIssueContext extends IssueContext {

	private final List<Issue> issues;

	public TopLevelIssueContext() {
		this.issues = new ArrayList<>();
	}

	@Override
	public void warn(Issue issue) {
		issues.add(issue);
	}

	@Override
	public boolean hasIssues() {
		return !issues.isEmpty();
	}

	public List<Issue> getIssues() {
		return Collections.unmodifiableList(issues);
	}

	/**
	 * @return the formatted message of every issue, as reported to the caller
	 */
	public List<String> getWarnings() {
		List<String> warnings = new ArrayList<>();
		for(Issue issue : issues) {
			warnings.add(issue.getMessage());
		}
		return warnings;
	}

	/**
	 * @return a one-line count such as "2 warnings: 1 line too long, 1 unknown proof label"
	 */
	public String summary() {
		int longLines = 0;
		int unknownLabels = 0;
		for(Issue issue : issues) {
			if(issue.accept(IssueKind.INSTANCE) == IssueKind.Kind.LINE_TOO_LONG) {
				++longLines;
			} else {
				++unknownLabels;
			}
		}
		StringBuilder summary = new StringBuilder();
		summary.append(issues.size()).append(issues.size() == 1 ? " warning" : " warnings");
		String separator = ": ";
		if(longLines > 0) {
			summary.append(separator).append(longLines).append(longLines == 1 ? " line" : " lines")
					.append(" too long");
			separator = ", ";
		}
		if(unknownLabels > 0) {
			summary.append(separator).append(unknownLabels).append(" unknown proof label")
					.append(unknownLabels == 1 ? "" : "s");
		}
		return summary.toString();
	}
}
