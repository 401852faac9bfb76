package zedtex.errors;

public abstract class IssueContext {

	public abstract void warn(Issue issue);

	public abstract boolean hasIssues();

}
