package org.springaicommunity.github.contributions;

/**
 * The requested GitHub user does not exist.
 */
public class SubjectNotFoundException extends RuntimeException {

	private final String subject;

	public SubjectNotFoundException(String subject) {
		super("GitHub user '" + subject + "' not found");
		this.subject = subject;
	}

	public SubjectNotFoundException(String subject, Throwable cause) {
		super("GitHub user '" + subject + "' not found", cause);
		this.subject = subject;
	}

	public String getSubject() {
		return subject;
	}

}
