package com.gate.builder;

/**
 * Property paths and event names of the CI platform's evaluation context.
 */
public final class GitHubContext {

    private GitHubContext() {
    }

    public static final String EVENT_NAME = "github.event_name";
    public static final String EVENT_ACTION = "github.event.action";
    public static final String REPOSITORY = "github.repository";
    public static final String REF = "github.ref";

    public static final String PR_HEAD_REPO_FULL_NAME = "github.event.pull_request.head.repo.full_name";
    public static final String PR_DRAFT = "github.event.pull_request.draft";
    public static final String ISSUE_PULL_REQUEST = "github.event.issue.pull_request";
    public static final String ISSUE_LABEL_NAMES = "github.event.issue.labels.*.name";
    public static final String LABEL_NAME = "github.event.label.name";

    /**
     * Event names.
     */
    public static final class Events {
        public static final String ISSUES = "issues";
        public static final String ISSUE_COMMENT = "issue_comment";
        public static final String PULL_REQUEST = "pull_request";
        public static final String PULL_REQUEST_REVIEW = "pull_request_review";
        public static final String PULL_REQUEST_REVIEW_COMMENT = "pull_request_review_comment";
        public static final String DISCUSSION = "discussion";
        public static final String DISCUSSION_COMMENT = "discussion_comment";

        private Events() {
        }
    }

    /**
     * Job whose result and outputs gate the safe-output jobs.
     */
    public static final String DEFAULT_AGENT_JOB_NAME = "agent";

    public static String jobResult(String jobName) {
        return "needs." + jobName + ".result";
    }

    public static String jobOutput(String jobName, String output) {
        return "needs." + jobName + ".outputs." + output;
    }
}
