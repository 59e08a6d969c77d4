package work.deeployd.workflow.deps;

/**
 * Hosting coordinates parsed out of a custom node repository URL.
 */
public record RepositoryInfo(String platform, String owner, String repo, String url) {}
