package work.deeployd.workflow.deps;

public record ModelFileInfo(String filename, String extension, String type, String fullPath) {}
