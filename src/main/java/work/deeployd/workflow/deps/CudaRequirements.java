package work.deeployd.workflow.deps;

import java.util.List;
import java.util.Optional;

/**
 * GPU packages found among the declared python dependencies.
 */
public record CudaRequirements(List<String> cudaPackages, String recommendedCudaVersion) {
    public CudaRequirements {
        cudaPackages = List.copyOf(cudaPackages);
    }

    public boolean requiresCuda() {
        return !cudaPackages.isEmpty();
    }

    public Optional<String> recommendedVersion() {
        return Optional.ofNullable(recommendedCudaVersion);
    }
}
