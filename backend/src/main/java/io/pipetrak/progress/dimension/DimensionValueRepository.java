package io.pipetrak.progress.dimension;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface DimensionValueRepository extends JpaRepository<DimensionValue, UUID> {

  List<DimensionValue> findByProjectIdAndDimensionOrderByName(
      UUID projectId, DimensionType dimension);

  List<DimensionValue> findByProjectIdOrderByDimensionAscNameAsc(UUID projectId);

  Optional<DimensionValue> findByIdAndProjectId(UUID id, UUID projectId);

  boolean existsByProjectIdAndDimensionAndNameIgnoreCase(
      UUID projectId, DimensionType dimension, String name);
}
