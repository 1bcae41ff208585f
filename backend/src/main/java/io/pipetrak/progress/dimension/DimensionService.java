package io.pipetrak.progress.dimension;

import io.pipetrak.progress.exception.InvalidStateException;
import io.pipetrak.progress.exception.ResourceConflictException;
import io.pipetrak.progress.exception.ResourceNotFoundException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class DimensionService {

  private static final Logger log = LoggerFactory.getLogger(DimensionService.class);

  private final DimensionValueRepository dimensionValueRepository;

  public DimensionService(DimensionValueRepository dimensionValueRepository) {
    this.dimensionValueRepository = dimensionValueRepository;
  }

  @Transactional
  public DimensionValue createValue(UUID projectId, DimensionType dimension, String name) {
    if (name == null || name.isBlank()) {
      throw new InvalidStateException("Invalid dimension value", "Name is required");
    }
    String trimmed = name.trim();
    if (dimensionValueRepository.existsByProjectIdAndDimensionAndNameIgnoreCase(
        projectId, dimension, trimmed)) {
      throw new ResourceConflictException(
          "Dimension value exists",
          dimension.name() + " value '" + trimmed + "' already exists in project " + projectId);
    }
    var value = dimensionValueRepository.save(new DimensionValue(projectId, dimension, trimmed));
    log.info(
        "Created {} value {} '{}' in project {}", dimension, value.getId(), trimmed, projectId);
    return value;
  }

  @Transactional(readOnly = true)
  public List<DimensionValue> listValues(UUID projectId, DimensionType dimension) {
    if (dimension == null) {
      return dimensionValueRepository.findByProjectIdOrderByDimensionAscNameAsc(projectId);
    }
    return dimensionValueRepository.findByProjectIdAndDimensionOrderByName(projectId, dimension);
  }

  /**
   * Validates an assignment: the value must belong to the project and to the expected dimension. A
   * null id is a valid "no assignment".
   */
  @Transactional(readOnly = true)
  public UUID requireValue(UUID projectId, UUID valueId, DimensionType expected) {
    if (valueId == null) {
      return null;
    }
    var value =
        dimensionValueRepository
            .findByIdAndProjectId(valueId, projectId)
            .orElseThrow(() -> new ResourceNotFoundException("DimensionValue", valueId));
    if (value.getDimension() != expected) {
      throw new InvalidStateException(
          "Invalid dimension value",
          "Value " + valueId + " is a " + value.getDimension() + ", expected " + expected);
    }
    return valueId;
  }

  /** Display names of the project's values of one dimension, keyed by id. */
  @Transactional(readOnly = true)
  public Map<UUID, String> names(UUID projectId, DimensionType dimension) {
    var names = new HashMap<UUID, String>();
    for (var value :
        dimensionValueRepository.findByProjectIdAndDimensionOrderByName(projectId, dimension)) {
      names.put(value.getId(), value.getName());
    }
    return names;
  }
}
