package io.pipetrak.progress.budget;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ManhourBudgetRepository extends JpaRepository<ManhourBudget, UUID> {

  Optional<ManhourBudget> findByProjectIdAndActiveTrue(UUID projectId);

  Optional<ManhourBudget> findTopByProjectIdOrderByVersionNumberDesc(UUID projectId);

  List<ManhourBudget> findByProjectIdOrderByVersionNumberDesc(UUID projectId);
}
