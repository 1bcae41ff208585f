package io.pipetrak.progress.rollup;

import io.pipetrak.progress.config.ProgressProperties;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic full rebuild of every project's rollup rows. Required in SCHEDULED refresh mode; in
 * EAGER mode it heals any drift left by out-of-band changes.
 */
@Component
public class RollupRebuildJob {

  private static final Logger log = LoggerFactory.getLogger(RollupRebuildJob.class);

  private final RollupService rollupService;
  private final ProgressProperties properties;

  public RollupRebuildJob(RollupService rollupService, ProgressProperties properties) {
    this.rollupService = rollupService;
    this.properties = properties;
  }

  @Scheduled(cron = "${pipetrak.progress.rollup.rebuild-cron:0 30 2 * * *}")
  public void rebuildAll() {
    if (!properties.rollup().rebuildEnabled()) {
      log.debug("Rollup rebuild job disabled");
      return;
    }
    log.info("Rollup rebuild job started");
    var projects = rollupService.activeProjects();
    int rebuilt = 0;
    for (UUID projectId : projects) {
      try {
        rollupService.rebuild(projectId);
        rebuilt++;
      } catch (RuntimeException e) {
        log.error("Rollup rebuild failed for project {}", projectId, e);
      }
    }
    log.info(
        "Rollup rebuild job completed: {} of {} projects rebuilt", rebuilt, projects.size());
  }
}
