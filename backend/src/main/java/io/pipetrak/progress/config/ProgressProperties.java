package io.pipetrak.progress.config;

import java.math.BigDecimal;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Tunables for schedule validation, resolver caching and rollup maintenance.
 *
 * @param weightTolerance allowed deviation of a resolved schedule's weight sum from 100
 * @param hoursTolerance allowed deviation between category earned hours and total earned hours
 * @param resolverCache sizing of the resolved-schedule cache
 * @param rollup how the dimension rollup cache is kept current
 */
@ConfigurationProperties(prefix = "pipetrak.progress")
public record ProgressProperties(
    @DefaultValue("0.01") BigDecimal weightTolerance,
    @DefaultValue("0.01") BigDecimal hoursTolerance,
    @DefaultValue ResolverCache resolverCache,
    @DefaultValue Rollup rollup) {

  public record ResolverCache(
      @DefaultValue("10000") long maximumSize, @DefaultValue("1h") Duration expireAfterWrite) {}

  /**
   * @param refreshMode EAGER applies each item change to its rollup rows in the writing
   *     transaction; SCHEDULED leaves refresh to the periodic rebuild
   * @param rebuildEnabled whether the periodic full rebuild runs
   * @param rebuildCron cron expression for the periodic rebuild
   */
  public record Rollup(
      @DefaultValue("EAGER") RefreshMode refreshMode,
      @DefaultValue("false") boolean rebuildEnabled,
      @DefaultValue("0 30 2 * * *") String rebuildCron) {}

  public enum RefreshMode {
    EAGER,
    SCHEDULED
  }

  /** Defaults used by unit tests and non-Spring callers. */
  public static ProgressProperties defaults() {
    return new ProgressProperties(
        new BigDecimal("0.01"),
        new BigDecimal("0.01"),
        new ResolverCache(10_000, Duration.ofHours(1)),
        new Rollup(RefreshMode.EAGER, false, "0 30 2 * * *"));
  }
}
