package ca.gc.cra.medingest.infrastructure.extract;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Ordered list of parser attempts, run until one yields content.
 * <p><strong>Why:</strong> Format parsers fail in many ways; every failure is turned into a uniform
 * {@link AttemptResult} so callers never see parser exceptions.</p>
 * <p><strong>Role:</strong> Fallback mechanism shared by the binary-format extractors.</p>
 * <p>An attempt counts as failed when it throws, reports failure, or returns blank content. Results from any
 * attempt after the first are capped at {@value #FALLBACK_CAP}.</p>
 * <p><strong>Thread-safety:</strong> Immutable once built; attempts must be stateless.</p>
 * <p><strong>Observability:</strong> Logs each failed attempt at DEBUG and exhaustion at WARN.</p>
 *
 * @since 0.1.0
 */
public final class AttemptChain {
  private static final Logger log = LoggerFactory.getLogger(AttemptChain.class);

  /** Maximum confidence of output produced by a fallback parser. */
  public static final double FALLBACK_CAP = 0.8;

  /** One parser attempt. */
  @FunctionalInterface
  public interface Attempt {
    /**
     * Runs the parser.
     *
     * @param path file to parse
     * @return attempt result
     * @throws Exception any parser failure; converted into a failed result by the chain
     */
    AttemptResult run(Path path) throws Exception;
  }

  private record Named(String name, Attempt attempt) {}

  private final List<Named> attempts;

  private AttemptChain(List<Named> attempts) {
    this.attempts = List.copyOf(attempts);
  }

  /**
   * Starts a chain with its primary parser.
   *
   * @param name label used in logs
   * @param attempt primary parser
   * @return builder
   */
  public static Builder primary(String name, Attempt attempt) {
    return new Builder().then(name, attempt);
  }

  /**
   * Runs the attempts in order.
   *
   * @param path file to parse
   * @return first successful result, or a failed result naming every attempt's failure
   */
  public AttemptResult run(Path path) {
    List<String> failures = new ArrayList<>();
    for (int i = 0; i < attempts.size(); i++) {
      Named named = attempts.get(i);
      AttemptResult result;
      try {
        result = named.attempt().run(path);
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        failures.add(named.name() + ": interrupted");
        break;
      } catch (Exception ex) {
        result = AttemptResult.failure(ex.getClass().getSimpleName() + ": " + ex.getMessage());
      }
      if (result != null && result.success() && !result.content().isBlank()) {
        return i == 0 ? result : result.capped(FALLBACK_CAP);
      }
      String reason = result == null || result.failure() == null ? "empty output" : result.failure();
      log.debug("Extraction attempt {} failed for {}: {}", named.name(), path, reason);
      failures.add(named.name() + ": " + reason);
    }
    log.warn("All extraction attempts failed for {}", path);
    return AttemptResult.failure(String.join("; ", failures));
  }

  /** Builder for {@link AttemptChain}. */
  public static final class Builder {
    private final List<Named> attempts = new ArrayList<>();

    private Builder() {}

    /**
     * Appends a fallback attempt.
     *
     * @param name label used in logs
     * @param attempt parser
     * @return this builder
     */
    public Builder then(String name, Attempt attempt) {
      attempts.add(new Named(Objects.requireNonNull(name, "name"), Objects.requireNonNull(attempt, "attempt")));
      return this;
    }

    /**
     * Builds the chain.
     *
     * @return immutable chain
     */
    public AttemptChain build() {
      return new AttemptChain(attempts);
    }
  }
}
