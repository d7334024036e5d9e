package io.github.panghy.lionrock.kv.client.util;

import com.google.common.base.Preconditions;

/**
 * Exponential back-off settings. Delays are drawn with full jitter: the n-th retry waits a random duration between 0
 * and {@code min(maxBackoffMillis, initialBackoffMillis * multiplier^n)}.
 *
 * @author Clement Pang
 */
public class RetryOptions {

  private final long initialBackoffMillis;
  private final long maxBackoffMillis;
  private final double multiplier;
  private final int maxRetries;

  private RetryOptions(long initialBackoffMillis, long maxBackoffMillis, double multiplier, int maxRetries) {
    this.initialBackoffMillis = initialBackoffMillis;
    this.maxBackoffMillis = maxBackoffMillis;
    this.multiplier = multiplier;
    this.maxRetries = maxRetries;
  }

  /**
   * @return 50ms initial back-off, 1s max back-off, a multiplier of 2 and no limit on the number of retries.
   */
  public static RetryOptions defaults() {
    return newBuilder().build();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public long getInitialBackoffMillis() {
    return initialBackoffMillis;
  }

  public long getMaxBackoffMillis() {
    return maxBackoffMillis;
  }

  public double getMultiplier() {
    return multiplier;
  }

  /**
   * @return The maximum number of retries (not counting the first attempt), 0 means unlimited.
   */
  public int getMaxRetries() {
    return maxRetries;
  }

  /**
   * @return Whether another retry is allowed after {@code retries} retries have been made.
   */
  public boolean canRetry(int retries) {
    return maxRetries <= 0 || retries < maxRetries;
  }

  /**
   * @param retry The 0-based number of the retry about to be made.
   * @return The jittered delay to wait before that retry.
   */
  public long backoffMillis(int retry) {
    double ceiling = Math.min(maxBackoffMillis, initialBackoffMillis * Math.pow(multiplier, retry));
    // full-jitter.
    return (long) (ceiling * Math.random());
  }

  @Override
  public String toString() {
    return "RetryOptions{" +
        "initialBackoffMillis=" + initialBackoffMillis +
        ", maxBackoffMillis=" + maxBackoffMillis +
        ", multiplier=" + multiplier +
        ", maxRetries=" + maxRetries +
        '}';
  }

  public static class Builder {
    private long initialBackoffMillis = 50;
    private long maxBackoffMillis = 1000;
    private double multiplier = 2;
    private int maxRetries = 0;

    public Builder setInitialBackoffMillis(long initialBackoffMillis) {
      Preconditions.checkArgument(initialBackoffMillis >= 0, "initialBackoffMillis must be >= 0");
      this.initialBackoffMillis = initialBackoffMillis;
      return this;
    }

    public Builder setMaxBackoffMillis(long maxBackoffMillis) {
      Preconditions.checkArgument(maxBackoffMillis >= 0, "maxBackoffMillis must be >= 0");
      this.maxBackoffMillis = maxBackoffMillis;
      return this;
    }

    public Builder setMultiplier(double multiplier) {
      Preconditions.checkArgument(multiplier >= 1, "multiplier must be >= 1");
      this.multiplier = multiplier;
      return this;
    }

    public Builder setMaxRetries(int maxRetries) {
      Preconditions.checkArgument(maxRetries >= 0, "maxRetries must be >= 0");
      this.maxRetries = maxRetries;
      return this;
    }

    public RetryOptions build() {
      Preconditions.checkArgument(initialBackoffMillis <= maxBackoffMillis,
          "initialBackoffMillis (%s) must not exceed maxBackoffMillis (%s)", initialBackoffMillis, maxBackoffMillis);
      return new RetryOptions(initialBackoffMillis, maxBackoffMillis, multiplier, maxRetries);
    }
  }
}
