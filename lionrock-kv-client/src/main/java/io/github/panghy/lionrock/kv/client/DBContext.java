package io.github.panghy.lionrock.kv.client;

import com.google.common.base.Preconditions;

import java.util.concurrent.Executor;

/**
 * Configuration of a {@link DB}.
 *
 * @author Clement Pang
 */
public class DBContext {

  /**
   * The user priority of requests that do not set one.
   */
  public static final double NORMAL_USER_PRIORITY = 1.0;

  private final double userPriority;
  private final NodeIdContainer nodeId;
  private final Executor executor;

  private DBContext(double userPriority, NodeIdContainer nodeId, Executor executor) {
    this.userPriority = userPriority;
    this.nodeId = nodeId;
    this.executor = executor;
  }

  /**
   * @return A context with normal user priority, an unset node id and {@link RemoteDBFactory#DEFAULT_EXECUTOR}.
   */
  public static DBContext defaults() {
    return newBuilder().build();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  /**
   * @return The default user priority applied to batches that do not carry one.
   */
  public double getUserPriority() {
    return userPriority;
  }

  public NodeIdContainer getNodeId() {
    return nodeId;
  }

  /**
   * @return The executor that runs asynchronous work (transaction retries, auto-wrapped batches).
   */
  public Executor getExecutor() {
    return executor;
  }

  public static class Builder {
    private double userPriority = NORMAL_USER_PRIORITY;
    private NodeIdContainer nodeId = new NodeIdContainer();
    private Executor executor = RemoteDBFactory.DEFAULT_EXECUTOR;

    public Builder setUserPriority(double userPriority) {
      Preconditions.checkArgument(userPriority > 0, "user priority must be positive: %s", userPriority);
      this.userPriority = userPriority;
      return this;
    }

    public Builder setNodeId(NodeIdContainer nodeId) {
      this.nodeId = Preconditions.checkNotNull(nodeId);
      return this;
    }

    public Builder setExecutor(Executor executor) {
      this.executor = Preconditions.checkNotNull(executor);
      return this;
    }

    public DBContext build() {
      return new DBContext(userPriority, nodeId, executor);
    }
  }
}
