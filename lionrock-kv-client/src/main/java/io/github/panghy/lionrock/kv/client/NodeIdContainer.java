package io.github.panghy.lionrock.kv.client;

import com.google.common.base.Preconditions;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Holds the id of the node a {@link DB} runs on. The id may not be known when the DB is created, it is set once
 * afterwards and read whenever a transaction is started (as its gateway node).
 */
public class NodeIdContainer {

  private final AtomicInteger nodeId = new AtomicInteger();

  /**
   * @return The node id, 0 if not yet known.
   */
  public int get() {
    return nodeId.get();
  }

  /**
   * Set the node id. It can only be set once, setting it to the same value again is allowed.
   */
  public void set(int id) {
    Preconditions.checkArgument(id > 0, "node id must be positive: %s", id);
    int previous = nodeId.compareAndExchange(0, id);
    Preconditions.checkState(previous == 0 || previous == id,
        "node id already set to %s, cannot change it to %s", previous, id);
  }

  @Override
  public String toString() {
    int id = nodeId.get();
    return id == 0 ? "?" : Integer.toString(id);
  }
}
