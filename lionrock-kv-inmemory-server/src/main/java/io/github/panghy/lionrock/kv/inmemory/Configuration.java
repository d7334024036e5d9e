package io.github.panghy.lionrock.kv.inmemory;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "lionrock.inmemory")
public class Configuration {

  /**
   * Keys at which the key space is initially split into ranges (as UTF-8 strings).
   */
  private List<String> splitKeys = new ArrayList<>();

  /**
   * Replicas of every initial range, the first one holds the lease. Defaults to node 1, store 1.
   */
  private List<Replica> replicas = new ArrayList<>();

  /**
   * Internal options (mainly for testing).
   */
  private InternalOptions internal = new InternalOptions();

  public List<String> getSplitKeys() {
    return splitKeys;
  }

  public void setSplitKeys(List<String> splitKeys) {
    this.splitKeys = splitKeys;
  }

  public List<Replica> getReplicas() {
    return replicas;
  }

  public void setReplicas(List<Replica> replicas) {
    this.replicas = replicas;
  }

  public InternalOptions getInternal() {
    return internal;
  }

  public void setInternal(InternalOptions internal) {
    this.internal = internal;
  }

  public static class Replica {
    private int nodeId;
    private int storeId;

    public int getNodeId() {
      return nodeId;
    }

    public int getStoreId() {
      return storeId;
    }

    public void setNodeId(int nodeId) {
      this.nodeId = nodeId;
    }

    public void setStoreId(int storeId) {
      this.storeId = storeId;
    }
  }

  /**
   * Internal options to simulate different behaviors.
   */
  public static class InternalOptions {
    /**
     * Whether responses are returned in the reverse order of the requests of a batch.
     */
    private boolean simulateOutOfOrderResponses = false;

    public boolean isSimulateOutOfOrderResponses() {
      return simulateOutOfOrderResponses;
    }

    public void setSimulateOutOfOrderResponses(boolean simulateOutOfOrderResponses) {
      this.simulateOutOfOrderResponses = simulateOutOfOrderResponses;
    }
  }
}
