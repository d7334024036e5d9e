package io.github.panghy.lionrock.kv.inmemory;

import com.google.common.util.concurrent.MoreExecutors;
import io.github.panghy.lionrock.kv.client.*;
import io.github.panghy.lionrock.kv.client.impl.TxnCoordSenderFactory;
import io.github.panghy.lionrock.kv.client.util.RetryOptions;
import io.github.panghy.lionrock.kv.proto.*;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class InmemoryStoreTest {

  private static final RetryOptions NO_BACKOFF = RetryOptions.newBuilder().
      setInitialBackoffMillis(0).
      setMaxBackoffMillis(0).
      setMaxRetries(10).
      build();
  private static final ReplicaDescriptor STORE_1 = ReplicaDescriptor.newBuilder().setNodeId(1).setStoreId(1).build();

  private InmemoryStore store = new InmemoryStore();
  private DB db = open(store);

  @Test
  void putGet() {
    db.put("a", "hello");
    assertEquals("hello", new String(db.get("a").valueBytes(), StandardCharsets.UTF_8));
    assertFalse(db.get("missing").exists());
    assertEquals(1, store.getVersion());
  }

  @Test
  void cput() {
    db.cput("a", 1, null);
    ConditionFailedException e = assertThrows(ConditionFailedException.class, () -> db.cput("a", 2, null));
    assertEquals(Values.ofInt(1), e.getActualValue());
    assertEquals(0, e.getIndex().getAsInt());

    db.cput("a", 2, 1);
    assertEquals(2, db.get("a").valueInt());
    e = assertThrows(ConditionFailedException.class, () -> db.cput("b", 2, 1));
    assertNull(e.getActualValue());
  }

  @Test
  void initPut() {
    db.initPut("k", "v", false);
    db.initPut("k", "v", false);
    ConditionFailedException e = assertThrows(ConditionFailedException.class, () -> db.initPut("k", "w", false));
    assertEquals(Values.marshal("v"), e.getActualValue());

    db.del("k");
    assertThrows(ConditionFailedException.class, () -> db.initPut("k", "v", true));
    db.initPut("k", "v", false);
    assertTrue(db.get("k").exists());
  }

  @Test
  void inc() {
    assertEquals(5, db.inc("counter", 5).valueInt());
    assertEquals(8, db.inc("counter", 3).valueInt());
    assertEquals(8, db.get("counter").valueInt());

    db.put("text", "not a number");
    KvException e = assertThrows(KvException.class, () -> db.inc("text", 1));
    assertEquals(KvErrorCodes.error_code_value_type_mismatch, e.getCode());
    assertEquals(0, e.getIndex().getAsInt());
  }

  @Test
  void scan_resumeSpan() {
    for (String key : List.of("a", "b", "c", "d")) {
      db.put(key, key);
    }
    Batch b = db.newBatch();
    b.getHeader().setMaxSpanRequestKeys(3);
    b.scan("a", "z");
    b.reverseScan("a", "z");
    db.run(b);

    Result forward = b.getResults().get(0);
    assertEquals(List.of("a", "b", "c"), keys(forward.getRows()));
    assertEquals("d", forward.getResumeSpan().getKey().toStringUtf8());
    assertEquals("z", forward.getResumeSpan().getEndKey().toStringUtf8());
    assertEquals(ResumeReason.RESUME_KEY_LIMIT, forward.getResumeReason());

    // the key budget is spent.
    Result reverse = b.getResults().get(1);
    assertTrue(reverse.getRows().isEmpty());
    assertEquals("a", reverse.getResumeSpan().getKey().toStringUtf8());
    assertEquals("z", reverse.getResumeSpan().getEndKey().toStringUtf8());

    assertEquals(List.of("d", "c"), keys(db.reverseScan("a", "z", 2)));
    Batch limited = db.newBatch();
    limited.getHeader().setMaxSpanRequestKeys(2);
    limited.reverseScan("a", "z");
    db.run(limited);
    assertEquals("a", limited.getResults().get(0).getResumeSpan().getKey().toStringUtf8());
    assertEquals("c", limited.getResults().get(0).getResumeSpan().getEndKey().toStringUtf8());
    assertEquals(4, db.scan("a", "z", 0).size());
  }

  @Test
  void scan_continuesFromResumeSpan() {
    InmemoryStore split = new InmemoryStore(List.of(bytes("c")), List.of(STORE_1), true, Clock.systemUTC());
    DB db = open(split);
    for (String key : List.of("a", "b", "c", "d", "e")) {
      db.put(key, key);
    }
    List<List<String>> pages = new ArrayList<>();
    Object begin = "a";
    while (begin != null) {
      Batch b = db.newBatch();
      b.getHeader().setMaxSpanRequestKeys(2);
      b.scan(begin, "z");
      db.run(b);
      Result page = b.getResults().get(0);
      pages.add(keys(page.getRows()));
      begin = page.getResumeSpan() == null ? null : page.getResumeSpan().getKey().toByteArray();
    }
    assertEquals(List.of(List.of("a", "b"), List.of("c", "d"), List.of("e")), pages);
    assertEquals(0, split.getPendingTransactionCount());
  }

  @Test
  void delRange() {
    for (String key : List.of("a", "b", "c")) {
      db.put(key, key);
    }
    Batch b = db.newBatch();
    b.delRange("a", "c", true);
    db.run(b);
    assertEquals(List.of("a", "b"), b.getResults().get(0).getKeys().stream().
        map(k -> new String(k, StandardCharsets.UTF_8)).
        collect(Collectors.toList()));
    assertEquals(List.of("c"), keys(db.scan("a", "z", 0)));
  }

  @Test
  void run_isAtomic() {
    Batch b = db.newBatch();
    b.put("a", 1);
    b.cput("b", 2, 5);
    ConditionFailedException e = assertThrows(ConditionFailedException.class, () -> db.run(b));
    assertEquals(1, e.getIndex().getAsInt());
    assertFalse(db.get("a").exists());
    assertEquals(0, store.getVersion());
  }

  @Test
  void run_outOfOrderResponses() {
    InmemoryStore reversing = new InmemoryStore(List.of(), List.of(STORE_1), true, Clock.systemUTC());
    DB db = open(reversing);
    db.put("b", 2);
    Batch b = db.newBatch();
    b.get("b");
    b.put("c", 3);
    b.inc("d", 4);
    db.run(b);
    assertEquals(2, b.getResults().get(0).getRows().get(0).valueInt());
    assertEquals(3, b.getResults().get(1).getRows().get(0).valueInt());
    assertEquals(4, b.getResults().get(2).getRows().get(0).valueInt());
  }

  @Test
  void run_crossRangeBatchIsWrapped() {
    InmemoryStore split = new InmemoryStore(List.of(bytes("m")), List.of(STORE_1), false, Clock.systemUTC());
    DB db = open(split);
    assertEquals(2, split.getRangeDescriptors().size());

    Batch b = db.newBatch();
    b.put("a", 1);
    b.put("z", 2);
    db.run(b);
    assertFalse(b.getRawResponse().getHeader().hasTxn());
    assertEquals(2, b.getRawResponse().getResponsesCount());
    assertEquals(1, db.get("a").valueInt());
    assertEquals(2, db.get("z").valueInt());
    assertEquals(List.of("a", "z"), keys(db.scan("a", "zz", 0)));
    assertEquals(0, split.getPendingTransactionCount());

    // reads that do not need to be consistent are not wrapped.
    Batch inconsistent = db.newBatch();
    inconsistent.getHeader().setReadConsistency(ReadConsistency.INCONSISTENT);
    inconsistent.get("a");
    inconsistent.get("z");
    db.run(inconsistent);
    assertEquals(2, inconsistent.getResults().get(1).getRows().get(0).valueInt());
  }

  @Test
  void txn_isolation() {
    db.txn(txn -> {
      txn.put("k", 1);
      assertTrue(txn.get("k").exists());
      assertFalse(db.get("k").exists());
      return null;
    });
    assertEquals(1, db.get("k").valueInt());
    assertEquals(0, store.getPendingTransactionCount());
  }

  @Test
  void txn_conflictIsRetried() {
    db.put("x", 1);
    AtomicInteger invocations = new AtomicInteger();
    Long seen = db.txn("conflict", txn -> {
      long x = txn.get("x").valueInt();
      if (invocations.incrementAndGet() == 1) {
        // written after the transaction read it.
        db.put("x", 2);
      }
      txn.put("y", x);
      return x;
    });
    assertEquals(2, invocations.get());
    assertEquals(2L, seen);
    assertEquals(2, db.get("y").valueInt());
  }

  @Test
  void txn_rollback() {
    assertThrows(IllegalArgumentException.class, () -> db.txn(txn -> {
      txn.put("k", 1);
      throw new IllegalArgumentException("bad input");
    }));
    assertFalse(db.get("k").exists());
    assertEquals(0, store.getPendingTransactionCount());
  }

  @Test
  void txn_commitInBatch() {
    db.txn(txn -> {
      Batch b = txn.newBatch();
      b.inc("a", 1);
      b.inc("b", 2);
      txn.commitInBatch(b);
      return null;
    });
    assertEquals(2, db.get("b").valueInt());
    assertEquals(1, store.getVersion());
  }

  @Test
  void admin() {
    db.adminSplit("a", "m");
    List<RangeDescriptor> ranges = store.getRangeDescriptors();
    assertEquals(2, ranges.size());
    assertEquals("m", ranges.get(0).getEndKey().toStringUtf8());
    assertEquals(2, ranges.get(1).getGeneration());
    // splitting at a boundary is a no-op.
    db.adminSplit("m", "m");
    assertEquals(2, store.getRangeDescriptors().size());

    KvException e = assertThrows(KvException.class, () -> db.adminTransferLease("a", 2));
    assertEquals(KvErrorCodes.error_code_lease_transfer_rejected, e.getCode());

    RangeDescriptor desc = store.getRangeDescriptor(bytes("a"));
    RangeDescriptor updated = db.adminChangeReplicas("a", ReplicaChangeType.ADD_REPLICA,
        List.of(ReplicationTarget.newBuilder().setNodeId(2).setStoreId(2).build()), desc);
    assertEquals(2, updated.getReplicasCount());
    assertEquals(desc.getGeneration() + 1, updated.getGeneration());
    assertEquals(updated, store.getRangeDescriptor(bytes("a")));

    // stale descriptor.
    e = assertThrows(KvException.class, () -> db.adminChangeReplicas("a", ReplicaChangeType.REMOVE_REPLICA,
        List.of(ReplicationTarget.newBuilder().setNodeId(2).setStoreId(2).build()), desc));
    assertEquals(KvErrorCodes.error_code_replica_change_rejected, e.getCode());

    db.adminTransferLease("a", 2);
    assertEquals(2, store.getRangeDescriptor(bytes("a")).getLeaseHolderStoreId());

    db.adminRelocateRange("a", List.of(ReplicationTarget.newBuilder().setNodeId(3).setStoreId(3).build()));
    RangeDescriptor relocated = store.getRangeDescriptor(bytes("a"));
    assertEquals(1, relocated.getReplicasCount());
    assertEquals(3, relocated.getLeaseHolderStoreId());

    db.adminMerge("a");
    assertEquals(1, store.getRangeDescriptors().size());
    e = assertThrows(KvException.class, () -> db.adminMerge("a"));
    assertEquals(KvErrorCodes.error_code_merge_rejected, e.getCode());
  }

  @Test
  void admin_notInTransactions() {
    BatchRequest request = BatchRequest.newBuilder().
        setHeader(Header.newBuilder().setTxn(TxnMeta.newBuilder().setName("txn"))).
        addRequests(RequestUnion.newBuilder().
            setAdminMerge(AdminMergeRequest.getDefaultInstance())).
        build();
    KvException e = (KvException) KvErrors.unwrap(assertThrows(Exception.class, () -> store.send(request).join()));
    assertEquals(KvErrorCodes.error_code_unsupported_request, e.getCode());
  }

  private static DB open(InmemoryStore store) {
    return new DB(new TxnCoordSenderFactory(store, NO_BACKOFF, MoreExecutors.directExecutor()), Clock.systemUTC(),
        DBContext.newBuilder().setExecutor(MoreExecutors.directExecutor()).build());
  }

  private static byte[] bytes(String key) {
    return key.getBytes(StandardCharsets.UTF_8);
  }

  private static List<String> keys(List<io.github.panghy.lionrock.kv.client.KeyValue> rows) {
    return rows.stream().
        map(kv -> new String(kv.getKey(), StandardCharsets.UTF_8)).
        collect(Collectors.toList());
  }
}
