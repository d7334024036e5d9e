package io.github.panghy.lionrock.kv.client;

import com.google.common.util.concurrent.MoreExecutors;
import com.google.protobuf.ByteString;
import io.github.panghy.lionrock.kv.client.impl.TxnCoordSenderFactory;
import io.github.panghy.lionrock.kv.client.util.RetryOptions;
import io.github.panghy.lionrock.kv.proto.BatchRequest;
import io.github.panghy.lionrock.kv.proto.ReadConsistency;
import io.github.panghy.lionrock.kv.proto.RequestUnion;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static java.util.concurrent.CompletableFuture.failedFuture;
import static org.junit.jupiter.api.Assertions.*;

class DBTxnTest {

  private static final RetryOptions NO_BACKOFF = RetryOptions.newBuilder().
      setInitialBackoffMillis(0).
      setMaxBackoffMillis(0).
      setMaxRetries(3).
      build();

  private EchoSender store;
  private DB db;

  @BeforeEach
  void setUp() {
    store = new EchoSender();
    db = new DB(new TxnCoordSenderFactory(store, NO_BACKOFF, MoreExecutors.directExecutor()), Clock.systemUTC(),
        DBContext.newBuilder().setExecutor(MoreExecutors.directExecutor()).build());
  }

  @Test
  void txn_commitsAfterClosure() {
    AtomicInteger invocations = new AtomicInteger();
    String result = db.txn("simple", txn -> {
      invocations.incrementAndGet();
      txn.put("a", 1);
      return "done";
    });
    assertEquals("done", result);
    assertEquals(1, invocations.get());

    List<BatchRequest> sent = store.getRequests();
    assertEquals(2, sent.size());
    assertTrue(sent.get(0).getRequests(0).hasPut());
    assertEquals("simple", sent.get(0).getHeader().getTxn().getName());
    RequestUnion endTxn = sent.get(1).getRequests(0);
    assertTrue(endTxn.getEndTransaction().getCommit());
    assertEquals(sent.get(0).getHeader().getTxn().getId(), sent.get(1).getHeader().getTxn().getId());
  }

  @Test
  void txn_commitInBatch() {
    db.txn(txn -> {
      Batch b = txn.newBatch();
      b.put("a", 1);
      b.put("b", 2);
      txn.commitInBatch(b);
      assertTrue(txn.isFinalized());
      return null;
    });
    // no separate commit.
    assertEquals(1, store.getRequests().size());
    BatchRequest sent = store.lastRequest();
    assertEquals(3, sent.getRequestsCount());
    assertTrue(sent.getRequests(2).hasEndTransaction());
  }

  @Test
  void txn_retriesWithSameTxn() {
    AtomicInteger invocations = new AtomicInteger();
    AtomicReference<Txn> seen = new AtomicReference<>();
    Integer epoch = db.txn(txn -> {
      if (seen.get() != null) {
        assertSame(seen.get(), txn);
      }
      seen.set(txn);
      if (invocations.incrementAndGet() < 3) {
        throw new TransactionRetryException("conflict", txn.getMeta().getId());
      }
      txn.put("a", 1);
      return txn.getMeta().getEpoch();
    });
    assertEquals(3, invocations.get());
    assertEquals(2, epoch);
    assertEquals(2, store.lastRequest().getHeader().getTxn().getEpoch());
  }

  @Test
  void txn_retriesOnCommitConflict() {
    AtomicInteger invocations = new AtomicInteger();
    db.txn(txn -> {
      if (invocations.incrementAndGet() == 1) {
        // the commit that follows is refused.
        store.failNext(new TransactionRetryException("conflict", ByteString.EMPTY));
      }
      return null;
    });
    assertEquals(2, invocations.get());
    // commit (failed), then commit again.
    assertEquals(2, store.getRequests().size());
    assertEquals(1, store.lastRequest().getHeader().getTxn().getEpoch());
  }

  @Test
  void txn_retriesExhausted() {
    AtomicInteger invocations = new AtomicInteger();
    TerminatedRetryableException e = assertThrows(TerminatedRetryableException.class, () -> db.txn(txn -> {
      invocations.incrementAndGet();
      throw new TransactionRetryException("conflict", txn.getMeta().getId());
    }));
    assertEquals(4, invocations.get());
    assertFalse(e.isRetryable());
    assertTrue(e.getCause() instanceof TransactionRetryException);
    // rolled back.
    RequestUnion last = store.lastRequest().getRequests(0);
    assertFalse(last.getEndTransaction().getCommit());
  }

  @Test
  void txn_otherTxnRetryErrorIsNotRetried() {
    AtomicInteger invocations = new AtomicInteger();
    ByteString otherTxn = ByteString.copyFromUtf8("another transaction");
    TerminatedRetryableException e = assertThrows(TerminatedRetryableException.class, () -> db.txn(txn -> {
      invocations.incrementAndGet();
      throw new TransactionRetryException("conflict", otherTxn);
    }));
    assertEquals(1, invocations.get());
    assertEquals(otherTxn, ((TransactionRetryException) e.getCause()).getTxnId());
  }

  @Test
  void txn_nonRetryableError() {
    AtomicInteger invocations = new AtomicInteger();
    ConditionFailedException e = assertThrows(ConditionFailedException.class, () -> db.txn(txn -> {
      invocations.incrementAndGet();
      store.failNext(new ConditionFailedException("exists", Values.ofInt(1)).setIndex(0));
      txn.cput("a", 1, null);
      return null;
    }));
    assertEquals(1, invocations.get());
    assertEquals(0, e.getIndex().getAsInt());
    assertFalse(store.lastRequest().getRequests(0).getEndTransaction().getCommit());
  }

  @Test
  void txn_applicationError() {
    IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> db.txn(txn -> {
      txn.put("a", 1);
      throw new IllegalArgumentException("bad input");
    }));
    assertEquals("bad input", e.getMessage());
    // put, then rollback.
    assertEquals(2, store.getRequests().size());
  }

  @Test
  void txn_rollbackFailureIsNotThrown() {
    IllegalStateException e = assertThrows(IllegalStateException.class, () -> db.txn(txn -> {
      store.failNext(new KvException("store unavailable", KvErrorCodes.error_code_rpc_failed));
      throw new IllegalStateException("bad state");
    }));
    assertEquals("bad state", e.getMessage());
    assertEquals(1, store.getRequests().size());
  }

  @Test
  void txn_inconsistentReadsRejected() {
    KvException e = assertThrows(KvException.class, () -> db.txn(txn -> {
      Batch b = txn.newBatch();
      b.getHeader().setReadConsistency(ReadConsistency.READ_UNCOMMITTED);
      b.get("a");
      txn.run(b);
      return null;
    }));
    assertEquals(KvErrorCodes.error_code_read_consistency_unsupported, e.getCode());
  }

  @Test
  void txnAsync_retries() {
    AtomicInteger invocations = new AtomicInteger();
    CompletableFuture<Long> result = db.txnAsync("async", txn -> {
      if (invocations.incrementAndGet() == 1) {
        return failedFuture(new TransactionRetryException("conflict", txn.getMeta().getId()));
      }
      return txn.incAsync("a", 3).thenApply(KeyValue::valueInt);
    });
    assertEquals(3L, result.join());
    assertEquals(2, invocations.get());
  }

  @Test
  void txnAsync_terminated() {
    CompletableFuture<Object> result = db.txnAsync(txn ->
        failedFuture(new TransactionRetryException("conflict", txn.getMeta().getId())));
    CompletionException e = assertThrows(CompletionException.class, result::join);
    assertTrue(e.getCause() instanceof TerminatedRetryableException);
  }

  @Test
  void txnAsync_closureThrows() {
    CompletableFuture<Object> result = db.txnAsync(txn -> {
      throw new IllegalArgumentException("bad input");
    });
    CompletionException e = assertThrows(CompletionException.class, result::join);
    assertTrue(e.getCause() instanceof IllegalArgumentException);
  }

  @Test
  void txn_rollbackIsIdempotent() {
    db.txn(txn -> {
      txn.rollback();
      txn.rollback();
      assertTrue(txn.isFinalized());
      // commit of a finalized transaction sends nothing.
      txn.commit();
      return null;
    });
    assertEquals(1, store.getRequests().size());
    assertFalse(store.lastRequest().getRequests(0).getEndTransaction().getCommit());
  }
}
