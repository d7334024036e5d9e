package io.github.panghy.lionrock.kv.client.mixins;

import com.google.common.base.Preconditions;
import com.google.protobuf.Message;
import com.google.protobuf.Parser;
import io.github.panghy.lionrock.kv.client.Batch;
import io.github.panghy.lionrock.kv.client.KeyValue;
import io.github.panghy.lionrock.kv.client.KvErrors;
import io.github.panghy.lionrock.kv.client.Result;

import javax.annotation.Nullable;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Single-operation convenience calls shared by {@link io.github.panghy.lionrock.kv.client.DB} and
 * {@link io.github.panghy.lionrock.kv.client.Txn}. Each call builds a {@link Batch} with exactly one operation, runs it
 * and unpacks its only {@link Result}. Errors are thrown as the error recorded on that result.
 *
 * @author Clement Pang
 */
public interface KvOperationsMixin {

  Batch newBatch();

  /**
   * Run the batch and block until its results are filled.
   *
   * @throws RuntimeException The first error of the batch (usually a {@link io.github.panghy.lionrock.kv.client.KvException}).
   */
  void run(Batch b);

  CompletableFuture<Void> runAsync(Batch b);

  /**
   * Retrieve the value of a key. A missing key is not an error, the returned {@link KeyValue} does not
   * {@link KeyValue#exists() exist}.
   */
  default KeyValue get(Object key) {
    Batch b = newBatch();
    b.get(key);
    return getOneRow(b);
  }

  default CompletableFuture<KeyValue> getAsync(Object key) {
    Batch b = newBatch();
    b.get(key);
    return getOneResultAsync(b).thenApply(r -> r.getRows().get(0));
  }

  /**
   * Retrieve a proto value, the default instance is returned for a missing key.
   */
  default <T extends Message> T getProto(Object key, Parser<T> parser) {
    return get(key).valueProto(parser);
  }

  default void put(Object key, Object value) {
    Batch b = newBatch();
    b.put(key, value);
    getOneResult(b);
  }

  default CompletableFuture<Void> putAsync(Object key, Object value) {
    Batch b = newBatch();
    b.put(key, value);
    return getOneResultAsync(b).thenApply(r -> null);
  }

  default void putInline(Object key, Object value) {
    Batch b = newBatch();
    b.putInline(key, value);
    getOneResult(b);
  }

  /**
   * Set the value of a key only if its current value is {@code expValue} (or if it does not exist when
   * {@code expValue} is null).
   *
   * @throws io.github.panghy.lionrock.kv.client.ConditionFailedException if the condition does not hold.
   */
  default void cput(Object key, Object value, @Nullable Object expValue) {
    Batch b = newBatch();
    b.cput(key, value, expValue);
    getOneResult(b);
  }

  default void initPut(Object key, Object value, boolean failOnTombstones) {
    Batch b = newBatch();
    b.initPut(key, value, failOnTombstones);
    getOneResult(b);
  }

  /**
   * Increment the INT value of a key.
   *
   * @return The key with its new value.
   */
  default KeyValue inc(Object key, long value) {
    Batch b = newBatch();
    b.inc(key, value);
    return getOneRow(b);
  }

  default CompletableFuture<KeyValue> incAsync(Object key, long value) {
    Batch b = newBatch();
    b.inc(key, value);
    return getOneResultAsync(b).thenApply(r -> r.getRows().get(0));
  }

  /**
   * Retrieve the rows in [begin, end) in ascending order.
   *
   * @param maxRows Maximum number of rows to return, 0 for no limit.
   */
  default List<KeyValue> scan(Object begin, Object end, long maxRows) {
    Batch b = newBatch();
    if (maxRows > 0) {
      b.getHeader().setMaxSpanRequestKeys(maxRows);
    }
    b.scan(begin, end);
    return getOneResult(b).getRows();
  }

  default CompletableFuture<List<KeyValue>> scanAsync(Object begin, Object end, long maxRows) {
    Batch b = newBatch();
    if (maxRows > 0) {
      b.getHeader().setMaxSpanRequestKeys(maxRows);
    }
    b.scan(begin, end);
    return getOneResultAsync(b).thenApply(Result::getRows);
  }

  /**
   * Retrieve the rows in [begin, end) in descending order.
   *
   * @param maxRows Maximum number of rows to return, 0 for no limit.
   */
  default List<KeyValue> reverseScan(Object begin, Object end, long maxRows) {
    Batch b = newBatch();
    if (maxRows > 0) {
      b.getHeader().setMaxSpanRequestKeys(maxRows);
    }
    b.reverseScan(begin, end);
    return getOneResult(b).getRows();
  }

  /**
   * Delete one or more keys.
   */
  default void del(Object... keys) {
    Batch b = newBatch();
    b.del(keys);
    getOneResult(b);
  }

  /**
   * Delete the rows in [begin, end).
   */
  default void delRange(Object begin, Object end) {
    Batch b = newBatch();
    b.delRange(begin, end, false);
    getOneResult(b);
  }

  /**
   * Run a batch that holds a single operation and return its result.
   *
   * @throws RuntimeException the error recorded on the result when the batch failed.
   * @throws IllegalStateException if the batch succeeded although its result carries an error.
   */
  default Result getOneResult(Batch b) {
    try {
      run(b);
    } catch (RuntimeException e) {
      throw oneError(b, e);
    }
    Result res = b.getResults().get(0);
    Preconditions.checkState(res.getErr() == null, "run succeeded even though the result has an error");
    return res;
  }

  default CompletableFuture<Result> getOneResultAsync(Batch b) {
    return runAsync(b).handle((v, t) -> {
      if (t != null) {
        throw oneError(b, KvErrors.unwrapToRuntimeException(t));
      }
      Result res = b.getResults().get(0);
      Preconditions.checkState(res.getErr() == null, "run succeeded even though the result has an error");
      return res;
    });
  }

  private KeyValue getOneRow(Batch b) {
    return getOneResult(b).getRows().get(0);
  }

  private static RuntimeException oneError(Batch b, RuntimeException runErr) {
    if (!b.getResults().isEmpty() && b.getResults().get(0).getErr() != null) {
      return b.getResults().get(0).getErr();
    }
    return runErr;
  }
}
