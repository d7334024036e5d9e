package io.github.panghy.lionrock.kv.client;

import com.google.common.base.Preconditions;
import com.google.protobuf.ByteString;
import io.github.panghy.lionrock.kv.client.impl.Requests;
import io.github.panghy.lionrock.kv.proto.*;

import javax.annotation.Nullable;
import java.util.*;
import java.util.concurrent.CompletableFuture;

import static java.util.concurrent.CompletableFuture.failedFuture;

/**
 * A collection of operations that are sent to the store in a single exchange. Operations are added with the builder
 * methods (e.g. {@link #get(Object)}, {@link #put(Object, Object)}) and the batch is executed with
 * {@link DB#run(Batch)} or {@link Txn#run(Batch)}. After it has run, {@link #getResults()} holds one {@link Result} per
 * builder call, in call order, regardless of the order in which the store answered.
 * <p>
 * Keys and values are marshalled when the operation is added, marshalling failures are recorded on the result of that
 * operation and reported when the batch is run (without contacting the store).
 * <p>
 * A batch is not thread-safe and can only be run once.
 *
 * @author Clement Pang
 */
public class Batch {

  private final Header.Builder header = Header.newBuilder();
  private final List<RequestUnion> requests = new ArrayList<>();
  private final List<Result> results = new ArrayList<>();
  /**
   * The transaction that created this batch, if any.
   */
  @Nullable
  final Txn txn;
  /**
   * Raw batches carry requests that were added with {@link #addRawRequest(RequestUnion...)}, their results are not
   * filled and the response is only available via {@link #getRawResponse()}.
   */
  private boolean raw;
  private boolean used;
  @Nullable
  private BatchResponse response;
  @Nullable
  private RuntimeException exchangeError;

  public Batch() {
    this(null);
  }

  Batch(@Nullable Txn txn) {
    this.txn = txn;
  }

  /**
   * @return The header applied to the whole batch (read consistency, key budget of span requests, user priority).
   */
  public Header.Builder getHeader() {
    return header;
  }

  public List<Result> getResults() {
    return Collections.unmodifiableList(results);
  }

  /**
   * @return The response of the store, available after the batch has run successfully.
   */
  @Nullable
  public BatchResponse getRawResponse() {
    return response;
  }

  /**
   * Retrieve the value of a key. A missing key produces a row without a value.
   */
  public void get(Object key) {
    ByteString k;
    try {
      k = Values.marshalKey(key);
    } catch (KvException e) {
      initResult(0, 1, false, e);
      return;
    }
    appendRequest(RequestUnion.newBuilder().setGet(GetRequest.newBuilder().setKey(k)));
    initResult(1, 1, false, null);
  }

  /**
   * Set the value of a key. See {@link Values#marshal(Object)} for the supported value types.
   */
  public void put(Object key, Object value) {
    put(key, value, false);
  }

  /**
   * Set the value of a key, the value is stored without versioning (inline).
   */
  public void putInline(Object key, Object value) {
    put(key, value, true);
  }

  private void put(Object key, Object value, boolean inline) {
    ByteString k;
    Value v;
    try {
      k = Values.marshalKey(key);
      v = Values.marshal(value);
    } catch (KvException e) {
      initResult(0, 1, false, e);
      return;
    }
    appendRequest(RequestUnion.newBuilder().setPut(PutRequest.newBuilder().
        setKey(k).
        setValue(v).
        setInline(inline)));
    initResult(1, 1, false, null);
  }

  /**
   * Conditionally set the value of a key. The put only happens if the existing value equals {@code expValue}, a null
   * {@code expValue} requires the key to not exist. Otherwise the result fails with a
   * {@link ConditionFailedException} that carries the actual value.
   */
  public void cput(Object key, Object value, @Nullable Object expValue) {
    ConditionalPutRequest.Builder builder = ConditionalPutRequest.newBuilder();
    try {
      builder.setKey(Values.marshalKey(key));
      builder.setValue(Values.marshal(value));
      if (expValue != null) {
        builder.setExpValue(Values.marshal(expValue));
      }
    } catch (KvException e) {
      initResult(0, 1, false, e);
      return;
    }
    appendRequest(RequestUnion.newBuilder().setConditionalPut(builder));
    initResult(1, 1, false, null);
  }

  /**
   * Set the value of a key only if it does not exist or already has the same value.
   *
   * @param failOnTombstones Whether a deleted key counts as existing.
   */
  public void initPut(Object key, Object value, boolean failOnTombstones) {
    ByteString k;
    Value v;
    try {
      k = Values.marshalKey(key);
      v = Values.marshal(value);
    } catch (KvException e) {
      initResult(0, 1, false, e);
      return;
    }
    appendRequest(RequestUnion.newBuilder().setInitPut(InitPutRequest.newBuilder().
        setKey(k).
        setValue(v).
        setFailOnTombstones(failOnTombstones)));
    initResult(1, 1, false, null);
  }

  /**
   * Increment an INT value, a missing key counts as 0. The row holds the new value.
   */
  public void inc(Object key, long value) {
    ByteString k;
    try {
      k = Values.marshalKey(key);
    } catch (KvException e) {
      initResult(0, 1, false, e);
      return;
    }
    appendRequest(RequestUnion.newBuilder().setIncrement(IncrementRequest.newBuilder().
        setKey(k).
        setIncrement(value)));
    initResult(1, 1, false, null);
  }

  /**
   * Retrieve the rows in [begin, end) in ascending order.
   */
  public void scan(Object begin, Object end) {
    scan(begin, end, false);
  }

  /**
   * Retrieve the rows in [begin, end) in descending order.
   */
  public void reverseScan(Object begin, Object end) {
    scan(begin, end, true);
  }

  private void scan(Object begin, Object end, boolean isReverse) {
    ByteString b;
    ByteString e;
    try {
      b = Values.marshalKey(begin);
      e = Values.marshalKey(end);
    } catch (KvException ex) {
      initResult(0, 0, false, ex);
      return;
    }
    if (isReverse) {
      appendRequest(RequestUnion.newBuilder().setReverseScan(ReverseScanRequest.newBuilder().setKey(b).setEndKey(e)));
    } else {
      appendRequest(RequestUnion.newBuilder().setScan(ScanRequest.newBuilder().setKey(b).setEndKey(e)));
    }
    initResult(1, 0, false, null);
  }

  /**
   * Delete one or more keys. All of the keys are reported by a single result.
   */
  public void del(Object... keys) {
    List<RequestUnion.Builder> toAppend = new ArrayList<>(keys.length);
    for (Object key : keys) {
      try {
        toAppend.add(RequestUnion.newBuilder().setDelete(DeleteRequest.newBuilder().setKey(Values.marshalKey(key))));
      } catch (KvException e) {
        initResult(0, keys.length, false, e);
        return;
      }
    }
    toAppend.forEach(this::appendRequest);
    initResult(toAppend.size(), toAppend.size(), false, null);
  }

  /**
   * Delete the rows in [begin, end).
   *
   * @param returnKeys Whether the deleted keys should be returned in {@link Result#getKeys()}.
   */
  public void delRange(Object begin, Object end, boolean returnKeys) {
    ByteString b;
    ByteString e;
    try {
      b = Values.marshalKey(begin);
      e = Values.marshalKey(end);
    } catch (KvException ex) {
      initResult(0, 0, false, ex);
      return;
    }
    appendRequest(RequestUnion.newBuilder().setDeleteRange(DeleteRangeRequest.newBuilder().
        setKey(b).
        setEndKey(e).
        setReturnKeys(returnKeys)));
    initResult(1, 0, false, null);
  }

  void adminSplit(Object spanKey, Object splitKey) {
    ByteString span;
    ByteString split;
    try {
      span = Values.marshalKey(spanKey);
      split = Values.marshalKey(splitKey);
    } catch (KvException e) {
      initResult(0, 0, false, e);
      return;
    }
    appendRequest(RequestUnion.newBuilder().setAdminSplit(AdminSplitRequest.newBuilder().
        setKey(span).
        setSplitKey(split)));
    initResult(1, 0, false, null);
  }

  void adminMerge(Object key) {
    ByteString k;
    try {
      k = Values.marshalKey(key);
    } catch (KvException e) {
      initResult(0, 0, false, e);
      return;
    }
    appendRequest(RequestUnion.newBuilder().setAdminMerge(AdminMergeRequest.newBuilder().setKey(k)));
    initResult(1, 0, false, null);
  }

  void adminTransferLease(Object key, int targetStoreId) {
    ByteString k;
    try {
      k = Values.marshalKey(key);
    } catch (KvException e) {
      initResult(0, 0, false, e);
      return;
    }
    appendRequest(RequestUnion.newBuilder().setAdminTransferLease(AdminTransferLeaseRequest.newBuilder().
        setKey(k).
        setTargetStoreId(targetStoreId)));
    initResult(1, 0, false, null);
  }

  void adminChangeReplicas(Object key, ReplicaChangeType changeType, List<ReplicationTarget> targets,
                           RangeDescriptor expDesc) {
    ByteString k;
    try {
      k = Values.marshalKey(key);
    } catch (KvException e) {
      initResult(0, 0, false, e);
      return;
    }
    appendRequest(RequestUnion.newBuilder().setAdminChangeReplicas(AdminChangeReplicasRequest.newBuilder().
        setKey(k).
        setChangeType(changeType).
        addAllTargets(targets).
        setExpDesc(expDesc)));
    initResult(1, 0, false, null);
  }

  void adminRelocateRange(Object key, List<ReplicationTarget> targets) {
    ByteString k;
    try {
      k = Values.marshalKey(key);
    } catch (KvException e) {
      initResult(0, 0, false, e);
      return;
    }
    appendRequest(RequestUnion.newBuilder().setAdminRelocateRange(AdminRelocateRangeRequest.newBuilder().
        setKey(k).
        addAllTargets(targets)));
    initResult(1, 0, false, null);
  }

  /**
   * Append an EndTransaction request, used to commit a transaction together with the rest of the batch.
   */
  void endTxn(boolean commit) {
    appendRequest(RequestUnion.newBuilder().setEndTransaction(EndTransactionRequest.newBuilder().setCommit(commit)));
    initResult(1, 0, raw, null);
  }

  /**
   * Add already constructed requests to the batch. A batch with raw requests cannot also use the regular builder
   * methods, its results are not filled and the outcome must be read from {@link #getRawResponse()}.
   */
  public void addRawRequest(RequestUnion... rawRequests) {
    RuntimeException err = null;
    if (!raw && !results.isEmpty()) {
      err = new KvException("must not use raw operations on a non-raw batch", KvErrorCodes.error_code_unsupported_request);
    }
    raw = true;
    for (RequestUnion request : rawRequests) {
      appendRequest(request.toBuilder());
      initResult(1, 0, true, err);
    }
  }

  /**
   * @return The first error recorded while the batch was constructed, null if the batch is ready to be sent.
   */
  @Nullable
  public RuntimeException prepare() {
    for (Result result : results) {
      if (result.err != null) {
        return result.err;
      }
    }
    return null;
  }

  /**
   * @return Whether the batch ends its transaction.
   */
  boolean endsTxn() {
    for (RequestUnion request : requests) {
      if (request.getValueCase() == RequestUnion.ValueCase.END_TRANSACTION) {
        return true;
      }
    }
    return false;
  }

  void markUsed() {
    Preconditions.checkState(!used, "batch has already been run");
    used = true;
  }

  BatchRequest toRequest() {
    return BatchRequest.newBuilder().
        setHeader(header).
        addAllRequests(requests).
        build();
  }

  /**
   * Send the batch with the given sender and fill the results. The returned future fails with the error of the
   * exchange or, when the exchange succeeded, with the first error of the results.
   */
  CompletableFuture<Void> sendAndFill(Sender sender) {
    CompletableFuture<BatchResponse> sent;
    try {
      sent = sender.send(toRequest());
    } catch (RuntimeException e) {
      sent = failedFuture(e);
    }
    return sent.handle((batchResponse, t) -> {
      fillResults(batchResponse, t == null ? null : KvErrors.unwrapToRuntimeException(t));
      RuntimeException err = exchangeError != null ? exchangeError : resultError();
      if (err != null) {
        throw err;
      }
      return null;
    });
  }

  @Nullable
  private RuntimeException resultError() {
    for (Result result : results) {
      if (result.err != null) {
        return result.err;
      }
    }
    return null;
  }

  void fillResults(@Nullable BatchResponse batchResponse, @Nullable RuntimeException err) {
    this.response = batchResponse;
    this.exchangeError = err;
    if (raw) {
      return;
    }
    if (err instanceof KvException) {
      KvException kvErr = (KvException) err;
      kvErr.getIndex().ifPresent(wireIndex -> {
        int logical = logicalIndex(wireIndex);
        if (logical >= 0) {
          kvErr.setIndex(logical);
        }
      });
    }
    Map<Long, ResponseUnion> bySequenceId = new HashMap<>();
    if (batchResponse != null) {
      for (ResponseUnion r : batchResponse.getResponsesList()) {
        bySequenceId.put(r.getSequenceId(), r);
      }
    }
    int offset = 0;
    for (int i = 0; i < results.size(); i++) {
      Result result = results.get(i);
      for (int k = 0; k < result.calls; k++) {
        RequestUnion args = requests.get(offset + k);
        ResponseUnion reply = null;
        // results with construction errors keep them.
        if (result.err == null) {
          result.err = err;
          if (result.err == null) {
            reply = bySequenceId.get(args.getSequenceId());
            if (reply == null && args.getValueCase() != RequestUnion.ValueCase.END_TRANSACTION) {
              result.err = new KvException("no response for request " + (offset + k) + " (" + args.getValueCase() +
                  ")", KvErrorCodes.error_code_internal_error).setIndex(i);
            }
          }
        }
        fillRow(result, args, reply);
        if (result.err == null && reply != null) {
          ResponseHeader responseHeader = Requests.responseHeader(reply);
          if (responseHeader.hasResumeSpan()) {
            result.resumeSpan = responseHeader.getResumeSpan();
            result.resumeReason = responseHeader.getResumeReason();
          }
        }
      }
      offset += result.calls;
    }
  }

  private void fillRow(Result result, RequestUnion args, @Nullable ResponseUnion reply) {
    boolean ok = result.err == null && reply != null;
    switch (args.getValueCase()) {
      case GET:
        result.rows.add(new KeyValue(args.getGet().getKey().toByteArray(),
            ok && reply.getGet().hasValue() ? reply.getGet().getValue() : null));
        break;
      case PUT:
        result.rows.add(new KeyValue(args.getPut().getKey().toByteArray(),
            result.err == null ? args.getPut().getValue() : null));
        break;
      case CONDITIONAL_PUT:
        result.rows.add(new KeyValue(args.getConditionalPut().getKey().toByteArray(),
            result.err == null ? args.getConditionalPut().getValue() : null));
        break;
      case INIT_PUT:
        result.rows.add(new KeyValue(args.getInitPut().getKey().toByteArray(),
            result.err == null ? args.getInitPut().getValue() : null));
        break;
      case INCREMENT:
        result.rows.add(new KeyValue(args.getIncrement().getKey().toByteArray(),
            ok ? Values.ofInt(reply.getIncrement().getNewValue()) : null));
        break;
      case DELETE:
        result.rows.add(new KeyValue(args.getDelete().getKey().toByteArray(), null));
        break;
      case SCAN:
        if (ok) {
          addRows(result, reply.getScan().getRowsList());
        }
        break;
      case REVERSE_SCAN:
        if (ok) {
          addRows(result, reply.getReverseScan().getRowsList());
        }
        break;
      case DELETE_RANGE:
        if (ok) {
          reply.getDeleteRange().getKeysList().forEach(x -> result.keys.add(x.toByteArray()));
        }
        break;
      default:
        // EndTransaction and admin requests do not produce rows.
    }
  }

  private static void addRows(Result result, List<io.github.panghy.lionrock.kv.proto.KeyValue> rows) {
    for (io.github.panghy.lionrock.kv.proto.KeyValue row : rows) {
      result.rows.add(new KeyValue(row.getKey().toByteArray(), row.hasValue() ? row.getValue() : null));
    }
  }

  /**
   * @return The index of the builder call that owns the wire request at {@code wireIndex}, -1 if there is none.
   */
  int logicalIndex(int wireIndex) {
    int offset = 0;
    for (int i = 0; i < results.size(); i++) {
      int calls = results.get(i).calls;
      if (wireIndex >= offset && wireIndex < offset + calls) {
        return i;
      }
      offset += calls;
    }
    return -1;
  }

  private void appendRequest(RequestUnion.Builder request) {
    requests.add(request.setSequenceId(requests.size()).build());
  }

  private void initResult(int calls, int numRows, boolean rawCall, @Nullable RuntimeException err) {
    if (err == null && raw && !rawCall) {
      err = new KvException("must not use non-raw operations on a raw batch",
          KvErrorCodes.error_code_unsupported_request);
    }
    results.add(new Result(calls, numRows, err));
  }
}
