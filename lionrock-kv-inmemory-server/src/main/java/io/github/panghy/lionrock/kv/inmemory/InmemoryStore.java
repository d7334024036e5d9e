package io.github.panghy.lionrock.kv.inmemory;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.protobuf.ByteString;
import io.github.panghy.lionrock.kv.client.*;
import io.github.panghy.lionrock.kv.client.impl.Requests;
import io.github.panghy.lionrock.kv.proto.KeyValue;
import io.github.panghy.lionrock.kv.proto.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.time.Clock;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import static com.apple.foundationdb.tuple.ByteArrayUtil.printable;
import static java.util.concurrent.CompletableFuture.completedFuture;
import static java.util.concurrent.CompletableFuture.failedFuture;

/**
 * A pseudo range-partitioned key-value store that lives in a single sorted map. Ranges, replicas and leases are only
 * descriptor metadata, they do not change where data lives, but they drive the same decisions a distributed store
 * would make: a non-transactional batch that touches more than one range is refused with
 * {@link KvErrorCodes#error_code_op_requires_txn}.
 * <p>
 * Every batch is atomic. Transactional batches buffer their writes until a batch with an EndTransaction request
 * commits them, at which point the keys the transaction read are validated against writes committed since it started
 * (optimistic concurrency). A conflict fails the commit with a {@link TransactionRetryException}.
 *
 * @author Clement Pang
 */
public class InmemoryStore implements Sender {

  private static final Logger logger = LoggerFactory.getLogger(InmemoryStore.class);

  private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
  private final ReentrantReadWriteLock.ReadLock readLock = lock.readLock();
  private final ReentrantReadWriteLock.WriteLock writeLock = lock.writeLock();

  /**
   * Committed data, deleted keys are kept as tombstones (with a null value).
   */
  private final TreeMap<BytesKey, VersionedValue> data = new TreeMap<>();
  /**
   * Range descriptors keyed by their start key.
   */
  private final TreeMap<BytesKey, RangeDescriptor> ranges = new TreeMap<>();
  private final Map<ByteString, TxnState> txns = new HashMap<>();
  private final Clock clock;
  private final boolean simulateOutOfOrderResponses;
  /**
   * Incremented for every commit.
   */
  private long version;
  private long nextRangeId = 1;

  /**
   * A store with a single range replicated on node 1, store 1.
   */
  public InmemoryStore() {
    this(Collections.emptyList(), ImmutableList.of(ReplicaDescriptor.newBuilder().
        setNodeId(1).
        setStoreId(1).
        build()), false, Clock.systemUTC());
  }

  /**
   * @param splitKeys                   Initial range boundaries.
   * @param replicas                    Replicas of every initial range, the first one holds the lease.
   * @param simulateOutOfOrderResponses Whether responses are returned in reverse order of the requests.
   * @param clock                       Used to stamp responses.
   */
  public InmemoryStore(List<byte[]> splitKeys, List<ReplicaDescriptor> replicas, boolean simulateOutOfOrderResponses,
                       Clock clock) {
    Preconditions.checkArgument(!replicas.isEmpty(), "at least one replica is required");
    this.simulateOutOfOrderResponses = simulateOutOfOrderResponses;
    this.clock = clock;
    TreeSet<BytesKey> boundaries = new TreeSet<>();
    for (byte[] splitKey : splitKeys) {
      if (splitKey.length > 0) {
        boundaries.add(new BytesKey(splitKey));
      }
    }
    BytesKey start = BytesKey.MIN;
    for (BytesKey boundary : boundaries) {
      addRange(start, boundary, replicas);
      start = boundary;
    }
    addRange(start, BytesKey.MIN, replicas);
  }

  private void addRange(BytesKey start, BytesKey end, List<ReplicaDescriptor> replicas) {
    ranges.put(start, RangeDescriptor.newBuilder().
        setRangeId(nextRangeId++).
        setStartKey(start.toByteString()).
        setEndKey(end.toByteString()).
        addAllReplicas(replicas).
        setLeaseHolderStoreId(replicas.get(0).getStoreId()).
        setGeneration(1).
        build());
  }

  @Override
  public CompletableFuture<BatchResponse> send(BatchRequest request) {
    writeLock.lock();
    try {
      return completedFuture(execute(request));
    } catch (KvException e) {
      if (logger.isDebugEnabled()) {
        logger.debug("batch of {} request(s) failed: {}", request.getRequestsCount(), e.getMessage());
      }
      return failedFuture(e);
    } finally {
      writeLock.unlock();
    }
  }

  /**
   * @return The descriptors of all ranges, in key order.
   */
  public List<RangeDescriptor> getRangeDescriptors() {
    readLock.lock();
    try {
      return new ArrayList<>(ranges.values());
    } finally {
      readLock.unlock();
    }
  }

  /**
   * @return The descriptor of the range that contains {@code key}.
   */
  public RangeDescriptor getRangeDescriptor(byte[] key) {
    readLock.lock();
    try {
      return rangeFor(new BytesKey(key));
    } finally {
      readLock.unlock();
    }
  }

  /**
   * @return The number of transactions with pending (uncommitted) state.
   */
  public int getPendingTransactionCount() {
    readLock.lock();
    try {
      return txns.size();
    } finally {
      readLock.unlock();
    }
  }

  /**
   * @return The latest commit version.
   */
  public long getVersion() {
    readLock.lock();
    try {
      return version;
    } finally {
      readLock.unlock();
    }
  }

  private BatchResponse execute(BatchRequest request) {
    Header header = request.getHeader();
    if (logger.isDebugEnabled()) {
      logger.debug("executing batch of {} request(s){}", request.getRequestsCount(),
          header.hasTxn() ? " in txn " + header.getTxn().getName() + " (epoch " + header.getTxn().getEpoch() + ")" :
              "");
    }
    List<ResponseUnion> responses = header.hasTxn() ?
        executeTxn(header, request.getRequestsList()) :
        executeNonTxn(header, request.getRequestsList());
    if (simulateOutOfOrderResponses) {
      responses = new ArrayList<>(responses);
      Collections.reverse(responses);
    }
    Instant now = clock.instant();
    BatchResponse.Builder builder = BatchResponse.newBuilder().addAllResponses(responses);
    builder.getHeaderBuilder().setNow(TimeUnit.SECONDS.toNanos(now.getEpochSecond()) + now.getNano());
    if (header.hasTxn()) {
      builder.getHeaderBuilder().setTxn(header.getTxn());
    }
    return builder.build();
  }

  private List<ResponseUnion> executeNonTxn(Header header, List<RequestUnion> requests) {
    for (int i = 0; i < requests.size(); i++) {
      if (requests.get(i).getValueCase() == RequestUnion.ValueCase.END_TRANSACTION) {
        throw new KvException("EndTransaction requires a transaction",
            KvErrorCodes.error_code_unsupported_request).setIndex(i);
      }
    }
    if (header.getReadConsistency() == ReadConsistency.CONSISTENT) {
      Set<Long> touched = rangesTouched(requests);
      if (touched.size() > 1) {
        throw new KvException("batch spans " + touched.size() + " ranges", KvErrorCodes.error_code_op_requires_txn);
      }
    }
    BatchExecution ex = new BatchExecution(new TreeMap<>(), header.getMaxSpanRequestKeys());
    List<ResponseUnion> responses = new ArrayList<>(requests.size());
    for (int i = 0; i < requests.size(); i++) {
      responses.add(executeRequest(ex, requests.get(i), i));
    }
    commitWrites(ex.writes);
    return responses;
  }

  private List<ResponseUnion> executeTxn(Header header, List<RequestUnion> requests) {
    TxnMeta meta = header.getTxn();
    TxnState state = txns.get(meta.getId());
    if (state == null || meta.getEpoch() > state.epoch) {
      // a new transaction or a restart.
      state = new TxnState(meta.getEpoch(), version);
      txns.put(meta.getId(), state);
    } else if (meta.getEpoch() < state.epoch) {
      throw new KvException("transaction " + meta.getName() + " is at epoch " + state.epoch + ", request is at " +
          meta.getEpoch(), KvErrorCodes.error_code_transaction_aborted);
    }
    BatchExecution ex = new BatchExecution(new TreeMap<>(state.writes), header.getMaxSpanRequestKeys());
    List<ResponseUnion> responses = new ArrayList<>(requests.size());
    RequestUnion endTxn = null;
    for (int i = 0; i < requests.size(); i++) {
      RequestUnion request = requests.get(i);
      if (request.getValueCase() == RequestUnion.ValueCase.END_TRANSACTION) {
        endTxn = request;
        continue;
      }
      if (Requests.isAdmin(request)) {
        throw new KvException("admin requests cannot be transactional", KvErrorCodes.error_code_unsupported_request).
            setIndex(i);
      }
      responses.add(executeRequest(ex, request, i));
    }
    state.writes = ex.writes;
    state.reads.addAll(ex.reads);
    if (endTxn != null) {
      txns.remove(meta.getId());
      boolean commit = endTxn.getEndTransaction().getCommit();
      if (commit) {
        ReadSpan conflict = findConflict(state);
        if (conflict != null) {
          throw new TransactionRetryException("transaction " + meta.getName() + " conflicts on " + conflict,
              meta.getId());
        }
        commitWrites(state.writes);
      }
      responses.add(ResponseUnion.newBuilder().
          setSequenceId(endTxn.getSequenceId()).
          setEndTransaction(EndTransactionResponse.newBuilder().setCommitted(commit)).
          build());
    }
    return responses;
  }

  private ResponseUnion executeRequest(BatchExecution ex, RequestUnion request, int index) {
    ResponseUnion.Builder response = ResponseUnion.newBuilder().setSequenceId(request.getSequenceId());
    switch (request.getValueCase()) {
      case GET: {
        Value value = ex.get(BytesKey.of(request.getGet().getKey()));
        GetResponse.Builder get = GetResponse.newBuilder();
        if (value != null) {
          get.setValue(value);
        }
        return response.setGet(get).build();
      }
      case PUT: {
        PutRequest put = request.getPut();
        ex.put(BytesKey.of(put.getKey()), put.getValue());
        return response.setPut(PutResponse.getDefaultInstance()).build();
      }
      case CONDITIONAL_PUT: {
        ConditionalPutRequest cput = request.getConditionalPut();
        BytesKey key = BytesKey.of(cput.getKey());
        Value actual = ex.get(key);
        Value expected = cput.hasExpValue() ? cput.getExpValue() : null;
        if (!Objects.equals(actual, expected)) {
          throw new ConditionFailedException("unexpected value for " + key + ": " + describe(actual),
              actual).setIndex(index);
        }
        ex.put(key, cput.getValue());
        return response.setConditionalPut(ConditionalPutResponse.getDefaultInstance()).build();
      }
      case INIT_PUT: {
        InitPutRequest initPut = request.getInitPut();
        BytesKey key = BytesKey.of(initPut.getKey());
        VersionedValue existing = ex.lookup(key);
        if (existing != null) {
          if (existing.value == null) {
            if (initPut.getFailOnTombstones()) {
              throw new ConditionFailedException("key " + key + " was deleted", null).setIndex(index);
            }
          } else if (!existing.value.equals(initPut.getValue())) {
            throw new ConditionFailedException("unexpected value for " + key + ": " + describe(existing.value),
                existing.value).setIndex(index);
          }
        }
        ex.put(key, initPut.getValue());
        return response.setInitPut(InitPutResponse.getDefaultInstance()).build();
      }
      case INCREMENT: {
        IncrementRequest inc = request.getIncrement();
        BytesKey key = BytesKey.of(inc.getKey());
        Value current = ex.get(key);
        long newValue;
        try {
          newValue = (current == null ? 0 : Values.getInt(current)) + inc.getIncrement();
        } catch (KvException e) {
          throw new KvException("key " + key + " does not hold an INT value", e.getCode(), e).setIndex(index);
        }
        ex.put(key, Values.ofInt(newValue));
        return response.setIncrement(IncrementResponse.newBuilder().setNewValue(newValue)).build();
      }
      case DELETE: {
        ex.delete(BytesKey.of(request.getDelete().getKey()));
        return response.setDelete(DeleteResponse.getDefaultInstance()).build();
      }
      case DELETE_RANGE: {
        DeleteRangeRequest delRange = request.getDeleteRange();
        BytesKey begin = BytesKey.of(delRange.getKey());
        BytesKey end = BytesKey.of(delRange.getEndKey());
        List<Map.Entry<BytesKey, Value>> rows = ex.scan(begin, end, false);
        int limit = ex.take(rows.size());
        DeleteRangeResponse.Builder builder = DeleteRangeResponse.newBuilder();
        for (int i = 0; i < limit; i++) {
          BytesKey key = rows.get(i).getKey();
          ex.delete(key);
          if (delRange.getReturnKeys()) {
            builder.addKeys(key.toByteString());
          }
        }
        builder.setHeader(spanHeader(begin, end, rows, limit, false));
        return response.setDeleteRange(builder).build();
      }
      case SCAN: {
        ScanRequest scan = request.getScan();
        BytesKey begin = BytesKey.of(scan.getKey());
        BytesKey end = BytesKey.of(scan.getEndKey());
        List<Map.Entry<BytesKey, Value>> rows = ex.scan(begin, end, false);
        int limit = ex.take(rows.size());
        return response.setScan(ScanResponse.newBuilder().
            addAllRows(toKeyValues(rows, limit)).
            setHeader(spanHeader(begin, end, rows, limit, false))).build();
      }
      case REVERSE_SCAN: {
        ReverseScanRequest scan = request.getReverseScan();
        BytesKey begin = BytesKey.of(scan.getKey());
        BytesKey end = BytesKey.of(scan.getEndKey());
        List<Map.Entry<BytesKey, Value>> rows = ex.scan(begin, end, true);
        int limit = ex.take(rows.size());
        return response.setReverseScan(ReverseScanResponse.newBuilder().
            addAllRows(toKeyValues(rows, limit)).
            setHeader(spanHeader(begin, end, rows, limit, true))).build();
      }
      case ADMIN_SPLIT:
        adminSplit(request.getAdminSplit(), index);
        return response.setAdminSplit(AdminSplitResponse.getDefaultInstance()).build();
      case ADMIN_MERGE:
        adminMerge(request.getAdminMerge(), index);
        return response.setAdminMerge(AdminMergeResponse.getDefaultInstance()).build();
      case ADMIN_TRANSFER_LEASE:
        adminTransferLease(request.getAdminTransferLease(), index);
        return response.setAdminTransferLease(AdminTransferLeaseResponse.getDefaultInstance()).build();
      case ADMIN_CHANGE_REPLICAS:
        return response.setAdminChangeReplicas(AdminChangeReplicasResponse.newBuilder().
            setDesc(adminChangeReplicas(request.getAdminChangeReplicas(), index))).build();
      case ADMIN_RELOCATE_RANGE:
        adminRelocateRange(request.getAdminRelocateRange(), index);
        return response.setAdminRelocateRange(AdminRelocateRangeResponse.getDefaultInstance()).build();
      default:
        throw new KvException("unsupported request: " + request.getValueCase(),
            KvErrorCodes.error_code_unsupported_request).setIndex(index);
    }
  }

  private void adminSplit(AdminSplitRequest split, int index) {
    BytesKey splitKey = BytesKey.of(split.getSplitKey());
    if (splitKey.isEmpty()) {
      throw new KvException("cannot split at the start of the key space", KvErrorCodes.error_code_range_not_found).
          setIndex(index);
    }
    RangeDescriptor desc = rangeFor(splitKey);
    if (desc.getStartKey().equals(split.getSplitKey())) {
      // already a boundary.
      return;
    }
    long generation = desc.getGeneration() + 1;
    ranges.put(BytesKey.of(desc.getStartKey()), desc.toBuilder().
        setEndKey(split.getSplitKey()).
        setGeneration(generation).
        build());
    ranges.put(splitKey, desc.toBuilder().
        setRangeId(nextRangeId++).
        setStartKey(split.getSplitKey()).
        setGeneration(generation).
        build());
    logger.info("split range {} at {}", desc.getRangeId(), splitKey);
  }

  private void adminMerge(AdminMergeRequest merge, int index) {
    RangeDescriptor left = rangeFor(BytesKey.of(merge.getKey()));
    if (left.getEndKey().isEmpty()) {
      throw new KvException("cannot merge the last range", KvErrorCodes.error_code_merge_rejected).setIndex(index);
    }
    RangeDescriptor right = ranges.remove(BytesKey.of(left.getEndKey()));
    ranges.put(BytesKey.of(left.getStartKey()), left.toBuilder().
        setEndKey(right.getEndKey()).
        setGeneration(Math.max(left.getGeneration(), right.getGeneration()) + 1).
        build());
    logger.info("merged range {} into range {}", right.getRangeId(), left.getRangeId());
  }

  private void adminTransferLease(AdminTransferLeaseRequest transfer, int index) {
    RangeDescriptor desc = rangeFor(BytesKey.of(transfer.getKey()));
    boolean isReplica = desc.getReplicasList().stream().
        anyMatch(r -> r.getStoreId() == transfer.getTargetStoreId());
    if (!isReplica) {
      throw new KvException("store " + transfer.getTargetStoreId() + " has no replica of range " +
          desc.getRangeId(), KvErrorCodes.error_code_lease_transfer_rejected).setIndex(index);
    }
    ranges.put(BytesKey.of(desc.getStartKey()), desc.toBuilder().
        setLeaseHolderStoreId(transfer.getTargetStoreId()).
        build());
  }

  private RangeDescriptor adminChangeReplicas(AdminChangeReplicasRequest change, int index) {
    RangeDescriptor desc = rangeFor(BytesKey.of(change.getKey()));
    if (!desc.equals(change.getExpDesc())) {
      throw new KvException("descriptor of range " + desc.getRangeId() + " does not match the expected one " +
          "(generation " + desc.getGeneration() + " vs " + change.getExpDesc().getGeneration() + ")",
          KvErrorCodes.error_code_replica_change_rejected).setIndex(index);
    }
    List<ReplicaDescriptor> replicas = new ArrayList<>(desc.getReplicasList());
    for (ReplicationTarget target : change.getTargetsList()) {
      ReplicaDescriptor replica = ReplicaDescriptor.newBuilder().
          setNodeId(target.getNodeId()).
          setStoreId(target.getStoreId()).
          build();
      if (change.getChangeType() == ReplicaChangeType.ADD_REPLICA) {
        if (replicas.contains(replica)) {
          throw new KvException("store " + target.getStoreId() + " already has a replica of range " +
              desc.getRangeId(), KvErrorCodes.error_code_replica_change_rejected).setIndex(index);
        }
        replicas.add(replica);
      } else if (!replicas.remove(replica)) {
        throw new KvException("store " + target.getStoreId() + " has no replica of range " + desc.getRangeId(),
            KvErrorCodes.error_code_replica_change_rejected).setIndex(index);
      }
    }
    RangeDescriptor updated = withReplicas(desc, replicas, index);
    ranges.put(BytesKey.of(desc.getStartKey()), updated);
    return updated;
  }

  private void adminRelocateRange(AdminRelocateRangeRequest relocate, int index) {
    RangeDescriptor desc = rangeFor(BytesKey.of(relocate.getKey()));
    List<ReplicaDescriptor> replicas = new ArrayList<>();
    for (ReplicationTarget target : relocate.getTargetsList()) {
      replicas.add(ReplicaDescriptor.newBuilder().
          setNodeId(target.getNodeId()).
          setStoreId(target.getStoreId()).
          build());
    }
    ranges.put(BytesKey.of(desc.getStartKey()), withReplicas(desc, replicas, index));
  }

  /**
   * @return The descriptor with the new replica set and a bumped generation, the lease moves to the first replica if
   * its holder is no longer a replica.
   */
  private static RangeDescriptor withReplicas(RangeDescriptor desc, List<ReplicaDescriptor> replicas, int index) {
    if (replicas.isEmpty()) {
      throw new KvException("range " + desc.getRangeId() + " must keep at least one replica",
          KvErrorCodes.error_code_replica_change_rejected).setIndex(index);
    }
    int leaseHolder = desc.getLeaseHolderStoreId();
    if (replicas.stream().noneMatch(r -> r.getStoreId() == desc.getLeaseHolderStoreId())) {
      leaseHolder = replicas.get(0).getStoreId();
    }
    return desc.toBuilder().
        clearReplicas().
        addAllReplicas(replicas).
        setLeaseHolderStoreId(leaseHolder).
        setGeneration(desc.getGeneration() + 1).
        build();
  }

  private RangeDescriptor rangeFor(BytesKey key) {
    return ranges.floorEntry(key).getValue();
  }

  private Set<Long> rangesTouched(List<RequestUnion> requests) {
    Set<Long> touched = new HashSet<>();
    for (RequestUnion request : requests) {
      BytesKey begin = BytesKey.of(Requests.key(request));
      BytesKey end = BytesKey.of(Requests.endKey(request));
      if (Requests.isSpan(request) && begin.compareTo(end) < 0) {
        for (RangeDescriptor desc : ranges.subMap(ranges.floorKey(begin), true, end, false).values()) {
          touched.add(desc.getRangeId());
        }
      } else {
        touched.add(rangeFor(begin).getRangeId());
      }
    }
    return touched;
  }

  private void commitWrites(TreeMap<BytesKey, VersionedValue> writes) {
    if (writes.isEmpty()) {
      return;
    }
    version++;
    for (Map.Entry<BytesKey, VersionedValue> entry : writes.entrySet()) {
      data.put(entry.getKey(), new VersionedValue(entry.getValue().value, version));
    }
  }

  /**
   * @return A read of the transaction that was overwritten after the transaction started, null if there is none.
   */
  @Nullable
  private ReadSpan findConflict(TxnState state) {
    for (ReadSpan read : state.reads) {
      if (read.end == null) {
        VersionedValue committed = data.get(read.begin);
        if (committed != null && committed.version > state.readVersion) {
          return read;
        }
      } else {
        for (VersionedValue committed : data.subMap(read.begin, read.end).values()) {
          if (committed.version > state.readVersion) {
            return read;
          }
        }
      }
    }
    return null;
  }

  private static ResponseHeader spanHeader(BytesKey begin, BytesKey end, List<Map.Entry<BytesKey, Value>> rows,
                                           int limit, boolean reverse) {
    ResponseHeader.Builder header = ResponseHeader.newBuilder().setNumKeys(limit);
    if (limit < rows.size()) {
      Span.Builder resume = Span.newBuilder();
      if (reverse) {
        resume.setKey(begin.toByteString()).
            setEndKey(limit == 0 ? end.toByteString() : rows.get(limit - 1).getKey().toByteString());
      } else {
        resume.setKey(limit == 0 ? begin.toByteString() : rows.get(limit).getKey().toByteString()).
            setEndKey(end.toByteString());
      }
      header.setResumeSpan(resume).setResumeReason(ResumeReason.RESUME_KEY_LIMIT);
    }
    return header.build();
  }

  private static List<KeyValue> toKeyValues(List<Map.Entry<BytesKey, Value>> rows, int limit) {
    List<KeyValue> toReturn = new ArrayList<>(limit);
    for (int i = 0; i < limit; i++) {
      toReturn.add(KeyValue.newBuilder().
          setKey(rows.get(i).getKey().toByteString()).
          setValue(rows.get(i).getValue()).
          build());
    }
    return toReturn;
  }

  private static String describe(@Nullable Value value) {
    if (value == null) {
      return "<missing>";
    }
    return value.getTag() + ":" + printable(value.getRawBytes().toByteArray());
  }

  private static class VersionedValue {
    /**
     * Null for a deleted key.
     */
    @Nullable
    final Value value;
    final long version;

    VersionedValue(@Nullable Value value, long version) {
      this.value = value;
      this.version = version;
    }
  }

  /**
   * A key (when {@link #end} is null) or a span read by a transaction.
   */
  private static class ReadSpan {
    final BytesKey begin;
    @Nullable
    final BytesKey end;

    ReadSpan(BytesKey begin, @Nullable BytesKey end) {
      this.begin = begin;
      this.end = end;
    }

    @Override
    public String toString() {
      return end == null ? begin.toString() : "[" + begin + ", " + end + ")";
    }
  }

  private static class TxnState {
    final int epoch;
    /**
     * The commit version the transaction started at.
     */
    final long readVersion;
    TreeMap<BytesKey, VersionedValue> writes = new TreeMap<>();
    final List<ReadSpan> reads = new ArrayList<>();

    TxnState(int epoch, long readVersion) {
      this.epoch = epoch;
      this.readVersion = readVersion;
    }
  }

  /**
   * State of a single batch: its writes (on top of those of its transaction, if any), its reads and the remaining key
   * budget of span requests. The writes are only applied (or handed back to the transaction) if the whole batch
   * succeeds.
   */
  private class BatchExecution {
    final TreeMap<BytesKey, VersionedValue> writes;
    final List<ReadSpan> reads = new ArrayList<>();
    long remainingKeys;

    BatchExecution(TreeMap<BytesKey, VersionedValue> writes, long maxSpanRequestKeys) {
      this.writes = writes;
      this.remainingKeys = maxSpanRequestKeys > 0 ? maxSpanRequestKeys : Long.MAX_VALUE;
    }

    @Nullable
    VersionedValue lookup(BytesKey key) {
      reads.add(new ReadSpan(key, null));
      VersionedValue written = writes.get(key);
      return written != null ? written : data.get(key);
    }

    @Nullable
    Value get(BytesKey key) {
      VersionedValue found = lookup(key);
      return found == null ? null : found.value;
    }

    void put(BytesKey key, Value value) {
      writes.put(key, new VersionedValue(value, 0));
    }

    void delete(BytesKey key) {
      writes.put(key, new VersionedValue(null, 0));
    }

    /**
     * @return The live rows in [begin, end), in descending order if {@code reverse}.
     */
    List<Map.Entry<BytesKey, Value>> scan(BytesKey begin, BytesKey end, boolean reverse) {
      if (begin.compareTo(end) >= 0) {
        return Collections.emptyList();
      }
      reads.add(new ReadSpan(begin, end));
      TreeMap<BytesKey, VersionedValue> merged = new TreeMap<>(data.subMap(begin, end));
      merged.putAll(writes.subMap(begin, end));
      NavigableMap<BytesKey, VersionedValue> ordered = reverse ? merged.descendingMap() : merged;
      List<Map.Entry<BytesKey, Value>> rows = new ArrayList<>();
      for (Map.Entry<BytesKey, VersionedValue> entry : ordered.entrySet()) {
        if (entry.getValue().value != null) {
          rows.add(new AbstractMap.SimpleImmutableEntry<>(entry.getKey(), entry.getValue().value));
        }
      }
      return rows;
    }

    /**
     * Take up to {@code available} keys from the budget.
     *
     * @return The number of keys the request may return.
     */
    int take(int available) {
      int allowed = (int) Math.min(available, remainingKeys);
      remainingKeys -= allowed;
      return allowed;
    }
  }
}
