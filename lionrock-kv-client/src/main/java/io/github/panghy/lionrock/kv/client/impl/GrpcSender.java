package io.github.panghy.lionrock.kv.client.impl;

import io.github.panghy.lionrock.kv.client.KvErrorCodes;
import io.github.panghy.lionrock.kv.client.KvErrors;
import io.github.panghy.lionrock.kv.client.KvException;
import io.github.panghy.lionrock.kv.client.Sender;
import io.github.panghy.lionrock.kv.proto.BatchRequest;
import io.github.panghy.lionrock.kv.proto.BatchResponse;
import io.github.panghy.lionrock.kv.proto.KeyValueBatchGrpc;
import io.grpc.stub.StreamObserver;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * A {@link Sender} that executes batches on a remote store through the {@code KeyValueBatch} gRPC service. Structured
 * errors are recovered from the trailers of failed calls (see {@link KvErrors#unwrap(Throwable)}).
 *
 * @author Clement Pang
 */
public class GrpcSender implements Sender {

  private final KeyValueBatchGrpc.KeyValueBatchStub stub;
  private final long timeoutMs;

  public GrpcSender(KeyValueBatchGrpc.KeyValueBatchStub stub) {
    this(stub, -1);
  }

  /**
   * @param timeoutMs Deadline of each call, non-positive for none.
   */
  public GrpcSender(KeyValueBatchGrpc.KeyValueBatchStub stub, long timeoutMs) {
    this.stub = stub;
    this.timeoutMs = timeoutMs;
  }

  @Override
  public CompletableFuture<BatchResponse> send(BatchRequest request) {
    KeyValueBatchGrpc.KeyValueBatchStub toUse = stub;
    if (timeoutMs > 0) {
      toUse = toUse.withDeadlineAfter(timeoutMs, TimeUnit.MILLISECONDS);
    }
    CompletableFuture<BatchResponse> toReturn = new CompletableFuture<>();
    toUse.batch(request, new StreamObserver<>() {
      @Override
      public void onNext(BatchResponse value) {
        toReturn.complete(value);
      }

      @Override
      public void onError(Throwable t) {
        toReturn.completeExceptionally(KvErrors.unwrap(t));
      }

      @Override
      public void onCompleted() {
        if (!toReturn.isDone()) {
          toReturn.completeExceptionally(new KvException("server completed the call without a response",
              KvErrorCodes.error_code_internal_error));
        }
      }
    });
    return toReturn;
  }
}
