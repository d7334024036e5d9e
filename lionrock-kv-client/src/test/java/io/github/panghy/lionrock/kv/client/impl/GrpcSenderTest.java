package io.github.panghy.lionrock.kv.client.impl;

import com.google.protobuf.ByteString;
import io.github.panghy.lionrock.kv.client.*;
import io.github.panghy.lionrock.kv.proto.*;
import io.grpc.ManagedChannel;
import io.grpc.Server;
import io.grpc.Status;
import io.grpc.inprocess.InProcessChannelBuilder;
import io.grpc.inprocess.InProcessServerBuilder;
import io.grpc.stub.StreamObserver;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class GrpcSenderTest {

  private final EchoSender store = new EchoSender();
  /**
   * Error to return instead of delegating to {@link #store}.
   */
  private final AtomicReference<Throwable> nextError = new AtomicReference<>();
  private Server server;
  private ManagedChannel channel;

  @BeforeEach
  void setUp() throws IOException {
    String name = InProcessServerBuilder.generateName();
    server = InProcessServerBuilder.forName(name).
        directExecutor().
        addService(new KeyValueBatchGrpc.KeyValueBatchImplBase() {
          @Override
          public void batch(BatchRequest request, StreamObserver<BatchResponse> responseObserver) {
            Throwable error = nextError.getAndSet(null);
            if (error != null) {
              responseObserver.onError(error);
              return;
            }
            responseObserver.onNext(store.send(request).join());
            responseObserver.onCompleted();
          }
        }).
        build().
        start();
    channel = InProcessChannelBuilder.forName(name).directExecutor().build();
  }

  @AfterEach
  void tearDown() throws InterruptedException {
    channel.shutdownNow().awaitTermination(5, TimeUnit.SECONDS);
    server.shutdownNow().awaitTermination(5, TimeUnit.SECONDS);
  }

  @Test
  void send() {
    GrpcSender sender = new GrpcSender(KeyValueBatchGrpc.newStub(channel));
    BatchResponse response = sender.send(BatchRequest.newBuilder().
        addRequests(RequestUnion.newBuilder().
            setIncrement(IncrementRequest.newBuilder().setKey(ByteString.copyFromUtf8("a")).setIncrement(9))).
        build()).join();
    assertEquals(9, response.getResponses(0).getIncrement().getNewValue());
  }

  @Test
  void send_structuredError() {
    nextError.set(KvErrors.toStatusRuntimeException(
        new ConditionFailedException("unexpected value", Values.ofInt(4)).setIndex(3)));
    GrpcSender sender = new GrpcSender(KeyValueBatchGrpc.newStub(channel), 5_000);
    CompletionException e = assertThrows(CompletionException.class,
        () -> sender.send(BatchRequest.getDefaultInstance()).join());
    ConditionFailedException cause = (ConditionFailedException) e.getCause();
    assertEquals(3, cause.getIndex().getAsInt());
    assertEquals(Values.ofInt(4), cause.getActualValue());
  }

  @Test
  void send_plainStatus() {
    nextError.set(Status.UNAVAILABLE.withDescription("store is down").asRuntimeException());
    GrpcSender sender = new GrpcSender(KeyValueBatchGrpc.newStub(channel));
    CompletionException e = assertThrows(CompletionException.class,
        () -> sender.send(BatchRequest.getDefaultInstance()).join());
    assertEquals(KvErrorCodes.error_code_rpc_failed, ((KvException) e.getCause()).getCode());
  }

  @Test
  void remoteDB() {
    DB db = RemoteDBFactory.open(channel);
    db.put("a", "b");
    assertEquals(5, db.inc("counter", 5).valueInt());
    String result = db.txn("remote", txn -> {
      txn.put("c", 1);
      return "ok";
    });
    assertEquals("ok", result);
    // put, inc, then the txn put and its commit.
    assertEquals(4, store.getRequests().size());
    assertTrue(store.lastRequest().getHeader().hasTxn());
  }
}
