package io.github.panghy.lionrock.kv.inmemory;

import com.google.common.base.Throwables;
import io.github.panghy.lionrock.kv.client.KvErrors;
import io.github.panghy.lionrock.kv.client.KvException;
import io.github.panghy.lionrock.kv.proto.BatchRequest;
import io.github.panghy.lionrock.kv.proto.BatchResponse;
import io.github.panghy.lionrock.kv.proto.KeyValueBatchGrpc;
import io.github.panghy.lionrock.kv.proto.ReplicaDescriptor;
import io.grpc.Status;
import io.grpc.stub.StreamObserver;
import org.lognet.springboot.grpc.GRpcService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.stereotype.Component;

import javax.annotation.PostConstruct;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Serves an {@link InmemoryStore} over gRPC. Errors of a batch are returned as {@link Status#ABORTED} with the
 * encoded {@link KvException} in the trailers (see {@link KvErrors#toStatusRuntimeException(KvException)}).
 */
@SpringBootApplication
@GRpcService
@Component
public class InmemoryServer extends KeyValueBatchGrpc.KeyValueBatchImplBase {

  Logger logger = LoggerFactory.getLogger(InmemoryServer.class);

  @Autowired
  Configuration config;

  private InmemoryStore store;

  @PostConstruct
  public void init() {
    List<byte[]> splitKeys = config.getSplitKeys().stream().
        map(s -> s.getBytes(StandardCharsets.UTF_8)).
        collect(Collectors.toList());
    List<ReplicaDescriptor> replicas = config.getReplicas().stream().
        map(r -> ReplicaDescriptor.newBuilder().
            setNodeId(r.getNodeId()).
            setStoreId(r.getStoreId()).
            build()).
        collect(Collectors.toList());
    if (replicas.isEmpty()) {
      replicas = List.of(ReplicaDescriptor.newBuilder().setNodeId(1).setStoreId(1).build());
    }
    logger.info("Configuring in-memory store with " + (splitKeys.size() + 1) + " range(s) and " + replicas.size() +
        " replica(s)");
    store = new InmemoryStore(splitKeys, replicas, config.getInternal().isSimulateOutOfOrderResponses(),
        Clock.systemUTC());
  }

  public InmemoryStore getStore() {
    return store;
  }

  @Override
  public void batch(BatchRequest request, StreamObserver<BatchResponse> responseObserver) {
    store.send(request).whenComplete((response, throwable) -> {
      if (throwable != null) {
        Throwable unwrapped = KvErrors.unwrap(throwable);
        if (unwrapped instanceof KvException) {
          responseObserver.onError(KvErrors.toStatusRuntimeException((KvException) unwrapped));
        } else {
          logger.warn("failed to execute batch", Throwables.getRootCause(unwrapped));
          responseObserver.onError(Status.INTERNAL.
              withCause(unwrapped).
              withDescription(unwrapped.getMessage()).
              asRuntimeException());
        }
        return;
      }
      responseObserver.onNext(response);
      responseObserver.onCompleted();
    });
  }

  public static void main(String[] args) {
    SpringApplication.run(InmemoryServer.class, args);
  }
}
