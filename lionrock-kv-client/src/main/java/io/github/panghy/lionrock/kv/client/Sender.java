package io.github.panghy.lionrock.kv.client;

import io.github.panghy.lionrock.kv.proto.BatchRequest;
import io.github.panghy.lionrock.kv.proto.BatchResponse;

import java.util.concurrent.CompletableFuture;

/**
 * Executes a batch of requests against the store as a single exchange. Failures complete the returned future
 * exceptionally with a {@link KvException}. Implementations are composed by wrapping (see
 * {@link io.github.panghy.lionrock.kv.client.impl.CrossRangeTxnWrapperSender}) and must be safe for concurrent use.
 *
 * @author Clement Pang
 */
@FunctionalInterface
public interface Sender {

  CompletableFuture<BatchResponse> send(BatchRequest request);
}
