package io.github.panghy.lionrock.kv.client;

import io.github.panghy.lionrock.kv.client.impl.GrpcSender;
import io.github.panghy.lionrock.kv.client.impl.TxnCoordSenderFactory;
import io.github.panghy.lionrock.kv.proto.KeyValueBatchGrpc;
import io.grpc.ManagedChannel;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entrypoint for clients of a remote key-value store that serves the {@code KeyValueBatch} gRPC service. Transactions
 * are coordinated on the client by a {@link io.github.panghy.lionrock.kv.client.impl.TxnCoordSender}.
 *
 * @author Clement Pang
 */
public class RemoteDBFactory {

  public static final ExecutorService DEFAULT_EXECUTOR;

  static class DaemonThreadFactory implements ThreadFactory {
    private final ThreadFactory factory;
    private static final AtomicInteger threadCount = new AtomicInteger();

    DaemonThreadFactory(ThreadFactory factory) {
      this.factory = factory;
    }

    @Override
    public Thread newThread(Runnable r) {
      Thread t = factory.newThread(r);
      t.setName("lionrock-kv-" + threadCount.incrementAndGet());
      t.setDaemon(true);
      return t;
    }
  }

  static {
    ThreadFactory factory = new DaemonThreadFactory(Executors.defaultThreadFactory());
    DEFAULT_EXECUTOR = Executors.newCachedThreadPool(factory);
  }

  /**
   * Open a remote key-value store via gRPC.
   *
   * @param channel The gRPC channel to use.
   * @return A {@link DB} with the default {@link DBContext}.
   */
  public static DB open(ManagedChannel channel) {
    return open(KeyValueBatchGrpc.newStub(channel), DBContext.defaults());
  }

  /**
   * Open a remote key-value store via gRPC.
   *
   * @param channel The gRPC channel to use.
   * @param context The configuration of the DB.
   */
  public static DB open(ManagedChannel channel, DBContext context) {
    return open(KeyValueBatchGrpc.newStub(channel), context);
  }

  /**
   * Open a remote key-value store via gRPC.
   *
   * @param stub    The {@link KeyValueBatchGrpc.KeyValueBatchStub} to use.
   * @param context The configuration of the DB, its executor is also used for the gRPC callbacks.
   */
  public static DB open(KeyValueBatchGrpc.KeyValueBatchStub stub, DBContext context) {
    GrpcSender sender = new GrpcSender(stub.withExecutor(context.getExecutor()));
    return new DB(new TxnCoordSenderFactory(sender, context.getExecutor()), Clock.systemUTC(), context);
  }
}
