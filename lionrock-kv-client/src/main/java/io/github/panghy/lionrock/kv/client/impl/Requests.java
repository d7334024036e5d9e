package io.github.panghy.lionrock.kv.client.impl;

import com.google.protobuf.ByteString;
import io.github.panghy.lionrock.kv.proto.BatchRequest;
import io.github.panghy.lionrock.kv.proto.RequestUnion;
import io.github.panghy.lionrock.kv.proto.ResponseHeader;
import io.github.panghy.lionrock.kv.proto.ResponseUnion;

/**
 * Helpers to inspect the members of {@link RequestUnion} and {@link ResponseUnion} without switching over every case
 * at the call site.
 *
 * @author Clement Pang
 */
public abstract class Requests {

  /**
   * @return Whether the request mutates data.
   */
  public static boolean isWrite(RequestUnion request) {
    switch (request.getValueCase()) {
      case PUT:
      case CONDITIONAL_PUT:
      case INIT_PUT:
      case INCREMENT:
      case DELETE:
      case DELETE_RANGE:
      case END_TRANSACTION:
        return true;
      default:
        return false;
    }
  }

  public static boolean isAdmin(RequestUnion request) {
    switch (request.getValueCase()) {
      case ADMIN_SPLIT:
      case ADMIN_MERGE:
      case ADMIN_TRANSFER_LEASE:
      case ADMIN_CHANGE_REPLICAS:
      case ADMIN_RELOCATE_RANGE:
        return true;
      default:
        return false;
    }
  }

  /**
   * @return Whether the request is a span request (scans and range deletes), which are subject to the key budget of
   * the batch and may return a resume span.
   */
  public static boolean isSpan(RequestUnion request) {
    switch (request.getValueCase()) {
      case SCAN:
      case REVERSE_SCAN:
      case DELETE_RANGE:
        return true;
      default:
        return false;
    }
  }

  public static boolean endsTransaction(BatchRequest request) {
    for (RequestUnion r : request.getRequestsList()) {
      if (r.getValueCase() == RequestUnion.ValueCase.END_TRANSACTION) {
        return true;
      }
    }
    return false;
  }

  /**
   * @return The (start) key the request addresses, empty for requests that are not addressed to a key
   * (EndTransaction).
   */
  public static ByteString key(RequestUnion request) {
    switch (request.getValueCase()) {
      case GET:
        return request.getGet().getKey();
      case PUT:
        return request.getPut().getKey();
      case CONDITIONAL_PUT:
        return request.getConditionalPut().getKey();
      case INIT_PUT:
        return request.getInitPut().getKey();
      case INCREMENT:
        return request.getIncrement().getKey();
      case DELETE:
        return request.getDelete().getKey();
      case DELETE_RANGE:
        return request.getDeleteRange().getKey();
      case SCAN:
        return request.getScan().getKey();
      case REVERSE_SCAN:
        return request.getReverseScan().getKey();
      case ADMIN_SPLIT:
        return request.getAdminSplit().getKey();
      case ADMIN_MERGE:
        return request.getAdminMerge().getKey();
      case ADMIN_TRANSFER_LEASE:
        return request.getAdminTransferLease().getKey();
      case ADMIN_CHANGE_REPLICAS:
        return request.getAdminChangeReplicas().getKey();
      case ADMIN_RELOCATE_RANGE:
        return request.getAdminRelocateRange().getKey();
      default:
        return ByteString.EMPTY;
    }
  }

  /**
   * @return The exclusive end key of a span request, empty otherwise.
   */
  public static ByteString endKey(RequestUnion request) {
    switch (request.getValueCase()) {
      case DELETE_RANGE:
        return request.getDeleteRange().getEndKey();
      case SCAN:
        return request.getScan().getEndKey();
      case REVERSE_SCAN:
        return request.getReverseScan().getEndKey();
      default:
        return ByteString.EMPTY;
    }
  }

  public static ResponseHeader responseHeader(ResponseUnion response) {
    switch (response.getValueCase()) {
      case GET:
        return response.getGet().getHeader();
      case PUT:
        return response.getPut().getHeader();
      case CONDITIONAL_PUT:
        return response.getConditionalPut().getHeader();
      case INIT_PUT:
        return response.getInitPut().getHeader();
      case INCREMENT:
        return response.getIncrement().getHeader();
      case DELETE:
        return response.getDelete().getHeader();
      case DELETE_RANGE:
        return response.getDeleteRange().getHeader();
      case SCAN:
        return response.getScan().getHeader();
      case REVERSE_SCAN:
        return response.getReverseScan().getHeader();
      case END_TRANSACTION:
        return response.getEndTransaction().getHeader();
      case ADMIN_SPLIT:
        return response.getAdminSplit().getHeader();
      case ADMIN_MERGE:
        return response.getAdminMerge().getHeader();
      case ADMIN_TRANSFER_LEASE:
        return response.getAdminTransferLease().getHeader();
      case ADMIN_CHANGE_REPLICAS:
        return response.getAdminChangeReplicas().getHeader();
      case ADMIN_RELOCATE_RANGE:
        return response.getAdminRelocateRange().getHeader();
      default:
        return ResponseHeader.getDefaultInstance();
    }
  }
}
