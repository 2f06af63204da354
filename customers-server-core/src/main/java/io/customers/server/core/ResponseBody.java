package io.customers.server.core;

/**
 * Framework-neutral response body abstraction.
 */
public sealed interface ResponseBody permits ResponseBody.Empty, ResponseBody.Json {

    record Empty() implements ResponseBody {}

    /** Already-encoded JSON document. */
    record Json(byte[] bytes) implements ResponseBody {}
}
