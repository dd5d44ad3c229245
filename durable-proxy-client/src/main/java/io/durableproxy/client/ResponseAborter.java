package io.durableproxy.client;

/**
 * Sends the targeted abort for one response id.
 */
@FunctionalInterface
public interface ResponseAborter {

    ResponseAborter UNSUPPORTED = responseId -> {
        throw new UnsupportedOperationException("response abort is not available here");
    };

    void abort(long responseId) throws Exception;
}
