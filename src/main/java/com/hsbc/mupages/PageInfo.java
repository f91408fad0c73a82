package com.hsbc.mupages;

import io.muserver.MuRequest;
import io.muserver.MuResponse;

import java.util.List;

/**
 * Information about a request that was answered with a rendered template. Use
 * {@link TemplatePagesBuilder#withPageListeners(List)} to subscribe to events that expose this data.
 */
public interface PageInfo {

    /**
     * The name of the template that matched the request path.
     * @return The name of the template that matched the request path, e.g. <code>pages/about.html</code>
     */
    String templateName();

    /**
     * The client's request.
     * @return The client's request.
     */
    MuRequest request();

    /**
     * The response to the client.
     * @return The response to the client.
     */
    MuResponse response();

    /**
     * The time in millis from when the request was received until now, or until the page was completed.
     * @return The time in millis from when the request was received.
     */
    long durationMillis();

    /**
     * If the context could not be built or the template could not be rendered, this is the exception.
     * @return The exception that stopped the page from being rendered, or null if there was none.
     */
    Throwable errorIfAny();
}
