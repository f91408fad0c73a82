package com.hsbc.mupages;

import io.muserver.MuRequest;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Builds the values a page template is rendered with.
 * <p>This is called once for each request that matches a template, before the template is rendered. It is
 * a good place to load things every page needs, such as details of the logged in user for a navbar.</p>
 * <p>The returned stage may complete on any thread, which lets the context be loaded without blocking a
 * server thread. For example:</p>
 * <pre>
 * ContextBuilder builder = request -&gt; userService.findUser(request.cookie("session").orElse(null))
 *     .thenApply(user -&gt; {
 *         Map&lt;String, Object&gt; context = new HashMap&lt;&gt;();
 *         context.put("username", user.name());
 *         return context;
 *     });
 * </pre>
 * <p>Route handlers for pages with more complex requirements can call the same builder and add their
 * own values to the result.</p>
 */
@FunctionalInterface
public interface ContextBuilder {

    /**
     * Builds the context for a request.
     *
     * @param request The request that matched a template
     * @return A stage that completes with a mutable map of template values. If it completes exceptionally
     * then a 500 error is sent to the client.
     * @throws Exception An exception thrown here is handled the same as an exceptionally completed stage
     */
    CompletionStage<Map<String, Object>> build(MuRequest request) throws Exception;

    /**
     * A builder that gives every page an empty context.
     *
     * @return A context builder
     */
    static ContextBuilder empty() {
        return request -> CompletableFuture.completedFuture(new HashMap<>());
    }
}
