package com.hsbc.mupages;

import java.util.List;
import java.util.Map;

/**
 * Hooks to observe and change the rendering of template pages.
 * <p>Register listeners when constructing the pages handler with the {@link TemplatePagesBuilder#withPageListeners(List)}
 * method. Requests that are passed on to the next handler are not reported.</p>
 * <p><strong>Note:</strong> the default implementation of each method is a no-op operation, so you can just
 * override the events you are interested in.</p>
 */
public interface PageListener {

    /**
     * This is called after the context has been built and before the template is rendered.
     *
     * @param info    Info about the request and the matched template.
     * @param context The context that the template will be rendered with. Modify this map in order to change
     *                the values available to the template.
     */
    default void onBeforeRender(PageInfo info, Map<String, Object> context) {};

    /**
     * This is called after the response for a page has been written or has failed.
     * <p>If the page was not rendered successfully then {@link PageInfo#errorIfAny()} will not be null.</p>
     *
     * @param info Information about the page.
     */
    default void onComplete(PageInfo info) {};
}
