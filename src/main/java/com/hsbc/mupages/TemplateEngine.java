package com.hsbc.mupages;

import java.util.Map;
import java.util.Set;

/**
 * The set of compiled templates that pages are rendered from.
 * <p>{@link MustacheTemplateEngine} is the bundled implementation. Register an engine with
 * {@link TemplatePagesBuilder#withTemplateEngine(TemplateEngine)}</p>
 */
public interface TemplateEngine {

    /**
     * The names of all registered templates, relative to the template root and using <code>/</code>
     * as the separator, e.g. <code>pages/about/index.html</code>
     *
     * @return A readonly set of template names
     */
    Set<String> templateNames();

    /**
     * Renders a template.
     *
     * @param templateName The name of a template in {@link #templateNames()}
     * @param context      The values available to the template
     * @return The rendered text
     * @throws TemplateRenderException Thrown if the template is unknown or fails while executing
     */
    String render(String templateName, Map<String, Object> context) throws TemplateRenderException;
}
