package com.hsbc.mupages;

import io.muserver.MuHandler;

import java.util.Optional;

/**
 * This class creates a {@link MuHandler} that renders a template for any <code>GET</code> request whose path
 * matches a template name, so that simple pages do not need a route of their own.
 * <p>Requests that do not match a template, and requests using any method other than <code>GET</code>, are passed
 * to the next handler of your Mu Server, so add the handler before your other handlers.</p>
 * <p>This class is created by using the {@link TemplatePagesBuilder#templatePages()} builder.</p>
 */
public interface TemplatePages {

    /**
     * Creates the handler that renders templates for matching requests.
     * @return A MuHandler that can be added to a MuServer
     */
    MuHandler createHttpHandler();

    /**
     * Finds the template that would be rendered for a request path.
     *
     * @param path A request path, e.g. <code>/about/</code>
     * @return The name of the matching template, or empty if the request would be passed to the next handler
     */
    Optional<String> resolveTemplate(String path);

    /**
     * The templates pages are rendered from.
     * @return The template engine given to the builder
     */
    TemplateEngine templateEngine();

    /**
     * The prefix added to request paths to create template names.
     * @return The prefix without leading or trailing slashes, e.g. <code>pages</code>
     */
    String templatePrefix();

    /**
     * The version of mu-template-pages being used.
     * @return The version of mu-template-pages being used, e.g. <code>1.0.0</code>
     */
    static String muPagesVersion() {
        return MuPages.artifactVersion();
    }
}
