package com.hsbc.mupages;

import io.muserver.Mutils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

import static java.util.Collections.emptyList;

/**
 * Use {@link #templatePages()} to create a builder where you can configure how request paths are matched
 * to templates. The {@link #start()} method returns a {@link TemplatePages} object which can be used to create
 * a handler that you add to your own Mu Server instance.
 */
public class TemplatePagesBuilder {
    private static final Logger log = LoggerFactory.getLogger(TemplatePagesBuilder.class);

    private TemplateEngine templateEngine;
    private ContextBuilder contextBuilder = ContextBuilder.empty();
    private String templatePrefix = "";
    private CandidateResolver candidateResolver;
    private MatchPrecedence matchPrecedence = MatchPrecedence.LAST_MATCH;
    private List<PageListener> pageListeners = emptyList();

    /**
     * @return A new builder
     */
    public static TemplatePagesBuilder templatePages() {
        return new TemplatePagesBuilder();
    }

    /**
     * The templates that request paths are matched against and rendered with. This is required.
     *
     * @param templateEngine The template engine, for example one created with {@link MustacheTemplateEngine#fromDirectory(java.nio.file.Path)}
     * @return This builder
     */
    public TemplatePagesBuilder withTemplateEngine(TemplateEngine templateEngine) {
        Mutils.notNull("templateEngine", templateEngine);
        this.templateEngine = templateEngine;
        return this;
    }

    /**
     * Sets the function that creates the context each matched template is rendered with.
     * <p>The default gives each page an empty context.</p>
     *
     * @param contextBuilder The context builder to use.
     * @return This builder
     */
    public TemplatePagesBuilder withContextBuilder(ContextBuilder contextBuilder) {
        Mutils.notNull("contextBuilder", contextBuilder);
        this.contextBuilder = contextBuilder;
        return this;
    }

    /**
     * <p>The directory, relative to the template root, that request paths are looked up in. For example with
     * the prefix <code>pages</code> a request to <code>/about</code> renders <code>pages/about.html</code>
     * or <code>pages/about/index.html</code>.</p>
     * <p>Leading and trailing slashes are ignored, so <code>/pages/</code> is the same as <code>pages</code>.</p>
     *
     * @param templatePrefix The prefix to use.
     * @return This builder
     */
    public TemplatePagesBuilder withTemplatePrefix(String templatePrefix) {
        Mutils.notNull("templatePrefix", templatePrefix);
        this.templatePrefix = trimSlashes(templatePrefix);
        return this;
    }

    /**
     * Customized candidate resolver. If it's not specified, will use the default implementation in {@link CandidateResolver#resolve(String, String)}
     *
     * @param candidateResolver The customized candidate resolver.
     * @return This builder
     */
    public TemplatePagesBuilder withCandidateResolver(CandidateResolver candidateResolver) {
        this.candidateResolver = candidateResolver;
        return this;
    }

    /**
     * Sets which template is used when more than one candidate for a path is registered, for example when
     * both <code>about.html</code> and <code>about/index.html</code> exist. Defaults to {@link MatchPrecedence#LAST_MATCH}.
     *
     * @param matchPrecedence The precedence to use.
     * @return This builder
     */
    public TemplatePagesBuilder withMatchPrecedence(MatchPrecedence matchPrecedence) {
        Mutils.notNull("matchPrecedence", matchPrecedence);
        this.matchPrecedence = matchPrecedence;
        return this;
    }

    /**
     * Registers page listeners to be called before rendering and after pages are completed.
     *
     * @param pageListeners The listeners to add.
     * @return This builder
     */
    public TemplatePagesBuilder withPageListeners(List<PageListener> pageListeners) {
        Mutils.notNull("pageListeners", pageListeners);
        this.pageListeners = pageListeners;
        return this;
    }

    /**
     * @return A newly created TemplatePages object
     * @throws IllegalStateException Thrown if no template engine has been set
     */
    public TemplatePages start() {
        if (templateEngine == null) {
            throw new IllegalStateException("A template engine must be set with withTemplateEngine before starting");
        }
        if (templatePrefix.isEmpty() && candidateResolver == null) {
            log.warn("No template prefix is set, so the default resolver will only match template names starting with '/'");
        }
        CandidateResolver resolver = candidateResolver == null ? new CandidateResolver() {} : candidateResolver;
        List<PageListener> listeners = this.pageListeners.isEmpty() ? emptyList() : new ArrayList<>(this.pageListeners);
        return new TemplatePagesImpl(templateEngine, contextBuilder, templatePrefix, resolver, matchPrecedence, listeners);
    }

    static String trimSlashes(String value) {
        int start = 0;
        int end = value.length();
        while (start < end && value.charAt(start) == '/') start++;
        while (end > start && value.charAt(end - 1) == '/') end--;
        return value.substring(start, end);
    }

    static String trimTrailingSlashes(String value) {
        int end = value.length();
        while (end > 0 && value.charAt(end - 1) == '/') end--;
        return value.substring(0, end);
    }
}
