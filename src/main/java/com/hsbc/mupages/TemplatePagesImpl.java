package com.hsbc.mupages;

import io.muserver.MuHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

class TemplatePagesImpl implements TemplatePages {
    private static final Logger log = LoggerFactory.getLogger(TemplatePagesImpl.class);

    private final TemplateEngine templateEngine;
    private final ContextBuilder contextBuilder;
    private final String templatePrefix;
    private final CandidateResolver candidateResolver;
    private final MatchPrecedence matchPrecedence;
    private final List<PageListener> pageListeners;

    TemplatePagesImpl(TemplateEngine templateEngine, ContextBuilder contextBuilder, String templatePrefix,
                      CandidateResolver candidateResolver, MatchPrecedence matchPrecedence, List<PageListener> pageListeners) {
        this.templateEngine = templateEngine;
        this.contextBuilder = contextBuilder;
        this.templatePrefix = templatePrefix;
        this.candidateResolver = candidateResolver;
        this.matchPrecedence = matchPrecedence;
        this.pageListeners = pageListeners;
    }

    @Override
    public MuHandler createHttpHandler() {
        return new TemplatePageHandler(this, contextBuilder, pageListeners);
    }

    @Override
    public Optional<String> resolveTemplate(String path) {
        List<String> candidates = candidateResolver.resolve(TemplatePagesBuilder.trimTrailingSlashes(path), templatePrefix);
        log.debug("Checking template candidates: {}", candidates);
        Optional<String> matched = matchPrecedence.select(candidates, templateEngine.templateNames());
        if (matched.isPresent()) {
            log.debug("Matched path {} to template {}", path, matched.get());
        } else {
            log.debug("No matching template for path {}", path);
        }
        return matched;
    }

    @Override
    public TemplateEngine templateEngine() {
        return templateEngine;
    }

    @Override
    public String templatePrefix() {
        return templatePrefix;
    }

    @Override
    public String toString() {
        return "TemplatePages{" +
            "templatePrefix='" + templatePrefix + '\'' +
            ", matchPrecedence=" + matchPrecedence +
            ", templateCount=" + templateEngine.templateNames().size() +
            '}';
    }
}
