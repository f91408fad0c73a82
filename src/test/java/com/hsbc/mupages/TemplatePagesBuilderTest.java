package com.hsbc.mupages;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static com.hsbc.mupages.TemplatePagesBuilder.templatePages;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;

public class TemplatePagesBuilderTest {

    @Test
    public void aTemplateEngineIsRequired() {
        IllegalStateException e = Assertions.assertThrows(IllegalStateException.class,
            () -> templatePages().withTemplatePrefix("pages").start());
        assertThat(e.getMessage(), containsString("template engine"));
    }

    @Test
    public void nullArgumentsAreRejected() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> templatePages().withTemplateEngine(null));
        Assertions.assertThrows(IllegalArgumentException.class, () -> templatePages().withContextBuilder(null));
        Assertions.assertThrows(IllegalArgumentException.class, () -> templatePages().withTemplatePrefix(null));
        Assertions.assertThrows(IllegalArgumentException.class, () -> templatePages().withMatchPrecedence(null));
        Assertions.assertThrows(IllegalArgumentException.class, () -> templatePages().withPageListeners(null));
    }

    @Test
    public void leadingAndTrailingSlashesAreRemovedFromThePrefix() {
        TemplateEngine engine = new FixedTemplateEngine("pages/index.html");
        assertThat(templatePages().withTemplateEngine(engine).withTemplatePrefix("/pages/").start().templatePrefix(), is("pages"));
        assertThat(templatePages().withTemplateEngine(engine).withTemplatePrefix("//site/pages//").start().templatePrefix(), is("site/pages"));
        assertThat(templatePages().withTemplateEngine(engine).withTemplatePrefix("pages").start().templatePrefix(), is("pages"));
        assertThat(templatePages().withTemplateEngine(engine).withTemplatePrefix("/").start().templatePrefix(), is(""));
        assertThat(templatePages().withTemplateEngine(engine).start().templatePrefix(), is(""));
    }

    @Test
    public void theDirectoryIndexWinsWhenBothCandidatesAreRegistered() {
        TemplatePages pages = templatePages()
            .withTemplateEngine(new FixedTemplateEngine("pages/about.html", "pages/about/index.html"))
            .withTemplatePrefix("pages")
            .start();
        assertThat(pages.resolveTemplate("/about"), is(Optional.of("pages/about/index.html")));
    }

    @Test
    public void theFileWinsWhenFirstMatchPrecedenceIsUsed() {
        TemplatePages pages = templatePages()
            .withTemplateEngine(new FixedTemplateEngine("pages/about.html", "pages/about/index.html"))
            .withTemplatePrefix("pages")
            .withMatchPrecedence(MatchPrecedence.FIRST_MATCH)
            .start();
        assertThat(pages.resolveTemplate("/about"), is(Optional.of("pages/about.html")));
    }

    @Test
    public void eitherCandidateMatchesOnItsOwn() {
        TemplatePages pages = templatePages()
            .withTemplateEngine(new FixedTemplateEngine("pages/index.html", "pages/about.html", "pages/blog/index.html"))
            .withTemplatePrefix("pages")
            .start();
        assertThat(pages.resolveTemplate("/about"), is(Optional.of("pages/about.html")));
        assertThat(pages.resolveTemplate("/about/"), is(Optional.of("pages/about.html")));
        assertThat(pages.resolveTemplate("/blog"), is(Optional.of("pages/blog/index.html")));
        assertThat(pages.resolveTemplate("/blog///"), is(Optional.of("pages/blog/index.html")));
        assertThat(pages.resolveTemplate("/"), is(Optional.of("pages/index.html")));
        assertThat(pages.resolveTemplate(""), is(Optional.of("pages/index.html")));
        assertThat(pages.resolveTemplate("/nonexistent"), is(Optional.empty()));
        assertThat(pages.resolveTemplate("/index"), is(Optional.of("pages/index.html")));
    }

    @Test
    public void customResolversCanBeUsed() {
        CandidateResolver htmOnly = (path, prefix) -> List.of(prefix + path + ".htm");
        TemplatePages pages = templatePages()
            .withTemplateEngine(new FixedTemplateEngine("pages/about.htm", "pages/about.html"))
            .withTemplatePrefix("pages")
            .withCandidateResolver(htmOnly)
            .start();
        assertThat(pages.resolveTemplate("/about"), is(Optional.of("pages/about.htm")));
    }

    @Test
    public void theEngineGivenToTheBuilderIsExposed() {
        TemplateEngine engine = new FixedTemplateEngine("pages/index.html");
        TemplatePages pages = templatePages().withTemplateEngine(engine).withTemplatePrefix("pages").start();
        assertThat(pages.templateEngine(), sameInstance(engine));
    }
}
