package com.hsbc.mupages;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;

public class CandidateResolverTest {

    private final CandidateResolver resolver = new CandidateResolver() {};

    @Test
    public void nonEmptyPathsGiveAFileCandidateThenAnIndexCandidate() {
        assertThat(resolver.resolve("/about", "pages"), contains("pages/about.html", "pages/about/index.html"));
        assertThat(resolver.resolve("/blog/2024/first-post", "pages"),
            contains("pages/blog/2024/first-post.html", "pages/blog/2024/first-post/index.html"));
        assertThat(resolver.resolve("/about", "site/pages"), contains("site/pages/about.html", "site/pages/about/index.html"));
    }

    @Test
    public void theRootPathGivesOnlyTheIndexCandidate() {
        assertThat(resolver.resolve("", "pages"), contains("pages/index.html"));
        assertThat(resolver.resolve("", "pages"), hasSize(1));
    }

    @Test
    public void prefixesAreConcatenatedLiterally() {
        assertThat(resolver.resolve("/about", ""), contains("/about.html", "/about/index.html"));
        assertThat(resolver.resolve("", ""), contains("/index.html"));
    }

    @Test
    public void pathsAreNotDecodedOrSanitised() {
        assertThat(resolver.resolve("/about%20us", "pages"), contains("pages/about%20us.html", "pages/about%20us/index.html"));
        assertThat(resolver.resolve("/../secret", "pages"), contains("pages/../secret.html", "pages/../secret/index.html"));
    }

    @Test
    public void resolvingIsRepeatable() {
        List<String> first = resolver.resolve("/about", "pages");
        List<String> second = resolver.resolve("/about", "pages");
        assertThat(second, equalTo(first));
        assertThat(resolver.resolve("", "pages"), equalTo(resolver.resolve("", "pages")));
    }
}
