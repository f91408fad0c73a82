package com.hsbc.mupages;

import com.github.mustachejava.DefaultMustacheFactory;
import com.github.mustachejava.Mustache;
import com.github.mustachejava.MustacheException;
import io.muserver.Mutils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static java.util.Collections.unmodifiableMap;
import static java.util.Collections.unmodifiableSet;

/**
 * A {@link TemplateEngine} backed by <a href="https://github.com/spullara/mustache.java">mustache.java</a>.
 * <p>Every file under a root directory that has one of the given suffixes is compiled when the engine is
 * created, and registered under its path relative to the root. For example, with the root <code>templates</code>
 * the file <code>templates/pages/about.html</code> is registered as <code>pages/about.html</code>.</p>
 * <p>Partial names are always resolved from the root directory, whichever directory the including template is in,
 * so <code>{{&gt; partials/navbar}}</code> in <code>pages/about.html</code> loads <code>partials/navbar.html</code>.
 * The including template's extension is added when the name has none, and a leading <code>/</code> is ignored.</p>
 */
public class MustacheTemplateEngine implements TemplateEngine {
    private static final Logger log = LoggerFactory.getLogger(MustacheTemplateEngine.class);

    private final Map<String, Mustache> templates;
    private final Set<String> templateNames;

    private MustacheTemplateEngine(Map<String, Mustache> templates) {
        this.templates = unmodifiableMap(templates);
        this.templateNames = unmodifiableSet(templates.keySet());
    }

    /**
     * Compiles all the <code>.html</code> files under the given directory.
     *
     * @param root The directory containing the templates
     * @return A new engine
     * @throws IOException             Thrown if the directory cannot be read
     * @throws TemplateRenderException Thrown if any template fails to compile
     */
    public static MustacheTemplateEngine fromDirectory(Path root) throws IOException, TemplateRenderException {
        return fromDirectory(root, List.of(".html"));
    }

    /**
     * Compiles all the files under the given directory whose names end with one of the suffixes.
     *
     * @param root     The directory containing the templates
     * @param suffixes File suffixes to register, for example <code>.html</code> and <code>.htm</code>
     * @return A new engine
     * @throws IOException             Thrown if the directory cannot be read
     * @throws TemplateRenderException Thrown if any template fails to compile
     */
    public static MustacheTemplateEngine fromDirectory(Path root, List<String> suffixes) throws IOException, TemplateRenderException {
        Mutils.notNull("root", root);
        Mutils.notNull("suffixes", suffixes);
        if (suffixes.isEmpty()) {
            throw new IllegalArgumentException("At least one template suffix is required");
        }
        if (!Files.isDirectory(root)) {
            throw new IOException("Template root " + root.toAbsolutePath() + " is not a directory");
        }

        List<String> names;
        try (Stream<Path> files = Files.walk(root)) {
            names = files
                .filter(Files::isRegularFile)
                .map(file -> root.relativize(file).toString().replace('\\', '/'))
                .filter(name -> suffixes.stream().anyMatch(name::endsWith))
                .sorted()
                .collect(Collectors.toList());
        }

        DefaultMustacheFactory factory = new RootPartialsMustacheFactory(root);
        Map<String, Mustache> compiled = new LinkedHashMap<>();
        for (String name : names) {
            try {
                compiled.put(name, factory.compile(name));
            } catch (MustacheException e) {
                throw new TemplateRenderException("Error compiling template " + name + ": " + e.getMessage(), e);
            }
        }
        log.info("Registered {} templates from {}", compiled.size(), root.toAbsolutePath());
        log.debug("Template names: {}", compiled.keySet());
        return new MustacheTemplateEngine(compiled);
    }

    @Override
    public Set<String> templateNames() {
        return templateNames;
    }

    @Override
    public String render(String templateName, Map<String, Object> context) throws TemplateRenderException {
        Mustache mustache = templates.get(templateName);
        if (mustache == null) {
            throw new TemplateRenderException("No template named " + templateName);
        }
        StringWriter writer = new StringWriter();
        try {
            mustache.execute(writer, context).flush();
        } catch (MustacheException | IOException e) {
            throw new TemplateRenderException("Error rendering template " + templateName + ": " + e.getMessage(), e);
        }
        return writer.toString();
    }

    static class RootPartialsMustacheFactory extends DefaultMustacheFactory {
        RootPartialsMustacheFactory(Path root) {
            super(root.toFile());
        }

        @Override
        public String resolvePartialPath(String dir, String name, String extension) {
            return partialPath(name, extension);
        }

        static String partialPath(String name, String extension) {
            String path = name;
            while (path.startsWith("/")) {
                path = path.substring(1);
            }
            return path.endsWith(extension) ? path : path + extension;
        }
    }

    @Override
    public String toString() {
        return "MustacheTemplateEngine{" +
            "templateNames=" + templateNames +
            '}';
    }
}
