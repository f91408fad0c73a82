package com.hsbc.mupages;

import java.util.List;

/**
 * Algorithm for turning a request path into the template names that could serve it.
 * <p>A custom resolver can be registered with {@link TemplatePagesBuilder#withCandidateResolver(CandidateResolver)}</p>
 */
public interface CandidateResolver {

    /**
     * Generates the candidate template names for a request path, in the order they are checked.
     *
     * <p>The default implementation treats the path as either a template file or a directory holding
     * an <code>index.html</code>, e.g. with prefix <code>pages</code>:</p>
     *
     * <ol>
     *     <li><code>/about</code> gives <code>pages/about.html</code> and <code>pages/about/index.html</code></li>
     *     <li>an empty path gives just <code>pages/index.html</code></li>
     * </ol>
     *
     * <p>No URL decoding or <code>..</code> removal is done, the path is expected to be normalized by the server.</p>
     *
     * @param path   the request path with trailing slashes removed, e.g. <code>/about</code>, or an empty string for the root
     * @param prefix the template prefix with leading and trailing slashes removed, e.g. <code>pages</code>
     * @return a non-empty list of template names
     */
    default List<String> resolve(String path, String prefix) {
        if (path.isEmpty()) {
            return List.of(prefix + "/index.html");
        }
        return List.of(prefix + path + ".html", prefix + path + "/index.html");
    }
}
