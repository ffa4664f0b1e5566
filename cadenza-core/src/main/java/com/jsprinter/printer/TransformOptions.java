package com.jsprinter.printer;

/**
 * Options for one print session.
 *
 * @param filename name of the component source, used in logs and as the source map source
 * @param internalUrl module specifier the runtime entry points are imported from
 * @param site site URL, embedded verbatim in the generated Astro context
 * @param runtimeNames identifiers used for runtime entry points
 */
public record TransformOptions(
    String filename,
    String internalUrl,
    String site,
    RuntimeNames runtimeNames
) {
    public static final String DEFAULT_INTERNAL_URL = "astro/internal";
    public static final String DEFAULT_FILENAME = "<stdin>";

    public TransformOptions {
        filename = filename != null ? filename : DEFAULT_FILENAME;
        internalUrl = internalUrl != null ? internalUrl : DEFAULT_INTERNAL_URL;
        site = site != null ? site : "";
        runtimeNames = runtimeNames != null ? runtimeNames : RuntimeNames.DEFAULT;
    }

    public TransformOptions(String filename, String internalUrl, String site) {
        this(filename, internalUrl, site, RuntimeNames.DEFAULT);
    }

    public static TransformOptions defaults() {
        return new TransformOptions(null, null, null, null);
    }

    public TransformOptions withSite(String site) {
        return new TransformOptions(filename, internalUrl, site, runtimeNames);
    }
}
