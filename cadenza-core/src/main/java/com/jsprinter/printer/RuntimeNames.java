package com.jsprinter.printer;

/**
 * Identifiers the generated module uses for runtime entry points and well-known bindings.
 *
 * <p>{@link #DEFAULT} matches the calling convention of the rendering runtime. Other instances
 * exist for embedding the printer next to a runtime that exports the same functions under
 * different local names.</p>
 */
public record RuntimeNames(
    String render,
    String createAstro,
    String createComponent,
    String renderComponent,
    String renderSlot,
    String addAttribute,
    String spreadAttributes,
    String defineStyleVars,
    String defineScriptVars,
    String createMetadata,
    String metadata,
    String result,
    String slots,
    String fragment
) {
    public static final RuntimeNames DEFAULT = new RuntimeNames(
        "$$render",
        "$$createAstro",
        "$$createComponent",
        "$$renderComponent",
        "$$renderSlot",
        "$$addAttribute",
        "$$spreadAttributes",
        "$$defineStyleVars",
        "$$defineScriptVars",
        "$$createMetadata",
        "$$metadata",
        "$$result",
        "$$slots",
        "Fragment");
}
