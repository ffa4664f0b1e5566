package com.jsprinter.scanner;

/**
 * One binding introduced by an import statement.
 *
 * @param localName the name bound in the importing module
 * @param exportName the name exported by the imported module: {@code "default"} for default
 *                   imports, {@code "*"} for namespace imports
 */
public record ImportedName(String localName, String exportName) {
    public static final String DEFAULT = "default";
    public static final String NAMESPACE = "*";

    public boolean isNamespace() {
        return NAMESPACE.equals(exportName);
    }
}
