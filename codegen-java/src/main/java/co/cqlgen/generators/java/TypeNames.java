package co.cqlgen.generators.java;

import com.squareup.javapoet.ClassName;
import com.squareup.javapoet.ParameterizedTypeName;
import com.squareup.javapoet.TypeName;

import java.util.Set;
import java.util.stream.Collectors;

/**
 * Renders JavaPoet type names for templates, which print simple names and declare imports
 * themselves.
 */
final class TypeNames {

    private TypeNames() {}

    /**
     * {@code java.util.Map<java.lang.String, com.acme.Tag>} → {@code Map<String, Tag>}.
     */
    static String simple(TypeName type) {
        if (type instanceof ParameterizedTypeName p) {
            return simple(p.rawType) + p.typeArguments.stream()
                .map(TypeNames::simple)
                .collect(Collectors.joining(", ", "<", ">"));
        }
        if (type instanceof ClassName c) {
            return String.join(".", c.simpleNames());
        }
        return type.toString();
    }

    /**
     * Add the import every class in {@code type} needs, skipping {@code java.lang}, the default
     * package and {@code localPackage}.
     */
    static void collectImports(TypeName type, String localPackage, Set<String> into) {
        if (type instanceof ParameterizedTypeName p) {
            collectImports(p.rawType, localPackage, into);
            p.typeArguments.forEach(arg -> collectImports(arg, localPackage, into));
        } else if (type instanceof ClassName c) {
            String pkg = c.packageName();
            if (!pkg.isEmpty() && !"java.lang".equals(pkg) && !pkg.equals(localPackage)) {
                into.add(c.topLevelClassName().canonicalName());
            }
        }
    }
}
