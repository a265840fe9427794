package co.cqlgen.generators.java;

import com.squareup.javapoet.AnnotationSpec;
import com.squareup.javapoet.ClassName;
import com.squareup.javapoet.CodeBlock;
import com.squareup.javapoet.FieldSpec;
import com.squareup.javapoet.JavaFile;
import com.squareup.javapoet.MethodSpec;
import com.squareup.javapoet.TypeSpec;

import javax.lang.model.element.Modifier;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Generates the plain-Java model class of a table: one private field per column in column
 * order, tagged with its lower-camel JSON name, plus constructors, accessors and
 * equals/hashCode/toString.
 *
 * <p>Serialized blob collections are declared with their {@code deserializeTo} element type
 * ({@code List<Tag>}, {@code Map<String, Tag>}), never as raw bytes.
 */
public class DtoGenerator {

    private static final ClassName JSON_PROPERTY = ClassName.get(
        "com.fasterxml.jackson.annotation", "JsonProperty");
    private static final ClassName OBJECTS = ClassName.get("java.util", "Objects");

    public JavaFile generate(EmissionModel model, String pkg) {
        String className = model.getModelName();
        ClassName self = ClassName.get(pkg, className);
        List<ColumnEmission> columns = model.getColumns();

        TypeSpec.Builder tb = TypeSpec.classBuilder(className)
            .addModifiers(Modifier.PUBLIC)
            .addJavadoc("Row of $L, keyed by $L.\n", model.getQualifiedTableName(), model.getPrimaryKeyClause());

        for (ColumnEmission c : columns) {
            tb.addField(FieldSpec.builder(c.getDtoTypeName(), c.getName(), Modifier.PRIVATE)
                .addAnnotation(AnnotationSpec.builder(JSON_PROPERTY)
                    .addMember("value", "$S", c.getSerializationTag())
                    .build())
                .build());
        }

        tb.addMethod(MethodSpec.constructorBuilder()
            .addModifiers(Modifier.PUBLIC)
            .addJavadoc("No-arg constructor, used by the generated DAO and by Jackson.\n")
            .build());
        tb.addMethod(allColumnsConstructor(columns));

        for (ColumnEmission c : columns) {
            String doc = describe(c);
            tb.addMethod(MethodSpec.methodBuilder(c.getGetter())
                .addModifiers(Modifier.PUBLIC)
                .addJavadoc("$L\n", doc)
                .returns(c.getDtoTypeName())
                .addStatement("return this.$N", c.getName())
                .build());
            tb.addMethod(MethodSpec.methodBuilder(c.getSetter())
                .addModifiers(Modifier.PUBLIC)
                .addParameter(c.getDtoTypeName(), c.getName())
                .addStatement("this.$N = $N", c.getName(), c.getName())
                .build());
        }

        tb.addMethod(equalsMethod(self, columns));
        tb.addMethod(hashCodeMethod(columns));
        tb.addMethod(toStringMethod(className, columns));

        return JavaFile.builder(pkg, tb.build())
            .addFileComment("Code generated by cqlgen for $L; DO NOT EDIT THIS FILE", model.getGeneratedName())
            .skipJavaLangImports(true)
            .indent("    ")
            .build();
    }

    /** e.g. {@code ts} column ({@code timestamp}), clustering key, DESC. */
    static String describe(ColumnEmission c) {
        StringBuilder doc = new StringBuilder("{@code ").append(c.getName()).append("} column ({@code ")
            .append(c.getStorageType()).append("})");
        if (c.isPartitionKey()) {
            doc.append(", partition key");
        } else if (c.isClusteringKey()) {
            doc.append(", clustering key");
            String direction = c.getKeyRole().sortDirection();
            if (direction != null) doc.append(", ").append(direction);
        }
        if (c.isSerialized()) {
            doc.append(", each element stored as JSON");
        }
        return doc.append('.').toString();
    }

    private static MethodSpec allColumnsConstructor(List<ColumnEmission> columns) {
        MethodSpec.Builder ctor = MethodSpec.constructorBuilder().addModifiers(Modifier.PUBLIC);
        for (ColumnEmission c : columns) {
            ctor.addParameter(c.getDtoTypeName(), c.getName());
            ctor.addStatement("this.$N = $N", c.getName(), c.getName());
        }
        return ctor.build();
    }

    // Fields are read through this/that so no column name can shadow the parameter.
    private static MethodSpec equalsMethod(ClassName self, List<ColumnEmission> columns) {
        CodeBlock comparisons = CodeBlock.join(columns.stream()
            .map(c -> CodeBlock.of("$T.equals(this.$N, that.$N)", OBJECTS, c.getName(), c.getName()))
            .collect(Collectors.toList()), "\n    && ");
        return MethodSpec.methodBuilder("equals")
            .addAnnotation(Override.class)
            .addModifiers(Modifier.PUBLIC)
            .returns(boolean.class)
            .addParameter(Object.class, "other")
            .addStatement("if (this == other) return true")
            .addStatement("if (!(other instanceof $T)) return false", self)
            .addStatement("$T that = ($T) other", self, self)
            .addStatement("return $L", comparisons)
            .build();
    }

    private static MethodSpec hashCodeMethod(List<ColumnEmission> columns) {
        CodeBlock fields = CodeBlock.join(columns.stream()
            .map(c -> CodeBlock.of("this.$N", c.getName()))
            .collect(Collectors.toList()), ", ");
        return MethodSpec.methodBuilder("hashCode")
            .addAnnotation(Override.class)
            .addModifiers(Modifier.PUBLIC)
            .returns(int.class)
            .addStatement("return $T.hash($L)", OBJECTS, fields)
            .build();
    }

    private static MethodSpec toStringMethod(String className, List<ColumnEmission> columns) {
        CodeBlock.Builder body = CodeBlock.builder().add("$S", className + "{");
        for (int i = 0; i < columns.size(); i++) {
            String name = columns.get(i).getName();
            body.add(" + $S + this.$N", (i == 0 ? "" : ", ") + name + "=", name);
        }
        body.add(" + $S", "}");
        return MethodSpec.methodBuilder("toString")
            .addAnnotation(Override.class)
            .addModifiers(Modifier.PUBLIC)
            .returns(String.class)
            .addStatement("return $L", body.build())
            .build();
    }
}
