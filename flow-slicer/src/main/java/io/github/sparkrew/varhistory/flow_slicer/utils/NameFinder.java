package io.github.sparkrew.varhistory.flow_slicer.utils;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.ThisExpr;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Collects the identifiers a statement reads or writes.
 * <p>
 * Only plain names count: local variables, parameters, declared variables and an unqualified {@code this}. Method
 * names, field names after a dot and type names are not identifiers of the snapshot and are skipped. A name used as
 * the scope of a qualified access ({@code System} in {@code System.out}) is included, it just never shows up in a
 * snapshot.
 */
public class NameFinder {

    public static Set<String> findNames(String statement) {
        ParsedStatement parsed = StatementParser.parse(statement);
        if (parsed.isOpaque()) {
            return new LinkedHashSet<>();
        }
        return findNames(parsed.ast());
    }

    public static Set<String> findNames(Node node) {
        Set<String> names = new LinkedHashSet<>();
        if (node == null) {
            return names;
        }
        node.walk(child -> {
            if (child instanceof NameExpr nameExpr) {
                names.add(nameExpr.getNameAsString());
            } else if (child instanceof ThisExpr thisExpr && thisExpr.getTypeName().isEmpty()) {
                names.add("this");
            } else if (child instanceof VariableDeclarator declarator) {
                names.add(declarator.getNameAsString());
            }
        });
        return names;
    }
}
