package de.upb.sse.typefill.visitors;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.type.ClassOrInterfaceType;
import com.github.javaparser.ast.type.Type;
import com.github.javaparser.ast.type.UnknownType;
import com.github.javaparser.ast.type.VarType;

import java.util.Optional;

/**
 * A position in the tree where a type annotation may be written.
 *
 * The value of a site is either a written {@link Type} or absent. Absent covers the two ways Java
 * lets a declaration go without a written type: an implicitly typed lambda parameter
 * ({@link UnknownType}) and {@code var} ({@link VarType}).
 */
public abstract class TypeSite {

    public enum Kind { PARAMETER, VARIABLE, RETURN }

    private TypeSite() {
    }

    /**
     * The site held by {@code node}, if {@code node} is a parameter, a variable declarator or a method
     * declaration.
     */
    public static Optional<TypeSite> at(Node node, String holeMarker) {
        if (node instanceof Parameter) {
            return Optional.of(new ParameterSite((Parameter) node));
        }
        if (node instanceof VariableDeclarator) {
            return Optional.of(new VariableSite((VariableDeclarator) node));
        }
        if (node instanceof MethodDeclaration) {
            return Optional.of(new ReturnSite((MethodDeclaration) node, holeMarker));
        }
        return Optional.empty();
    }

    public abstract Kind getKind();

    public abstract Optional<Type> get();

    public abstract void set(Optional<Type> value);

    static boolean isAbsent(Type type) {
        return type instanceof UnknownType || type instanceof VarType;
    }

    private static final class ParameterSite extends TypeSite {
        private final Parameter parameter;

        ParameterSite(Parameter parameter) {
            this.parameter = parameter;
        }

        @Override
        public Kind getKind() {
            return Kind.PARAMETER;
        }

        @Override
        public Optional<Type> get() {
            Type type = parameter.getType();
            return isAbsent(type) ? Optional.empty() : Optional.of(type);
        }

        @Override
        public void set(Optional<Type> value) {
            parameter.setType(value.orElseGet(UnknownType::new));
        }
    }

    private static final class VariableSite extends TypeSite {
        private final VariableDeclarator variable;

        VariableSite(VariableDeclarator variable) {
            this.variable = variable;
        }

        @Override
        public Kind getKind() {
            return Kind.VARIABLE;
        }

        @Override
        public Optional<Type> get() {
            Type type = variable.getType();
            return isAbsent(type) ? Optional.empty() : Optional.of(type);
        }

        @Override
        public void set(Optional<Type> value) {
            variable.setType(value.orElseGet(VarType::new));
        }
    }

    /** Return types are never absent in Java; writing "absent" puts the hole marker there instead. */
    private static final class ReturnSite extends TypeSite {
        private final MethodDeclaration method;
        private final String holeMarker;

        ReturnSite(MethodDeclaration method, String holeMarker) {
            this.method = method;
            this.holeMarker = holeMarker;
        }

        @Override
        public Kind getKind() {
            return Kind.RETURN;
        }

        @Override
        public Optional<Type> get() {
            return Optional.of(method.getType());
        }

        @Override
        public void set(Optional<Type> value) {
            method.setType(value.orElseGet(() -> new ClassOrInterfaceType(null, holeMarker)));
        }
    }
}
