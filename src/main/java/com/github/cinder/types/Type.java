package com.github.cinder.types;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;

/**
 * Type handle attached to expressions. Instances are interned per {@link Table},
 * so two handles from the same table denote the same type iff they are identical.
 */
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public abstract class Type {

    public boolean isDependent() {
        return false;
    }

    public boolean isMetaType() {
        return this instanceof MetaTypeType;
    }

    @Override
    public abstract String toString();

    public static final class NominalType extends Type {
        @Accessors(fluent = true)
        @Getter
        private final String name;

        private NominalType(String name) {
            this.name = name;
        }

        @Override
        public String toString() {
            return name;
        }
    }

    public static final class BuiltinIntegerType extends Type {
        @Accessors(fluent = true)
        @Getter
        private final int bitWidth;

        private BuiltinIntegerType(int bitWidth) {
            this.bitWidth = bitWidth;
        }

        @Override
        public String toString() {
            return "Builtin.Int" + bitWidth;
        }
    }

    public static final class BuiltinFloatType extends Type {
        public enum FPKind {
            IEEE32(32), IEEE64(64);

            final int bitWidth;

            FPKind(int bitWidth) {
                this.bitWidth = bitWidth;
            }
        }

        @Accessors(fluent = true)
        @Getter
        private final FPKind fpKind;

        private BuiltinFloatType(FPKind fpKind) {
            this.fpKind = fpKind;
        }

        public int bitWidth() {
            return fpKind.bitWidth;
        }

        @Override
        public String toString() {
            return "Builtin.FP" + fpKind;
        }
    }

    public static final class TupleType extends Type {
        @Accessors(fluent = true)
        @Getter
        private final ImmutableList<Type> elements;

        private TupleType(ImmutableList<Type> elements) {
            this.elements = elements;
        }

        @Override
        public String toString() {
            return elements.stream().map(Type::toString).collect(Collectors.joining(", ", "(", ")"));
        }
    }

    public static final class FunctionType extends Type {
        @Accessors(fluent = true)
        @Getter
        private final Type input;
        @Accessors(fluent = true)
        @Getter
        private final Type result;

        private FunctionType(Type input, Type result) {
            this.input = input;
            this.result = result;
        }

        @Override
        public String toString() {
            if (input instanceof FunctionType) {
                return "(" + input + ") -> " + result;
            }
            return input + " -> " + result;
        }
    }

    public static final class MetaTypeType extends Type {
        @Accessors(fluent = true)
        @Getter
        private final Type instanceType;

        private MetaTypeType(Type instanceType) {
            this.instanceType = instanceType;
        }

        @Override
        public String toString() {
            return instanceType + ".metatype";
        }
    }

    /**
     * Placeholder for "not yet known". Carried by overload sets and untyped
     * literals; it must not be inspected before resolution replaces it.
     */
    public static final class UnstructuredDependentType extends Type {
        private UnstructuredDependentType() {
        }

        @Override
        public boolean isDependent() {
            return true;
        }

        @Override
        public String toString() {
            return "<<dependent type>>";
        }
    }

    public static final class Table {
        private final Map<String, NominalType> nominals = new HashMap<>();
        private final Map<Integer, BuiltinIntegerType> integers = new HashMap<>();
        private final Map<BuiltinFloatType.FPKind, BuiltinFloatType> floats = new HashMap<>();
        private final Map<List<Type>, TupleType> tuples = new HashMap<>();
        private final Map<FunctionKey, FunctionType> functions = new HashMap<>();
        private final Map<Type, MetaTypeType> metatypes = new HashMap<>();
        private final UnstructuredDependentType dependent = new UnstructuredDependentType();

        private record FunctionKey(Type input, Type result) {}

        public NominalType nominal(String name) {
            return nominals.computeIfAbsent(name, NominalType::new);
        }

        public BuiltinIntegerType integer(int bitWidth) {
            Preconditions.checkArgument(bitWidth > 0, "integer bit width must be positive: %s", bitWidth);
            return integers.computeIfAbsent(bitWidth, BuiltinIntegerType::new);
        }

        public BuiltinFloatType floating(BuiltinFloatType.FPKind kind) {
            return floats.computeIfAbsent(kind, BuiltinFloatType::new);
        }

        public TupleType tuple(List<Type> elements) {
            var key = ImmutableList.copyOf(elements);
            return tuples.computeIfAbsent(key, k -> new TupleType(key));
        }

        public TupleType tuple(Type... elements) {
            return tuple(List.of(elements));
        }

        public FunctionType function(Type input, Type result) {
            return functions.computeIfAbsent(new FunctionKey(input, result), k -> new FunctionType(k.input, k.result));
        }

        public MetaTypeType metatype(Type instanceType) {
            return metatypes.computeIfAbsent(instanceType, MetaTypeType::new);
        }

        public UnstructuredDependentType dependent() {
            return dependent;
        }
    }
}
