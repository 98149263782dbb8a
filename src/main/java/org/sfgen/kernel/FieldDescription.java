package org.sfgen.kernel;

import org.sfgen.lang.CppType;
import org.sfgen.lang.Variable;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Logical description of an array field accessed by a kernel.
 * <p>
 * The shape of a field is its spatial shape followed by its index shape; the strides list
 * has one entry per shape entry. Symbolic entries are kernel parameters named
 * {@code _size_<field>_<i>} and {@code _stride_<field>_<i>}; the base pointer is named
 * {@code _data_<field>}.
 *
 * @param name The field name.
 * @param elementType The element type.
 * @param spatialShape Extents of the spatial dimensions.
 * @param indexShape Extents of the index dimensions, empty for implicit scalar fields.
 * @param strides Strides of all dimensions.
 * @param basePointer The base pointer parameter.
 */
public record FieldDescription(
        String name,
        CppType elementType,
        List<Extent> spatialShape,
        List<Extent> indexShape,
        List<Extent> strides,
        Variable basePointer
) {

    public static final CppType INDEX_TYPE = CppType.INT64.constQualified();

    public FieldDescription {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(elementType, "elementType");
        spatialShape = List.copyOf(spatialShape);
        indexShape = List.copyOf(indexShape);
        strides = List.copyOf(strides);
        Objects.requireNonNull(basePointer, "basePointer");
        if (spatialShape.isEmpty()) {
            throw new IllegalArgumentException("Field " + name + " must have at least one spatial dimension");
        }
        if (strides.size() != spatialShape.size() + indexShape.size()) {
            throw new IllegalArgumentException("Field " + name + ": expected "
                    + (spatialShape.size() + indexShape.size()) + " strides, but got " + strides.size());
        }
    }

    /**
     * Creates a field with fully symbolic shape and strides.
     *
     * @param name The field name.
     * @param elementType The element type.
     * @param spatialDims Number of spatial dimensions.
     * @param indexShape Fixed index shape, e.g. {@code 3} for a vector field; none for a scalar field.
     * @return The field description.
     */
    public static FieldDescription create(String name, CppType elementType, int spatialDims, long... indexShape) {
        List<Extent> spatial = new ArrayList<>();
        for (int i = 0; i < spatialDims; i++) {
            spatial.add(Extent.of(sizeSymbol(name, i)));
        }
        List<Extent> index = new ArrayList<>();
        for (long s : indexShape) {
            index.add(Extent.of(s));
        }
        List<Extent> strides = new ArrayList<>();
        for (int i = 0; i < spatialDims + indexShape.length; i++) {
            strides.add(Extent.of(strideSymbol(name, i)));
        }
        return new FieldDescription(name, elementType, spatial, index, strides, basePointer(name, elementType));
    }

    public static Variable sizeSymbol(String field, int coordinate) {
        return new Variable("_size_" + field + "_" + coordinate, INDEX_TYPE);
    }

    public static Variable strideSymbol(String field, int coordinate) {
        return new Variable("_stride_" + field + "_" + coordinate, INDEX_TYPE);
    }

    public static Variable basePointer(String field, CppType elementType) {
        return new Variable("_data_" + field, CppType.pointerTo(elementType));
    }

    public int spatialDimensions() {
        return spatialShape.size();
    }

    /**
     * @return Spatial shape followed by index shape.
     */
    public List<Extent> shape() {
        List<Extent> all = new ArrayList<>(spatialShape);
        all.addAll(indexShape);
        return List.copyOf(all);
    }

    /**
     * @return Whether the index shape is exactly {@code (1)}.
     */
    public boolean isExplicitScalar() {
        return indexShape.size() == 1 && indexShape.get(0).equals(Extent.of(1));
    }

    /**
     * @return The number of dimensions a data structure must provide for this field.
     */
    public int mappedRank() {
        return isExplicitScalar() ? spatialDimensions() : spatialShape.size() + indexShape.size();
    }

    /**
     * @return All symbolic kernel parameters of this field, base pointer first.
     */
    public List<Variable> parameters() {
        List<Variable> out = new ArrayList<>();
        out.add(basePointer);
        for (Extent e : shape()) {
            if (e instanceof Extent.Symbolic s) {
                out.add(s.symbol());
            }
        }
        for (Extent e : strides) {
            if (e instanceof Extent.Symbolic s && !out.contains(s.symbol())) {
                out.add(s.symbol());
            }
        }
        return out;
    }

    /**
     * Returns a copy of this description with the given strides.
     *
     * @param newStrides The new strides.
     * @return The new description.
     */
    public FieldDescription withStrides(List<Extent> newStrides) {
        return new FieldDescription(name, elementType, spatialShape, indexShape, newStrides, basePointer);
    }

    public FieldDescription withSpatialShape(List<Extent> newShape) {
        return new FieldDescription(name, elementType, newShape, indexShape, strides, basePointer);
    }
}
