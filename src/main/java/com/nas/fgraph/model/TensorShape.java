package com.nas.fgraph.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Static shape of a node's output tensor, as written by the shape-inference
 * collaborator. Dimension 0 is the batch, dimension 1 the channels.
 */
public final class TensorShape {
    public static final int BATCH_DIM = 0;
    public static final int CHANNEL_DIM = 1;

    private final int[] dims;

    private TensorShape(int[] dims) {
        this.dims = dims;
    }

    public static TensorShape of(int... dims) {
        if (dims == null || dims.length == 0)
            throw new IllegalArgumentException("Shape must have at least one dimension");
        for (int d : dims) {
            if (d <= 0)
                throw new IllegalArgumentException("Shape extents must be positive: " + Arrays.toString(dims));
        }
        return new TensorShape(dims.clone());
    }

    public static TensorShape of(List<Integer> dims) {
        if (dims == null)
            throw new IllegalArgumentException("Shape must not be null");
        return of(dims.stream().mapToInt(Integer::intValue).toArray());
    }

    public int rank() {
        return dims.length;
    }

    public int dim(int i) {
        return dims[normalize(i)];
    }

    /**
     * Number of channels (extent of dimension 1).
     *
     * @throws IllegalStateException if the tensor has no channel dimension.
     */
    public int channels() {
        if (dims.length <= CHANNEL_DIM)
            throw new IllegalStateException("Shape " + this + " has no channel dimension");
        return dims[CHANNEL_DIM];
    }

    /**
     * Maps a possibly negative dimension index to its positive form, following
     * the usual tensor convention ({@code -1} is the last dimension).
     *
     * @throws IndexOutOfBoundsException if the index falls outside the shape.
     */
    public int normalize(int dim) {
        int d = dim < 0 ? dim + dims.length : dim;
        if (d < 0 || d >= dims.length)
            throw new IndexOutOfBoundsException("Dimension " + dim + " out of range for rank " + dims.length);
        return d;
    }

    /** Product of the extents from {@code from} to {@code to}, both inclusive. 1 for an empty range. */
    public int product(int from, int to) {
        int p = 1;
        for (int i = from; i <= to; i++)
            p *= dims[i];
        return p;
    }

    public List<Integer> toList() {
        List<Integer> list = new ArrayList<>(dims.length);
        for (int d : dims)
            list.add(d);
        return list;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof TensorShape other && Arrays.equals(dims, other.dims);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(dims);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(dims.length * 4).append('(');
        for (int i = 0; i < dims.length; i++) {
            sb.append(dims[i]);
            if (i < dims.length - 1)
                sb.append(", ");
        }
        return sb.append(')').toString();
    }
}
