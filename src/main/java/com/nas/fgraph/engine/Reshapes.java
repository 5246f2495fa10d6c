package com.nas.fgraph.engine;

import com.nas.fgraph.api.InvalidReshapeException;
import com.nas.fgraph.model.GraphNode;
import com.nas.fgraph.model.ModelGraph;
import com.nas.fgraph.model.NodeFlags;
import com.nas.fgraph.model.TensorShape;

/**
 * Decides how a flatten or squeeze node changes the channel dimension of its
 * input. Both the calculator pass and the back-reference pass rely on this,
 * so they can never disagree about a reshape.
 */
final class Reshapes {
    private Reshapes() {
        // Utility class
    }

    /**
     * Effect of a reshape on the channel axis.
     *
     * @param altersChannels true if spatial extents were merged into the channels.
     * @param multiplier     factor applied to the upstream channel count; 1 when
     *                       the channels are left alone.
     */
    record Effect(boolean altersChannels, int multiplier) {
        static final Effect UNCHANGED = new Effect(false, 1);
    }

    /** Dispatches on the node's flags. */
    static Effect of(GraphNode reshape, ModelGraph graph) {
        NodeFlags flags = reshape.requireFlags();
        if (flags.flatten())
            return flatten(reshape, inputShape(reshape, graph));
        if (flags.squeeze())
            return squeeze(reshape, inputShape(reshape, graph));
        throw new IllegalArgumentException("Node " + reshape.name() + " is not a flatten or squeeze");
    }

    /**
     * {@code start_dim} (default 0) and {@code end_dim} (default -1) are read
     * from the first positional arguments or keywords. Merging starting at the
     * channel dimension multiplies it by the extents of dimensions 2..end_dim.
     */
    static Effect flatten(GraphNode n, TensorShape in) {
        int start = normalize(n, in, n.intArgument(0, "start_dim", 0), "start_dim");
        int end = normalize(n, in, n.intArgument(1, "end_dim", -1), "end_dim");
        if (start == TensorShape.BATCH_DIM)
            throw new InvalidReshapeException(n.name(), "Flattening the batch dimension is not supported");
        if (start > end)
            throw new InvalidReshapeException(n.name(), "start_dim " + start + " is after end_dim " + end);
        if (start == TensorShape.CHANNEL_DIM)
            return new Effect(true, in.product(TensorShape.CHANNEL_DIM + 1, end));
        return Effect.UNCHANGED;
    }

    /**
     * {@code dim} is mandatory. Squeezing the channel dimension moves the next
     * dimension into its place, so the channel count is multiplied by the
     * extent of dimension 2.
     */
    static Effect squeeze(GraphNode n, TensorShape in) {
        Integer dim = n.intArgument(0, "dim", null);
        if (dim == null)
            throw new InvalidReshapeException(n.name(), "Squeeze without dim is not supported");
        int d = normalize(n, in, dim, "dim");
        if (d == TensorShape.BATCH_DIM)
            throw new InvalidReshapeException(n.name(), "Squeezing the batch dimension is not supported");
        if (d == TensorShape.CHANNEL_DIM) {
            int next = in.rank() > TensorShape.CHANNEL_DIM + 1 ? in.dim(TensorShape.CHANNEL_DIM + 1) : 1;
            return new Effect(true, next);
        }
        return Effect.UNCHANGED;
    }

    private static TensorShape inputShape(GraphNode reshape, ModelGraph graph) {
        return graph.predecessors(reshape).get(0).requireShape();
    }

    private static int normalize(GraphNode n, TensorShape in, int dim, String argName) {
        try {
            return in.normalize(dim);
        } catch (IndexOutOfBoundsException e) {
            throw new InvalidReshapeException(n.name(),
                    argName + " " + dim + " is out of range for input shape " + in);
        }
    }
}
