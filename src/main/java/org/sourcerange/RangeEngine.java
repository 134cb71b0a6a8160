package org.sourcerange;

import org.sourcerange.api.IRangeEngine;
import org.sourcerange.api.Range;
import org.sourcerange.api.RangeException;
import org.sourcerange.api.RangeOptions;
import org.sourcerange.ast.Node;
import org.sourcerange.range.CommentAugmenter;
import org.sourcerange.range.RangeVisitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * The default implementation of {@link IRangeEngine}.
 * <p>
 * Computes the base range by dispatching on the node's shape and, if requested, widens it by the
 * node's leading comments. The engine holds no state, so a single instance can serve any number
 * of threads.
 */
public class RangeEngine implements IRangeEngine {

    private static final Logger LOG = LoggerFactory.getLogger(RangeEngine.class);

    @Override
    public Range getRange(Node node, RangeOptions options) {
        Objects.requireNonNull(node, "node");
        Objects.requireNonNull(options, "options");

        Range range;
        try {
            range = new RangeVisitor(options.maxDepth()).rangeOf(node);
        } catch (RangeException e) {
            LOG.debug("Cannot compute range of {}: {}", node.describe(), e.getMessage());
            throw e;
        }

        if (options.includeComments()) {
            Range widened = CommentAugmenter.widen(range, node);
            if (!widened.equals(range)) {
                LOG.debug("Comments widen {} from {} to {}", node.describe(), range, widened);
            }
            range = widened;
        }
        LOG.trace("Range of {} is {}", node.describe(), range);
        return range;
    }
}
