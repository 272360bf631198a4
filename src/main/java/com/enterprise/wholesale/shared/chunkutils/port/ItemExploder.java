package com.enterprise.wholesale.shared.chunkutils.port;

import java.util.Collection;

/**
 * Turns one input item into zero or more output items.
 */
@FunctionalInterface
public interface ItemExploder<I, O> {
    Collection<O> explode(I item) throws Exception;
}
