package com.enterprise.wholesale.shared.querybridge.adapter;

import com.enterprise.wholesale.shared.querybridge.port.BatchQueryProvider;

/** Reader queries, e.g. {@code allCustomers} and {@code activeForecasts}. */
public class QueryProviderRegistry extends ProviderRegistry<BatchQueryProvider> {

    public QueryProviderRegistry() {
        super("query provider");
    }
}
