package com.enterprise.wholesale.shared.querybridge.adapter;

import com.enterprise.wholesale.shared.querybridge.port.BatchDmlProvider;

/** Upsert statements for the analytics output tables. */
public class DmlProviderRegistry extends ProviderRegistry<BatchDmlProvider> {

    public DmlProviderRegistry() {
        super("DML provider");
    }
}
