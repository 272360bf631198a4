package com.enterprise.wholesale.churn.application;

import com.enterprise.wholesale.customer.domain.ClassifiedCustomer;

import java.util.ArrayList;
import java.util.List;

/**
 * Classified customers collected by the health step of one job execution,
 * read back by the report step.
 */
public class DoorHealthRunContext {

    private final List<ClassifiedCustomer> classified = new ArrayList<>();

    public synchronized void add(ClassifiedCustomer customer) {
        classified.add(customer);
    }

    public synchronized List<ClassifiedCustomer> classified() {
        return List.copyOf(classified);
    }

    public synchronized int size() {
        return classified.size();
    }
}
