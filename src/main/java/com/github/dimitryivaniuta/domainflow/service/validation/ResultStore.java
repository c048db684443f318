package com.github.dimitryivaniuta.domainflow.service.validation;

import java.util.Collection;
import java.util.List;

/**
 * Persistence of one stage's result rows, as seen by {@link ValidationResultWriter}.
 *
 * @param <R> result entity
 */
public interface ResultStore<R> {

    List<String> existingNames(String campaignId, Collection<String> names);

    void saveAll(List<R> results);

    String domainOf(R result);

    /**
     * Whether a result counts towards {@code successful_items}; every other result is a failed item.
     */
    boolean isSuccessful(R result);
}
