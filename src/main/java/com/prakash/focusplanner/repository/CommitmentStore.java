package com.prakash.focusplanner.repository;

import com.prakash.focusplanner.model.Commitment;

import java.util.List;

/**
 * Persistent store for commitments. Every method may throw
 * {@link com.prakash.focusplanner.exception.StoreFailureException}.
 */
public interface CommitmentStore {

    Commitment create(Commitment commitment);

    Commitment update(Commitment commitment);

    void delete(String id);

    List<Commitment> fetch(CommitmentQuery query);

    void batchUpdateSortOrders(List<SortOrderUpdate> updates);

    void batchUpdateSortOrdersAndSections(List<SectionSortOrderUpdate> updates);
}
