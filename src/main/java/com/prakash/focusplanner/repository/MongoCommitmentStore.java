package com.prakash.focusplanner.repository;

import com.prakash.focusplanner.exception.StoreFailureException;
import com.prakash.focusplanner.model.Commitment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.BulkOperations;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.function.Supplier;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * {@link CommitmentStore} backed by the MongoDB {@code commitments} collection.
 * {@link CommitmentQuery} filters are translated into Mongo criteria here and nowhere else.
 */
@Component
public class MongoCommitmentStore implements CommitmentStore {

    private static final Logger log = LoggerFactory.getLogger(MongoCommitmentStore.class);

    private final MongoTemplate mongoTemplate;

    @Autowired
    public MongoCommitmentStore(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    @Override
    public Commitment create(Commitment commitment) {
        return call("create commitment", () -> mongoTemplate.insert(commitment));
    }

    @Override
    public Commitment update(Commitment commitment) {
        return call("update commitment " + commitment.getId(), () -> mongoTemplate.save(commitment));
    }

    @Override
    public void delete(String id) {
        call("delete commitment " + id, () -> mongoTemplate.remove(new Query(where("_id").is(id)), Commitment.class));
    }

    @Override
    public List<Commitment> fetch(CommitmentQuery query) {
        Query mongoQuery = toMongoQuery(query);
        log.debug("Fetching commitments with {}", mongoQuery);
        return call("fetch commitments", () -> mongoTemplate.find(mongoQuery, Commitment.class));
    }

    @Override
    public void batchUpdateSortOrders(List<SortOrderUpdate> updates) {
        if (updates.isEmpty()) {
            return;
        }
        call("update " + updates.size() + " sort orders", () -> {
            BulkOperations bulk = mongoTemplate.bulkOps(BulkOperations.BulkMode.UNORDERED, Commitment.class);
            for (SortOrderUpdate update : updates) {
                bulk.updateOne(new Query(where("_id").is(update.id())), new Update().set("sortOrder", update.sortOrder()));
            }
            return bulk.execute();
        });
    }

    @Override
    public void batchUpdateSortOrdersAndSections(List<SectionSortOrderUpdate> updates) {
        if (updates.isEmpty()) {
            return;
        }
        call("update " + updates.size() + " sort orders and sections", () -> {
            BulkOperations bulk = mongoTemplate.bulkOps(BulkOperations.BulkMode.UNORDERED, Commitment.class);
            for (SectionSortOrderUpdate update : updates) {
                bulk.updateOne(new Query(where("_id").is(update.id())),
                        new Update().set("sortOrder", update.sortOrder()).set("section", update.section()));
            }
            return bulk.execute();
        });
    }

    static Query toMongoQuery(CommitmentQuery query) {
        Criteria criteria = new Criteria();
        if (query.getOwnerId() != null) {
            criteria.and("ownerId").is(query.getOwnerId());
        }
        if (query.getTimeframe() != null) {
            criteria.and("timeframe").is(query.getTimeframe());
        }
        if (query.getSection() != null) {
            criteria.and("section").is(query.getSection());
        }
        if (query.getTaskId() != null) {
            criteria.and("taskId").is(query.getTaskId());
        }
        if (query.getParentCommitmentId() != null) {
            criteria.and("parentCommitmentId").is(query.getParentCommitmentId());
        }
        if (query.getAnchorFrom() != null || query.getAnchorUntil() != null) {
            Criteria anchor = criteria.and("periodAnchorDate");
            if (query.getAnchorFrom() != null) {
                anchor.gte(query.getAnchorFrom());
            }
            if (query.getAnchorUntil() != null) {
                anchor.lt(query.getAnchorUntil());
            }
        }
        if (query.getScheduledFrom() != null || query.getScheduledUntil() != null) {
            Criteria scheduled = criteria.and("scheduledTime");
            if (query.getScheduledFrom() != null) {
                scheduled.gte(query.getScheduledFrom());
            }
            if (query.getScheduledUntil() != null) {
                scheduled.lt(query.getScheduledUntil());
            }
        }
        return new Query(criteria).with(Sort.by(Sort.Direction.ASC, "sortOrder"));
    }

    private <T> T call(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            log.error("Commitment store failed to {}: {}", operation, e.getMessage(), e);
            throw new StoreFailureException("Failed to " + operation, e);
        }
    }
}
